package org.portal.chooser;

/**
 * 携带 {@link PortalError} 的请求级异常。
 */
public class PortalRequestException extends RuntimeException {

    private final PortalError error;

    public PortalRequestException(PortalError error) {
        super(error.description());
        this.error = error;
    }

    public PortalRequestException(PortalError error, String detail) {
        super(error.description() + "：" + detail);
        this.error = error;
    }

    public PortalRequestException(PortalError error, String detail, Throwable cause) {
        super(error.description() + "：" + detail, cause);
        this.error = error;
    }

    public PortalError error() {
        return error;
    }
}
