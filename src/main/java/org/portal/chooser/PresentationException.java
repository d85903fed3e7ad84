package org.portal.chooser;

/**
 * 展示层无法给出结果：对话框没能启动，或者用户取消/关闭了对话框。
 */
public class PresentationException extends RuntimeException {

    private final Reason reason;

    public PresentationException(Reason reason) {
        super(reason.description);
        this.reason = reason;
    }

    public PresentationException(Reason reason, Throwable cause) {
        super(reason.description, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    public enum Reason {
        CLOSED("对话框无法启动"),
        REJECTED("用户取消了操作");

        private final String description;

        Reason(String description) {
            this.description = description;
        }
    }
}
