package org.portal.instance;

/**
 * 无法成为门户名称的唯一持有者。
 */
public class PortalInstanceLockException extends Exception {

    public PortalInstanceLockException(String message) {
        super(message);
    }

    public PortalInstanceLockException(String message, Throwable cause) {
        super(message, cause);
    }
}
