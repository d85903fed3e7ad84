package org.portal.request;

/**
 * 取消端点无法注册（token 非法或已被占用）。
 */
public class RequestExportException extends Exception {

    public RequestExportException(String message) {
        super(message);
    }
}
