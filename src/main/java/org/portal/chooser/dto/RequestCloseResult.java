package org.portal.chooser.dto;

/**
 * {@code request_close} 的结果。
 *
 * @param handle 请求句柄
 * @param closed 是否确实通知到了一个已注册的请求（false 表示请求不存在、已结束或尚未注册）
 */
public record RequestCloseResult(String handle, boolean closed) {
}
