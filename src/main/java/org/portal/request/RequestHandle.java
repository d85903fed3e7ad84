package org.portal.request;

import java.util.concurrent.CompletableFuture;

/**
 * 一个进行中请求的取消端点：客户端给出的 token + 只触发一次的关闭信号。
 */
public final class RequestHandle {

    private final String token;
    private final CompletableFuture<Void> closeSignal = new CompletableFuture<>();

    public RequestHandle(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    /**
     * 触发关闭信号。幂等：只有第一次调用返回 true，之后的调用都是空操作。
     */
    public boolean close() {
        return closeSignal.complete(null);
    }

    public boolean isClosed() {
        return closeSignal.isDone();
    }

    CompletableFuture<Void> closeSignal() {
        return closeSignal;
    }
}
