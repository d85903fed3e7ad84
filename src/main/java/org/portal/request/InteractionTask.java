package org.portal.request;

import java.util.concurrent.CompletableFuture;

/**
 * 交给 {@link RequestLifecycleManager} 的交互任务。
 *
 * @param <T> 结果类型
 */
public interface InteractionTask<T> {

    /**
     * 启动交互，返回最终响应。实现应把领域错误转换为 cancelled 响应，而不是让 future 异常结束。
     */
    CompletableFuture<PortalResponse<T>> start();

    /**
     * 客户端取消且取消先于交互完成时调用：尽力通知展示层收起对话框，不等待、不强制中断。
     */
    default void abandon() {
    }
}
