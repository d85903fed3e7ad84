package org.portal.chooser;

import java.util.concurrent.CompletableFuture;

/**
 * 一次正在展示的选择会话。
 */
public interface ChooserSession {

    /**
     * 用户确认后完成；对话框无法启动或被用户取消时以 {@link PresentationException} 异常结束。
     */
    CompletableFuture<InteractionOutcome> outcome();

    /**
     * 请求方已取消：尽力收起对话框。只是通知，不等待结果；会话已结束时应为空操作。
     */
    void notifyCancel();
}
