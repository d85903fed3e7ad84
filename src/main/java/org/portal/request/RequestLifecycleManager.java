package org.portal.request;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * 请求生命周期管理：让“交互完成”与“客户端取消”赛跑，并保证每个请求恰好产生一个响应。
 * <p>
 * 状态：Pending（任务已启动）-> Registered（取消端点已按 token 注册）-> Resolved（完成或取消）。
 * <ul>
 *   <li>先完成的一方决定响应；响应是一次性赋值的 future，后到的结果直接丢弃。</li>
 *   <li>取消获胜时只调用 {@link InteractionTask#abandon()} 通知展示层，不强制中断任务。</li>
 *   <li>取消端点注册失败时记录告警，请求照常进行，只是无法被外部取消。</li>
 *   <li>任意方式结束后，移除该请求的注册。</li>
 * </ul>
 * <p>
 * 已知竞态：客户端在注册完成之前发送的 Close() 会丢失，交互会继续直到完成。这里不缓存这类取消。
 */
public class RequestLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(RequestLifecycleManager.class);

    private final RequestHandleRegistry registry;

    public RequestLifecycleManager(RequestHandleRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry 不能为空");
    }

    /**
     * 阻塞直到请求结束。
     *
     * @param token        客户端给出的请求句柄
     * @param task         交互任务
     * @param emptyResults 取消时使用的空结果
     */
    public <T> PortalResponse<T> handle(String token, InteractionTask<T> task, Supplier<T> emptyResults) {
        return run(token, task, emptyResults).join();
    }

    public <T> CompletableFuture<PortalResponse<T>> run(String token, InteractionTask<T> task, Supplier<T> emptyResults) {
        CompletableFuture<PortalResponse<T>> reply = new CompletableFuture<>();

        // 1) Pending：启动交互任务
        start(token, task, emptyResults).whenComplete((response, error) -> {
            if (error != null) {
                log.error("请求 {} 的交互任务异常结束，按取消处理", token, error);
                reply.complete(PortalResponse.cancelled(emptyResults.get()));
            } else {
                reply.complete(response);
            }
        });

        // 2) Registered：导出取消端点；失败时降级为不可取消
        RequestHandle handle = new RequestHandle(token);
        boolean exported = export(handle);
        if (exported) {
            handle.closeSignal().thenRun(() -> {
                if (reply.complete(PortalResponse.cancelled(emptyResults.get()))) {
                    log.info("请求 {} 已被客户端取消", token);
                    abandon(token, task);
                }
            });
            // 3) Resolved：无论哪一方获胜都移除注册（若任务在注册前已完成，这里会立即执行）
            reply.whenComplete((response, error) -> registry.remove(handle));
        }
        return reply;
    }

    private <T> CompletableFuture<PortalResponse<T>> start(String token, InteractionTask<T> task, Supplier<T> emptyResults) {
        try {
            CompletableFuture<PortalResponse<T>> future = task.start();
            if (future == null) {
                throw new IllegalStateException("交互任务没有返回 future");
            }
            return future;
        } catch (RuntimeException e) {
            log.error("请求 {} 的交互任务启动失败，按取消处理", token, e);
            return CompletableFuture.completedFuture(PortalResponse.cancelled(emptyResults.get()));
        }
    }

    private boolean export(RequestHandle handle) {
        try {
            registry.export(handle);
            return true;
        } catch (RequestExportException e) {
            log.warn("无法导出请求对象，该请求将无法被取消：{}", e.getMessage());
            return false;
        }
    }

    private static void abandon(String token, InteractionTask<?> task) {
        try {
            task.abandon();
        } catch (RuntimeException e) {
            log.warn("请求 {} 取消后通知展示层失败", token, e);
        }
    }
}
