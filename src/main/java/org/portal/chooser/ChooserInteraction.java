package org.portal.chooser;

import org.portal.request.InteractionTask;
import org.portal.request.PortalResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 一次门户方法调用对应的交互任务：构造会话描述 -> 展示 -> 映射结果。
 * <p>
 * 任意一步出现错误（参数映射、校验、展示层拒绝、结果映射，以及缺字段等非法线上参数）都会记录
 * {@code "<方法名> failed: ..."} 日志并转换为 cancelled 响应，不会让 future 异常结束。
 *
 * @param <T> 结果类型
 */
class ChooserInteraction<T> implements InteractionTask<T> {

    private static final Logger log = LoggerFactory.getLogger(ChooserInteraction.class);

    private final String method;
    private final ChooserPresenter presenter;
    private final Supplier<InteractionSpec> specFactory;
    private final Function<InteractionOutcome, T> resultMapper;
    private final Supplier<T> emptyResults;

    private volatile ChooserSession session;

    ChooserInteraction(
            String method,
            ChooserPresenter presenter,
            Supplier<InteractionSpec> specFactory,
            Function<InteractionOutcome, T> resultMapper,
            Supplier<T> emptyResults
    ) {
        this.method = method;
        this.presenter = presenter;
        this.specFactory = specFactory;
        this.resultMapper = resultMapper;
        this.emptyResults = emptyResults;
    }

    @Override
    public CompletableFuture<PortalResponse<T>> start() {
        ChooserSession started;
        try {
            InteractionSpec spec = specFactory.get();
            started = presenter.present(spec);
        } catch (RuntimeException e) {
            // 包括缺字段的线上参数引发的 NullPointerException 等
            return CompletableFuture.completedFuture(fail(e));
        }
        session = started;
        return started.outcome().handle((outcome, error) -> {
            if (error != null) {
                return fail(unwrap(error));
            }
            try {
                return PortalResponse.success(resultMapper.apply(outcome));
            } catch (RuntimeException e) {
                return fail(e);
            }
        });
    }

    @Override
    public void abandon() {
        ChooserSession current = session;
        if (current != null) {
            current.notifyCancel();
        }
    }

    private PortalResponse<T> fail(Throwable error) {
        if (error instanceof PortalRequestException || error instanceof PresentationException) {
            log.error("{} failed: {}", method, error.getMessage());
        } else {
            log.error("{} failed: {}", method, error.toString(), error);
        }
        return PortalResponse.cancelled(emptyResults.get());
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
