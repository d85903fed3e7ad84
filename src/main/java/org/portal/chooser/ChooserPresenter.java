package org.portal.chooser;

/**
 * 展示层契约：把一次 {@link InteractionSpec} 展示给用户。
 * <p>
 * 实现必须立即返回，不能阻塞调用线程；结果通过 {@link ChooserSession#outcome()} 异步给出。
 */
@FunctionalInterface
public interface ChooserPresenter {

    ChooserSession present(InteractionSpec spec);
}
