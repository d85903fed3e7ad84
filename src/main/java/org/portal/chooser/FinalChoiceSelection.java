package org.portal.chooser;

/**
 * 用户确认时某个附加选项的最终取值。
 *
 * @param id        选项 id
 * @param variantId 选中的候选值 id
 */
public record FinalChoiceSelection(String id, String variantId) {
}
