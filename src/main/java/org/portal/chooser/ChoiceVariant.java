package org.portal.chooser;

/**
 * 附加选项（{@link Choice}）的一个候选值。
 *
 * @param id    候选值 id
 * @param label 展示文本
 */
public record ChoiceVariant(String id, String label) {
}
