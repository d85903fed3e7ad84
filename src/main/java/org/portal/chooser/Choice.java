package org.portal.chooser;

import java.util.List;

/**
 * 随选择对话框一起展示的附加选项（例如“编码”下拉框）。
 * <p>
 * 没有候选值的 Choice 是布尔选项，取值为 {@code "true"} / {@code "false"}。
 *
 * @param id             选项 id
 * @param label          展示文本
 * @param defaultVariant 默认选中的候选值 id
 * @param variants       有序候选值列表
 */
public record Choice(String id, String label, String defaultVariant, List<ChoiceVariant> variants) {

    public static final String BOOLEAN_TRUE = "true";
    public static final String BOOLEAN_FALSE = "false";

    public Choice {
        variants = (variants == null) ? List.of() : List.copyOf(variants);
    }

    public boolean isBoolean() {
        return variants.isEmpty();
    }
}
