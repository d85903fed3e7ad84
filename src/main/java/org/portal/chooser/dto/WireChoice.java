package org.portal.chooser.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 附加选项的线上表示：{@code (id, label, [(variantId, variantLabel)], default)}。
 *
 * @param id             选项 id
 * @param label          展示文本
 * @param variants       候选值；为空表示布尔选项
 * @param defaultVariant 默认候选值 id
 */
public record WireChoice(
        String id,
        String label,
        List<WireChoiceVariant> variants,
        @JsonProperty("default") String defaultVariant
) {
}
