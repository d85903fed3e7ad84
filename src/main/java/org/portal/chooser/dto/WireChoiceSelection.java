package org.portal.chooser.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 附加选项最终取值的线上表示：{@code (id, variant_id)}。
 */
public record WireChoiceSelection(String id, @JsonProperty("variant_id") String variantId) {
}
