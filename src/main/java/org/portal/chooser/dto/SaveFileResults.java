package org.portal.chooser.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * {@code file_chooser_save_file} 的结果。
 *
 * @param uris          选中的 URI
 * @param choices       附加选项的最终取值
 * @param currentFilter 确认时生效的过滤器
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SaveFileResults(
        @JsonProperty("uris") List<String> uris,
        @JsonProperty("choices") List<WireChoiceSelection> choices,
        @JsonProperty("current_filter") WireFilter currentFilter
) {

    public static SaveFileResults empty() {
        return new SaveFileResults(null, null, null);
    }
}
