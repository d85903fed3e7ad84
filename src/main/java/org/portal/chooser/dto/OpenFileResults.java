package org.portal.chooser.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * {@code file_chooser_open_file} 的结果。未设置的字段不会出现在 JSON 中。
 *
 * @param uris          选中的 URI
 * @param choices       附加选项的最终取值
 * @param currentFilter 确认时生效的过滤器
 * @param writable      是否以可写方式打开
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OpenFileResults(
        @JsonProperty("uris") List<String> uris,
        @JsonProperty("choices") List<WireChoiceSelection> choices,
        @JsonProperty("current_filter") WireFilter currentFilter,
        @JsonProperty("writable") Boolean writable
) {

    public static OpenFileResults empty() {
        return new OpenFileResults(null, null, null, null);
    }
}
