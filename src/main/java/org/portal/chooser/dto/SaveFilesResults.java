package org.portal.chooser.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * {@code file_chooser_save_files} 的结果。
 *
 * @param uris    去重后的目标 URI，与请求中的 files 一一对应、顺序一致
 * @param choices 附加选项的最终取值
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SaveFilesResults(
        @JsonProperty("uris") List<String> uris,
        @JsonProperty("choices") List<WireChoiceSelection> choices
) {

    public static SaveFilesResults empty() {
        return new SaveFilesResults(null, null);
    }
}
