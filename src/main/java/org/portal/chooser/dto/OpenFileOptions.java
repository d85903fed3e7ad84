package org.portal.chooser.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.portal.chooser.FilePathBytes;

import java.util.List;

/**
 * {@code file_chooser_open_file} 的可选参数。所有字段都可以省略。
 *
 * @param acceptLabel   确认按钮文本
 * @param modal         是否模态（默认 true）
 * @param multiple      是否多选（默认 false）
 * @param directory     是否选择目录（默认 false）
 * @param filters       过滤器列表
 * @param currentFilter 默认过滤器
 * @param choices       附加选项
 * @param currentFolder 初始目录（NUL 结尾字节）
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OpenFileOptions(
        @JsonProperty("accept_label") String acceptLabel,
        @JsonProperty("modal") Boolean modal,
        @JsonProperty("multiple") Boolean multiple,
        @JsonProperty("directory") Boolean directory,
        @JsonProperty("filters") List<WireFilter> filters,
        @JsonProperty("current_filter") WireFilter currentFilter,
        @JsonProperty("choices") List<WireChoice> choices,
        @JsonProperty("current_folder") FilePathBytes currentFolder
) {

    public static OpenFileOptions defaults() {
        return new OpenFileOptions(null, null, null, null, null, null, null, null);
    }
}
