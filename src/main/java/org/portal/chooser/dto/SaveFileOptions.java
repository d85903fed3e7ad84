package org.portal.chooser.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.portal.chooser.FilePathBytes;

import java.util.List;

/**
 * {@code file_chooser_save_file} 的可选参数（不支持 directory 模式）。
 *
 * @param acceptLabel     确认按钮文本
 * @param modal           是否模态（默认 true）
 * @param multiple        是否多选（默认 false）
 * @param filters         过滤器列表
 * @param currentFilter   默认过滤器
 * @param choices         附加选项
 * @param currentName     建议的文件名
 * @param currentFolder   初始目录（NUL 结尾字节）
 * @param currentFilename 预选的已有文件（NUL 结尾字节）
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SaveFileOptions(
        @JsonProperty("accept_label") String acceptLabel,
        @JsonProperty("modal") Boolean modal,
        @JsonProperty("multiple") Boolean multiple,
        @JsonProperty("filters") List<WireFilter> filters,
        @JsonProperty("current_filter") WireFilter currentFilter,
        @JsonProperty("choices") List<WireChoice> choices,
        @JsonProperty("current_name") String currentName,
        @JsonProperty("current_folder") FilePathBytes currentFolder,
        @JsonProperty("current_filename") FilePathBytes currentFilename
) {

    public static SaveFileOptions defaults() {
        return new SaveFileOptions(null, null, null, null, null, null, null, null, null);
    }
}
