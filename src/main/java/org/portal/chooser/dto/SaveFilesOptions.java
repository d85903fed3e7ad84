package org.portal.chooser.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.portal.chooser.FilePathBytes;

import java.util.List;

/**
 * {@code file_chooser_save_files} 的参数。
 *
 * @param acceptLabel   确认按钮文本
 * @param modal         是否模态（默认 true）
 * @param choices       附加选项
 * @param currentFolder 初始目录（NUL 结尾字节）
 * @param files         待保存的相对文件名（每个都是 NUL 结尾字节，只能是单级文件名）
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SaveFilesOptions(
        @JsonProperty("accept_label") String acceptLabel,
        @JsonProperty("modal") Boolean modal,
        @JsonProperty("choices") List<WireChoice> choices,
        @JsonProperty("current_folder") FilePathBytes currentFolder,
        @JsonProperty("files") List<FilePathBytes> files
) {

    public SaveFilesOptions {
        files = (files == null) ? List.of() : files;
    }
}
