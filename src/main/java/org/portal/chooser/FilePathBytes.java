package org.portal.chooser;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 线上传输的路径：以 NUL 结尾的字节序列。
 * <p>
 * 反序列化时只保存原始字节，不做校验；必须显式调用 {@link #decode()} 才能得到字符串：
 * <ul>
 *   <li>最后一个字节不是 NUL，或 NUL 出现在中间，视为 {@link PortalError#MALFORMED_PATH}。</li>
 *   <li>去掉结尾 NUL 后按 UTF-8 解码，非法字节序列替换为 U+FFFD，不报错。</li>
 * </ul>
 * JSON 中可以是数字数组，也可以是 base64 字符串（Jackson 对 {@code byte[]} 的两种默认表示）。
 */
public final class FilePathBytes {

    private final byte[] bytes;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public FilePathBytes(byte[] bytes) {
        this.bytes = (bytes == null) ? new byte[0] : bytes.clone();
    }

    /**
     * 把字符串编码为线上格式（UTF-8 + 结尾 NUL）。
     */
    public static FilePathBytes of(String path) {
        byte[] utf8 = path.getBytes(StandardCharsets.UTF_8);
        return new FilePathBytes(Arrays.copyOf(utf8, utf8.length + 1));
    }

    @JsonValue
    public byte[] bytes() {
        return bytes.clone();
    }

    public String decode() {
        if (bytes.length == 0 || bytes[bytes.length - 1] != 0) {
            throw new PortalRequestException(PortalError.MALFORMED_PATH, "缺少结尾 NUL");
        }
        for (int i = 0; i < bytes.length - 1; i++) {
            if (bytes[i] == 0) {
                throw new PortalRequestException(PortalError.MALFORMED_PATH, "第 " + i + " 个字节是 NUL");
            }
        }
        // new String(...) 对非法 UTF-8 序列默认使用替换字符
        return new String(bytes, 0, bytes.length - 1, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof FilePathBytes other && Arrays.equals(bytes, other.bytes));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "FilePathBytes" + Arrays.toString(bytes);
    }
}
