package org.portal.chooser;

import java.io.IOError;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * SaveFiles 的文件名校验与去重：把客户端给出的一批相对文件名，落到用户选择的目录下，并保证不会覆盖已有文件。
 * <p>
 * 流程：
 * <ol>
 *   <li>{@link #validate(List)}：在弹出对话框之前对整批文件名做校验，任意一个不合法则整个请求失败。</li>
 *   <li>{@link #resolveDirectory(List)}：用户选择目录后，要求恰好一个 URI，且能转换为本地路径。</li>
 *   <li>{@link #uniquify(Path, List)}：逐个文件名（按输入顺序）计算不冲突的目标路径，并转换回 URI。</li>
 * </ol>
 * <p>
 * 注意：存在性检查与后续真正创建文件之间没有加锁（TOCTOU）。这里只负责“起名字”，真正写文件的是客户端。
 */
public class SaveSetResolver {

    private final PathExistence existence;

    public SaveSetResolver(PathExistence existence) {
        this.existence = Objects.requireNonNull(existence, "existence 不能为空");
    }

    /**
     * 校验整批文件名：只允许单级、非特殊的相对文件名。
     *
     * @throws PortalRequestException 第一个不合法的文件名对应的错误
     */
    public void validate(List<String> filenames) {
        for (String filename : filenames) {
            validateOne(filename);
        }
    }

    private static void validateOne(String filename) {
        if (filename.isEmpty() || ".".equals(filename) || "..".equals(filename)) {
            throw new PortalRequestException(PortalError.SPECIAL_PATH, "'" + filename + "'");
        }
        Path path;
        try {
            path = Path.of(filename);
        } catch (InvalidPathException e) {
            throw new PortalRequestException(PortalError.MULTIPLE_COMPONENTS, filename, e);
        }
        if (path.isAbsolute() || path.getRoot() != null) {
            throw new PortalRequestException(PortalError.ABSOLUTE_PATH, filename);
        }
        // "a/" 规范化后只有一级；"./a"、"a/b" 都是两级
        if (path.getNameCount() > 1) {
            throw new PortalRequestException(PortalError.MULTIPLE_COMPONENTS, filename);
        }
    }

    /**
     * 从选择目录的结果中取出目标目录。
     *
     * @param uris 展示层返回的 URI 列表
     * @return 目标目录的本地路径
     */
    public Path resolveDirectory(List<String> uris) {
        if (uris.size() != 1) {
            throw new PortalRequestException(PortalError.NOT_EXACTLY_ONE_PATH, "选中了 " + uris.size() + " 个");
        }
        String selected = uris.get(0);
        URI uri;
        try {
            uri = new URI(selected);
        } catch (URISyntaxException e) {
            throw new PortalRequestException(PortalError.SELECTED_NOT_VALID_URI, selected, e);
        }
        // 没有 scheme 的相对引用不是完整的 URI
        if (!uri.isAbsolute()) {
            throw new PortalRequestException(PortalError.SELECTED_NOT_VALID_URI, selected);
        }
        try {
            return Path.of(uri);
        } catch (IllegalArgumentException | FileSystemNotFoundException | SecurityException e) {
            throw new PortalRequestException(PortalError.SELECTED_NOT_VALID_PATH, selected, e);
        }
    }

    /**
     * 为每个文件名计算目录下不冲突的目标 URI。
     * <p>
     * 规则：目标不存在则直接使用；已存在时在第一个 {@code .} 处拆成 stem/suffix，
     * 依次尝试 {@code "stem (1).suffix"}、{@code "stem (2).suffix"} ……（没有 {@code .} 时为 {@code "stem (i)"}）。
     *
     * @return 与输入等长、顺序一致的 URI 列表
     */
    public List<String> uniquify(Path directory, List<String> filenames) {
        List<String> uris = new ArrayList<>(filenames.size());
        for (String filename : filenames) {
            uris.add(toUri(uniquePath(directory, filename)));
        }
        return uris;
    }

    /**
     * 校验通过后的完整流程：选择结果 -> 目录 -> 去重后的 URI。
     */
    public List<String> resolve(List<String> selectedUris, List<String> filenames) {
        return uniquify(resolveDirectory(selectedUris), filenames);
    }

    Path uniquePath(Path directory, String filename) {
        Path candidate = directory.resolve(filename);
        if (!existence.exists(candidate)) {
            return candidate;
        }
        int dot = filename.indexOf('.');
        String stem = (dot < 0) ? filename : filename.substring(0, dot);
        String suffix = (dot < 0) ? "" : filename.substring(dot);
        for (long i = 1; ; i++) {
            candidate = directory.resolve(stem + " (" + i + ")" + suffix);
            if (!existence.exists(candidate)) {
                return candidate;
            }
        }
    }

    private static String toUri(Path path) {
        if (!path.isAbsolute()) {
            throw new PortalRequestException(PortalError.UNIQUE_URI_ENCODING_FAILURE, path.toString());
        }
        try {
            return path.toUri().toString();
        } catch (IOError | SecurityException e) {
            throw new PortalRequestException(PortalError.UNIQUE_URI_ENCODING_FAILURE, path.toString(), e);
        }
    }
}
