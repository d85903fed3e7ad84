package org.portal.chooser;

/**
 * 请求在映射/校验阶段可能出现的错误类型。
 * <p>
 * 这些错误都会在本地恢复为 {@code cancelled} 响应并记录日志，不会作为调用失败抛给客户端。
 */
public enum PortalError {
    ABSOLUTE_PATH("客户端尝试保存绝对路径"),
    MULTIPLE_COMPONENTS("客户端尝试保存包含多级目录的路径"),
    SPECIAL_PATH("客户端尝试保存 `.`、`..` 或空文件名"),
    NOT_EXACTLY_ONE_PATH("用户没有恰好选择一个目录"),
    SELECTED_NOT_VALID_URI("选中的路径不是合法的 URI"),
    SELECTED_NOT_VALID_PATH("选中的 URI 不是本地文件路径"),
    UNIQUE_URI_ENCODING_FAILURE("计算出的唯一路径无法转换为 URI"),
    MALFORMED_PATH("路径字节不是以 NUL 结尾的字符串");

    private final String description;

    PortalError(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
