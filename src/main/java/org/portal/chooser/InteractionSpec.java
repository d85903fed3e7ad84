package org.portal.chooser;

import java.util.List;

/**
 * 一次选择会话的完整描述，交给展示层之后不再修改。
 *
 * @param title           对话框标题
 * @param mode            工作模式
 * @param save            是否为保存类请求（SaveFiles 虽然是选目录，也算保存，影响默认按钮文本）
 * @param multiple        是否允许多选
 * @param modal           是否模态
 * @param acceptLabel     可选：确认按钮文本（为空时由展示层决定）
 * @param filters         有序过滤器列表（可能为空，不为 null）
 * @param currentFilter   可选：默认选中的过滤器
 * @param currentName     可选：保存时建议的文件名
 * @param currentFolder   可选：初始目录
 * @param currentFilename 可选：保存时预选的已有文件
 * @param choices         可选：附加选项；{@code null} 表示调用方没有传 choices（与空列表含义不同）
 * @param appId           发起请求的应用 id
 * @param parentWindow    父窗口标识（例如 {@code wayland:xxxx}）
 */
public record InteractionSpec(
        String title,
        InteractionMode mode,
        boolean save,
        boolean multiple,
        boolean modal,
        String acceptLabel,
        List<Filter> filters,
        Filter currentFilter,
        String currentName,
        String currentFolder,
        String currentFilename,
        List<Choice> choices,
        String appId,
        String parentWindow
) {

    public InteractionSpec {
        filters = (filters == null) ? List.of() : List.copyOf(filters);
        choices = (choices == null) ? null : List.copyOf(choices);
    }

    public boolean hasChoices() {
        return choices != null;
    }
}
