package org.portal.chooser;

import java.util.List;

/**
 * 展示层在用户确认后产生的结果（每次成功的会话只产生一次）。
 *
 * @param uris          选中的 URI（有序，可能为空）
 * @param currentFilter 可选：确认时生效的过滤器
 * @param finalChoices  可选：附加选项的最终取值；仅当会话带有 choices 时存在
 * @param writable      是否以可写方式打开
 */
public record InteractionOutcome(
        List<String> uris,
        Filter currentFilter,
        List<FinalChoiceSelection> finalChoices,
        boolean writable
) {

    public InteractionOutcome {
        uris = (uris == null) ? List.of() : List.copyOf(uris);
        finalChoices = (finalChoices == null) ? null : List.copyOf(finalChoices);
    }
}
