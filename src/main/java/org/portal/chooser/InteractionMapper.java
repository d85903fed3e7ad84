package org.portal.chooser;

import org.portal.chooser.dto.OpenFileOptions;
import org.portal.chooser.dto.OpenFileResults;
import org.portal.chooser.dto.SaveFileOptions;
import org.portal.chooser.dto.SaveFileResults;
import org.portal.chooser.dto.SaveFilesOptions;
import org.portal.chooser.dto.SaveFilesResults;
import org.portal.chooser.dto.WireChoice;
import org.portal.chooser.dto.WireChoiceSelection;
import org.portal.chooser.dto.WireChoiceVariant;
import org.portal.chooser.dto.WireFilter;
import org.portal.chooser.dto.WireFilterRule;

import java.util.ArrayList;
import java.util.List;

/**
 * 线上参数与内部会话描述之间的转换（纯函数，不做任何 IO）。
 * <p>
 * 正向：options -> {@link InteractionSpec}；反向：{@link InteractionOutcome} -> results。
 * <ul>
 *   <li>未知的过滤规则类型会被静默丢弃（向前兼容），不会报错。</li>
 *   <li>反向转换时，缺失的可选字段保持 {@code null}（JSON 中不出现），不会变成空集合。</li>
 * </ul>
 */
public final class InteractionMapper {

    private InteractionMapper() {
    }

    public static InteractionSpec forOpenFile(String appId, String parentWindow, String title, OpenFileOptions options) {
        OpenFileOptions o = (options == null) ? OpenFileOptions.defaults() : options;
        return new InteractionSpec(
                title,
                InteractionMode.of(Boolean.TRUE.equals(o.directory()), false),
                false,
                Boolean.TRUE.equals(o.multiple()),
                o.modal() == null || o.modal(),
                o.acceptLabel(),
                toFilters(o.filters()),
                toFilter(o.currentFilter()),
                null,
                decodePath(o.currentFolder()),
                null,
                toChoices(o.choices()),
                appId,
                parentWindow
        );
    }

    public static InteractionSpec forSaveFile(String appId, String parentWindow, String title, SaveFileOptions options) {
        SaveFileOptions o = (options == null) ? SaveFileOptions.defaults() : options;
        return new InteractionSpec(
                title,
                InteractionMode.SAVE,
                true,
                Boolean.TRUE.equals(o.multiple()),
                o.modal() == null || o.modal(),
                o.acceptLabel(),
                toFilters(o.filters()),
                toFilter(o.currentFilter()),
                o.currentName(),
                decodePath(o.currentFolder()),
                decodePath(o.currentFilename()),
                toChoices(o.choices()),
                appId,
                parentWindow
        );
    }

    /**
     * SaveFiles 只让用户选一个目标目录：固定为单选、选目录模式，且不带过滤器。
     */
    public static InteractionSpec forSaveFiles(String appId, String parentWindow, String title, SaveFilesOptions options) {
        return new InteractionSpec(
                title,
                InteractionMode.of(true, true),
                true,
                false,
                options.modal() == null || options.modal(),
                options.acceptLabel(),
                List.of(),
                null,
                null,
                decodePath(options.currentFolder()),
                null,
                toChoices(options.choices()),
                appId,
                parentWindow
        );
    }

    public static OpenFileResults toOpenFileResults(InteractionOutcome outcome) {
        return new OpenFileResults(
                outcome.uris(),
                toWireSelections(outcome.finalChoices()),
                toWireFilter(outcome.currentFilter()),
                outcome.writable()
        );
    }

    public static SaveFileResults toSaveFileResults(InteractionOutcome outcome) {
        return new SaveFileResults(
                outcome.uris(),
                toWireSelections(outcome.finalChoices()),
                toWireFilter(outcome.currentFilter())
        );
    }

    public static SaveFilesResults toSaveFilesResults(List<String> uniqueUris, InteractionOutcome outcome) {
        return new SaveFilesResults(uniqueUris, toWireSelections(outcome.finalChoices()));
    }

    /**
     * 解码可选路径参数；参数缺失时返回 {@code null}。
     *
     * @throws PortalRequestException {@link PortalError#MALFORMED_PATH}
     */
    public static String decodePath(FilePathBytes path) {
        return (path == null) ? null : path.decode();
    }

    public static List<String> decodePaths(List<FilePathBytes> paths) {
        List<String> result = new ArrayList<>(paths.size());
        for (FilePathBytes path : paths) {
            result.add(path.decode());
        }
        return result;
    }

    public static List<Filter> toFilters(List<WireFilter> filters) {
        if (filters == null) {
            return List.of();
        }
        List<Filter> result = new ArrayList<>(filters.size());
        for (WireFilter filter : filters) {
            result.add(toFilter(filter));
        }
        return result;
    }

    public static Filter toFilter(WireFilter filter) {
        if (filter == null) {
            return null;
        }
        List<FilterRule> rules = new ArrayList<>();
        if (filter.rules() != null) {
            for (WireFilterRule rule : filter.rules()) {
                FilterRule.Kind kind = FilterRule.Kind.fromCode(rule.kind());
                if (kind != null) {
                    rules.add(new FilterRule(kind, rule.value()));
                }
            }
        }
        return new Filter(filter.name(), rules);
    }

    public static WireFilter toWireFilter(Filter filter) {
        if (filter == null) {
            return null;
        }
        List<WireFilterRule> rules = new ArrayList<>(filter.rules().size());
        for (FilterRule rule : filter.rules()) {
            rules.add(new WireFilterRule(rule.kind().code(), rule.value()));
        }
        return new WireFilter(filter.name(), rules);
    }

    public static List<Choice> toChoices(List<WireChoice> choices) {
        if (choices == null) {
            return null;
        }
        List<Choice> result = new ArrayList<>(choices.size());
        for (WireChoice choice : choices) {
            result.add(toChoice(choice));
        }
        return result;
    }

    public static Choice toChoice(WireChoice choice) {
        List<ChoiceVariant> variants = new ArrayList<>();
        if (choice.variants() != null) {
            for (WireChoiceVariant variant : choice.variants()) {
                variants.add(new ChoiceVariant(variant.id(), variant.label()));
            }
        }
        return new Choice(choice.id(), choice.label(), choice.defaultVariant(), variants);
    }

    public static List<WireChoiceSelection> toWireSelections(List<FinalChoiceSelection> selections) {
        if (selections == null) {
            return null;
        }
        List<WireChoiceSelection> result = new ArrayList<>(selections.size());
        for (FinalChoiceSelection selection : selections) {
            result.add(new WireChoiceSelection(selection.id(), selection.variantId()));
        }
        return result;
    }
}
