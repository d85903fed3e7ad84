package org.portal.chooser;

import org.portal.chooser.dto.OpenFileOptions;
import org.portal.chooser.dto.OpenFileResults;
import org.portal.chooser.dto.SaveFileOptions;
import org.portal.chooser.dto.SaveFileResults;
import org.portal.chooser.dto.SaveFilesOptions;
import org.portal.chooser.dto.SaveFilesResults;
import org.portal.request.PortalResponse;
import org.portal.request.RequestLifecycleManager;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 文件选择门户的三个对外方法：OpenFile / SaveFile / SaveFiles。
 * <p>
 * 每次调用：映射参数 -> （SaveFiles 额外校验文件名）-> 交给生命周期管理器展示 -> 映射结果 -> 包装为响应信封。
 * 领域错误一律转换为 cancelled 响应，不会以异常形式返回给客户端。
 */
public class FileChooserPortal {

    private final RequestLifecycleManager lifecycle;
    private final ChooserPresenter presenter;
    private final SaveSetResolver saveSetResolver;

    public FileChooserPortal(RequestLifecycleManager lifecycle, ChooserPresenter presenter, SaveSetResolver saveSetResolver) {
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle 不能为空");
        this.presenter = Objects.requireNonNull(presenter, "presenter 不能为空");
        this.saveSetResolver = Objects.requireNonNull(saveSetResolver, "saveSetResolver 不能为空");
    }

    public PortalResponse<OpenFileResults> openFile(
            String handle, String appId, String parentWindow, String title, OpenFileOptions options) {
        ChooserInteraction<OpenFileResults> interaction = new ChooserInteraction<>(
                "OpenFile",
                presenter,
                () -> InteractionMapper.forOpenFile(appId, parentWindow, title, options),
                InteractionMapper::toOpenFileResults,
                OpenFileResults::empty
        );
        return lifecycle.handle(handle, interaction, OpenFileResults::empty);
    }

    public PortalResponse<SaveFileResults> saveFile(
            String handle, String appId, String parentWindow, String title, SaveFileOptions options) {
        ChooserInteraction<SaveFileResults> interaction = new ChooserInteraction<>(
                "SaveFile",
                presenter,
                () -> InteractionMapper.forSaveFile(appId, parentWindow, title, options),
                InteractionMapper::toSaveFileResults,
                SaveFileResults::empty
        );
        return lifecycle.handle(handle, interaction, SaveFileResults::empty);
    }

    public PortalResponse<SaveFilesResults> saveFiles(
            String handle, String appId, String parentWindow, String title, SaveFilesOptions options) {
        SaveFilesOptions resolvedOptions = (options == null) ? new SaveFilesOptions(null, null, null, null, null) : options;
        // 文件名在展示之前解码并校验；解码结果留给结果映射阶段使用
        AtomicReference<List<String>> filenames = new AtomicReference<>();
        ChooserInteraction<SaveFilesResults> interaction = new ChooserInteraction<>(
                "SaveFiles",
                presenter,
                () -> {
                    List<String> decoded = InteractionMapper.decodePaths(resolvedOptions.files());
                    saveSetResolver.validate(decoded);
                    filenames.set(decoded);
                    return InteractionMapper.forSaveFiles(appId, parentWindow, title, resolvedOptions);
                },
                outcome -> InteractionMapper.toSaveFilesResults(
                        saveSetResolver.resolve(outcome.uris(), filenames.get()), outcome),
                SaveFilesResults::empty
        );
        return lifecycle.handle(handle, interaction, SaveFilesResults::empty);
    }
}
