package org.portal.chooser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.portal.chooser.dto.OpenFileOptions;
import org.portal.chooser.dto.OpenFileResults;
import org.portal.chooser.dto.SaveFileOptions;
import org.portal.chooser.dto.SaveFileResults;
import org.portal.chooser.dto.SaveFilesOptions;
import org.portal.chooser.dto.SaveFilesResults;
import org.portal.chooser.dto.WireFilter;
import org.portal.chooser.dto.WireFilterRule;
import org.portal.chooser.dto.WireChoiceSelection;
import org.portal.request.PortalResponse;
import org.portal.request.RequestHandleRegistry;
import org.portal.request.RequestLifecycleManager;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class FileChooserPortalTest {

    @TempDir
    Path dir;

    private final RequestHandleRegistry registry = new RequestHandleRegistry();
    private final ScriptedChooserPresenter presenter = new ScriptedChooserPresenter();
    private final FileChooserPortal portal = new FileChooserPortal(
            new RequestLifecycleManager(registry), presenter, new SaveSetResolver(PathExistence.FILESYSTEM));

    @Test
    void openFile_returnsSelectedUris() throws Exception {
        CompletableFuture<PortalResponse<OpenFileResults>> reply = CompletableFuture.supplyAsync(
                () -> portal.openFile("/r/open1", "app", "", "Open", OpenFileOptions.defaults()));

        ScriptedChooserPresenter.Session session = presenter.awaitSession();
        session.accept(new InteractionOutcome(List.of("file:///tmp/a.txt"), null, null, false));

        PortalResponse<OpenFileResults> response = reply.get(5, TimeUnit.SECONDS);
        assertThat(response.isSuccess()).isTrue();
        assertThat(response.results().uris()).containsExactly("file:///tmp/a.txt");
        assertThat(response.results().writable()).isFalse();
        assertThat(presenter.presented().get(0).mode()).isEqualTo(InteractionMode.OPEN);
        assertThat(registry.size()).isZero();
    }

    @Test
    void openFile_closeDismissesDialogAndCancels() throws Exception {
        CompletableFuture<PortalResponse<OpenFileResults>> reply = CompletableFuture.supplyAsync(
                () -> portal.openFile("/r/open2", "app", "", "Open", null));
        ScriptedChooserPresenter.Session session = presenter.awaitSession();
        awaitExported("/r/open2");

        assertThat(registry.close("/r/open2")).isTrue();

        PortalResponse<OpenFileResults> response = reply.get(5, TimeUnit.SECONDS);
        assertThat(response).isEqualTo(PortalResponse.cancelled(OpenFileResults.empty()));
        assertThat(session.cancelNotifications()).isEqualTo(1);

        // 对话框随后仍然返回了结果，也不会产生第二个响应
        session.accept(new InteractionOutcome(List.of("file:///tmp/late"), null, null, false));
        assertThat(reply.get()).isSameAs(response);
    }

    @Test
    void saveFile_dismissedDialogIsCancelled() throws Exception {
        CompletableFuture<PortalResponse<SaveFileResults>> reply = CompletableFuture.supplyAsync(
                () -> portal.saveFile("/r/save1", "app", "", "Save", SaveFileOptions.defaults()));

        presenter.awaitSession().reject();

        PortalResponse<SaveFileResults> response = reply.get(5, TimeUnit.SECONDS);
        assertThat(response.isCancelled()).isTrue();
        assertThat(response.results()).isEqualTo(SaveFileResults.empty());
        assertThat(presenter.presented().get(0).mode()).isEqualTo(InteractionMode.SAVE);
    }

    @Test
    void saveFile_malformedPathCancelsWithoutDialog() {
        SaveFileOptions options = new SaveFileOptions(
                null, null, null, null, null, null, null, new FilePathBytes(new byte[0]), null);

        PortalResponse<SaveFileResults> response = portal.saveFile("/r/save2", "app", "", "Save", options);

        assertThat(response.isCancelled()).isTrue();
        assertThat(presenter.presented()).isEmpty();
    }

    @Test
    void openFile_filterWithoutNameCancelsWithoutDialog() {
        OpenFileOptions options = new OpenFileOptions(null, null, null, null,
                List.of(new WireFilter(null, List.of(new WireFilterRule(0, "*.txt")))), null, null, null);

        PortalResponse<OpenFileResults> response = portal.openFile("/r/open3", "app", "", "Open", options);

        assertThat(response).isEqualTo(PortalResponse.cancelled(OpenFileResults.empty()));
        assertThat(presenter.presented()).isEmpty();
        assertThat(registry.size()).isZero();
    }

    @Test
    void saveFiles_nullFileEntryCancelsWithoutDialog() {
        SaveFilesOptions options = new SaveFilesOptions(null, null, null, null,
                Arrays.asList(FilePathBytes.of("a.txt"), null));

        PortalResponse<SaveFilesResults> response = portal.saveFiles("/r/files5", "app", "", "Save all", options);

        assertThat(response).isEqualTo(PortalResponse.cancelled(SaveFilesResults.empty()));
        assertThat(presenter.presented()).isEmpty();
    }

    @Test
    void saveFiles_uniquifiesAgainstChosenFolder() throws Exception {
        Files.createFile(dir.resolve("report.txt"));
        SaveFilesOptions options = new SaveFilesOptions(null, null, null, null,
                List.of(FilePathBytes.of("report.txt"), FilePathBytes.of("notes")));

        CompletableFuture<PortalResponse<SaveFilesResults>> reply = CompletableFuture.supplyAsync(
                () -> portal.saveFiles("/r/files1", "app", "", "Save all", options));
        presenter.awaitSession().accept(new InteractionOutcome(
                List.of(dir.toUri().toString()), null, List.of(new FinalChoiceSelection("overwrite", "false")), false));

        PortalResponse<SaveFilesResults> response = reply.get(5, TimeUnit.SECONDS);
        assertThat(response.isSuccess()).isTrue();
        assertThat(response.results().uris()).containsExactly(
                dir.resolve("report (1).txt").toUri().toString(),
                dir.resolve("notes").toUri().toString());
        assertThat(response.results().choices()).containsExactly(new WireChoiceSelection("overwrite", "false"));
        assertThat(presenter.presented().get(0).mode()).isEqualTo(InteractionMode.SELECT_FOLDER);
    }

    @Test
    void saveFiles_invalidFilenameCancelsWithoutDialog() {
        SaveFilesOptions options = new SaveFilesOptions(null, null, null, null,
                List.of(FilePathBytes.of("ok.txt"), FilePathBytes.of("/etc/passwd")));

        PortalResponse<SaveFilesResults> response = portal.saveFiles("/r/files2", "app", "", "Save all", options);

        assertThat(response).isEqualTo(PortalResponse.cancelled(SaveFilesResults.empty()));
        assertThat(presenter.presented()).isEmpty();
        assertThat(registry.size()).isZero();
    }

    @Test
    void saveFiles_multipleSelectedFoldersCancel() throws Exception {
        SaveFilesOptions options = new SaveFilesOptions(null, null, null, null, List.of(FilePathBytes.of("a.txt")));

        CompletableFuture<PortalResponse<SaveFilesResults>> reply = CompletableFuture.supplyAsync(
                () -> portal.saveFiles("/r/files3", "app", "", "Save all", options));
        presenter.awaitSession().accept(new InteractionOutcome(
                List.of(dir.toUri().toString(), dir.resolve("sub").toUri().toString()), null, null, false));

        assertThat(reply.get(5, TimeUnit.SECONDS).isCancelled()).isTrue();
    }

    @Test
    void saveFiles_nonFileUriCancels() throws Exception {
        SaveFilesOptions options = new SaveFilesOptions(null, null, null, null, List.of(FilePathBytes.of("a.txt")));

        CompletableFuture<PortalResponse<SaveFilesResults>> reply = CompletableFuture.supplyAsync(
                () -> portal.saveFiles("/r/files4", "app", "", "Save all", options));
        presenter.awaitSession().accept(new InteractionOutcome(List.of("https://example.org/dir"), null, null, false));

        assertThat(reply.get(5, TimeUnit.SECONDS)).isEqualTo(PortalResponse.cancelled(SaveFilesResults.empty()));
    }

    @Test
    void saveFiles_missingFolderIsFine() {
        // 目录不存在时所有名字都不冲突
        Path missing = dir.resolve("missing");
        SaveSetResolver resolver = new SaveSetResolver(PathExistence.FILESYSTEM);

        assertThat(resolver.resolve(List.of(missing.toUri().toString()), List.of("a.txt")))
                .containsExactly(missing.resolve("a.txt").toUri().toString());
    }

    private void awaitExported(String token) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!registry.isExported(token)) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("请求 " + token + " 没有完成注册");
            }
            Thread.sleep(10);
        }
    }
}
