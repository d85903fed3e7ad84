package org.portal.chooser.swing;

import org.junit.jupiter.api.Test;
import org.portal.chooser.ChooserSession;
import org.portal.chooser.InteractionMapper;
import org.portal.chooser.PresentationException;
import org.portal.chooser.dto.OpenFileOptions;
import org.portal.chooser.dto.SaveFilesOptions;
import org.springframework.context.support.StaticMessageSource;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 测试以 headless 模式运行（见 surefire 配置），这里只覆盖无图形环境下的行为。
 */
class SwingChooserPresenterTest {

    @Test
    void present_headlessClosesSessionImmediately() {
        SwingChooserPresenter presenter = new SwingChooserPresenter(new StaticMessageSource());

        ChooserSession session = presenter.present(InteractionMapper.forOpenFile("app", "", "Open", null));

        assertThat(session.outcome()).isCompletedExceptionally();
        assertThatThrownBy(() -> session.outcome().join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(PresentationException.class)
                .extracting(e -> ((PresentationException) e.getCause()).reason())
                .isEqualTo(PresentationException.Reason.CLOSED);
    }

    @Test
    void acceptLabel_saveFilesFolderPickerDefaultsToSave() {
        SwingChooserPresenter presenter = new SwingChooserPresenter(labels());

        String label = presenter.acceptLabel(InteractionMapper.forSaveFiles("app", "", "Save all",
                new SaveFilesOptions(null, null, null, null, List.of())));

        assertThat(label).isEqualTo("Save");
    }

    @Test
    void acceptLabel_openFolderPickerDefaultsToOpen() {
        SwingChooserPresenter presenter = new SwingChooserPresenter(labels());
        OpenFileOptions directory = new OpenFileOptions(null, null, null, true, null, null, null, null);

        assertThat(presenter.acceptLabel(InteractionMapper.forOpenFile("app", "", "Open", directory)))
                .isEqualTo("Open");
    }

    @Test
    void acceptLabel_explicitLabelWins() {
        SwingChooserPresenter presenter = new SwingChooserPresenter(labels());
        OpenFileOptions options = new OpenFileOptions("Import", null, null, null, null, null, null, null);

        assertThat(presenter.acceptLabel(InteractionMapper.forOpenFile("app", "", "Open", options)))
                .isEqualTo("Import");
    }

    private static StaticMessageSource labels() {
        StaticMessageSource messages = new StaticMessageSource();
        messages.addMessage("chooser.accept.open", Locale.getDefault(), "Open");
        messages.addMessage("chooser.accept.save", Locale.getDefault(), "Save");
        return messages;
    }
}
