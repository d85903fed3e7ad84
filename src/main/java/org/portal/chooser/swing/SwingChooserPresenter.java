package org.portal.chooser.swing;

import org.portal.chooser.Choice;
import org.portal.chooser.ChoiceVariant;
import org.portal.chooser.ChooserPresenter;
import org.portal.chooser.ChooserSession;
import org.portal.chooser.Filter;
import org.portal.chooser.FinalChoiceSelection;
import org.portal.chooser.InteractionMode;
import org.portal.chooser.InteractionOutcome;
import org.portal.chooser.InteractionSpec;
import org.portal.chooser.PresentationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.MessageSource;

import javax.swing.BoxLayout;
import javax.swing.JCheckBox;
import javax.swing.JComboBox;
import javax.swing.JComponent;
import javax.swing.JFileChooser;
import javax.swing.JLabel;
import javax.swing.JPanel;
import javax.swing.SwingUtilities;
import javax.swing.filechooser.FileFilter;
import java.awt.GraphicsEnvironment;
import java.io.File;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 基于 Swing {@link JFileChooser} 的默认展示层。
 * <p>
 * 说明：
 * <ul>
 *   <li>对话框在事件分发线程（EDT）上创建与显示，{@link #present(InteractionSpec)} 本身立即返回。</li>
 *   <li>附加选项以附件面板的形式展示：有候选值的用下拉框，布尔选项用复选框。</li>
 *   <li>打开模式额外提供“只读打开”复选框（默认勾选），取消勾选才会返回 writable=true。</li>
 *   <li>无图形环境（headless）时会话直接以 {@link PresentationException.Reason#CLOSED} 结束。</li>
 *   <li>父窗口标识来自其它进程，Swing 无法挂靠，仅记录日志；对话框总是模态显示。</li>
 * </ul>
 */
public class SwingChooserPresenter implements ChooserPresenter {

    private static final Logger log = LoggerFactory.getLogger(SwingChooserPresenter.class);

    private final MessageSource messages;

    public SwingChooserPresenter(MessageSource messages) {
        this.messages = messages;
    }

    @Override
    public ChooserSession present(InteractionSpec spec) {
        SwingSession session = new SwingSession(spec);
        if (GraphicsEnvironment.isHeadless()) {
            session.outcome.completeExceptionally(new PresentationException(PresentationException.Reason.CLOSED));
            return session;
        }
        SwingUtilities.invokeLater(session::show);
        return session;
    }

    /**
     * 确认按钮文本：调用方给出的优先；否则保存类请求（包括 SaveFiles 的选目录）用“保存”，其余用“打开”。
     */
    String acceptLabel(InteractionSpec spec) {
        if (spec.acceptLabel() != null) {
            return spec.acceptLabel();
        }
        return message(spec.save() ? "chooser.accept.save" : "chooser.accept.open");
    }

    private String message(String key) {
        return messages.getMessage(key, null, key, Locale.getDefault());
    }

    private final class SwingSession implements ChooserSession {

        private final InteractionSpec spec;
        private final CompletableFuture<InteractionOutcome> outcome = new CompletableFuture<>();

        // 仅在 EDT 上读写
        private JFileChooser chooser;
        private boolean cancelRequested;

        private SwingSession(InteractionSpec spec) {
            this.spec = spec;
        }

        @Override
        public CompletableFuture<InteractionOutcome> outcome() {
            return outcome;
        }

        @Override
        public void notifyCancel() {
            SwingUtilities.invokeLater(() -> {
                cancelRequested = true;
                if (chooser != null) {
                    chooser.cancelSelection();
                }
            });
        }

        private void show() {
            if (cancelRequested) {
                outcome.completeExceptionally(new PresentationException(PresentationException.Reason.REJECTED));
                return;
            }
            try {
                chooser = new JFileChooser();
                Map<String, JComponent> choiceInputs = new LinkedHashMap<>();
                JCheckBox readOnly = configure(chooser, choiceInputs);
                log.debug("为 {} 显示文件选择对话框（parentWindow={}）", spec.appId(), spec.parentWindow());

                int result = chooser.showDialog(null, null);
                if (result != JFileChooser.APPROVE_OPTION) {
                    outcome.completeExceptionally(new PresentationException(PresentationException.Reason.REJECTED));
                    return;
                }
                outcome.complete(new InteractionOutcome(
                        selectedUris(chooser),
                        selectedFilter(chooser),
                        spec.hasChoices() ? finalChoices(choiceInputs) : null,
                        readOnly != null && !readOnly.isSelected()
                ));
            } catch (RuntimeException e) {
                outcome.completeExceptionally(new PresentationException(PresentationException.Reason.CLOSED, e));
            } finally {
                chooser = null;
            }
        }

        private JCheckBox configure(JFileChooser fc, Map<String, JComponent> choiceInputs) {
            boolean save = spec.mode() == InteractionMode.SAVE;
            fc.setDialogTitle(spec.title());
            fc.setDialogType(save ? JFileChooser.SAVE_DIALOG : JFileChooser.OPEN_DIALOG);
            // setDialogType 会清掉按钮文本，必须在其之后设置
            fc.setApproveButtonText(acceptLabel(spec));
            fc.setFileSelectionMode(spec.mode() == InteractionMode.SELECT_FOLDER
                    ? JFileChooser.DIRECTORIES_ONLY
                    : JFileChooser.FILES_ONLY);
            fc.setMultiSelectionEnabled(spec.multiple());

            fc.setAcceptAllFileFilterUsed(spec.filters().isEmpty());
            for (Filter filter : spec.filters()) {
                PortalFileFilter swingFilter = new PortalFileFilter(filter);
                fc.addChoosableFileFilter(swingFilter);
                if (filter.equals(spec.currentFilter())) {
                    fc.setFileFilter(swingFilter);
                }
            }

            if (spec.currentFolder() != null) {
                fc.setCurrentDirectory(new File(spec.currentFolder()));
            }
            if (spec.currentName() != null) {
                fc.setSelectedFile(new File(fc.getCurrentDirectory(), spec.currentName()));
            }
            if (spec.currentFilename() != null) {
                fc.setSelectedFile(new File(spec.currentFilename()));
            }

            JPanel accessory = new JPanel();
            accessory.setLayout(new BoxLayout(accessory, BoxLayout.Y_AXIS));
            JCheckBox readOnly = null;
            if (spec.mode() == InteractionMode.OPEN) {
                readOnly = new JCheckBox(message("chooser.read-only"), true);
                accessory.add(readOnly);
            }
            if (spec.hasChoices()) {
                for (Choice choice : spec.choices()) {
                    JComponent input = choiceInput(choice);
                    if (!choice.isBoolean()) {
                        accessory.add(new JLabel(choice.label()));
                    }
                    accessory.add(input);
                    choiceInputs.put(choice.id(), input);
                }
            }
            if (accessory.getComponentCount() > 0) {
                fc.setAccessory(accessory);
            }
            return readOnly;
        }

        private JComponent choiceInput(Choice choice) {
            if (choice.isBoolean()) {
                return new JCheckBox(choice.label(), Choice.BOOLEAN_TRUE.equals(choice.defaultVariant()));
            }
            JComboBox<VariantItem> combo = new JComboBox<>();
            for (ChoiceVariant variant : choice.variants()) {
                VariantItem item = new VariantItem(variant);
                combo.addItem(item);
                if (variant.id().equals(choice.defaultVariant())) {
                    combo.setSelectedItem(item);
                }
            }
            return combo;
        }

        private List<FinalChoiceSelection> finalChoices(Map<String, JComponent> choiceInputs) {
            List<FinalChoiceSelection> selections = new ArrayList<>(choiceInputs.size());
            for (Map.Entry<String, JComponent> entry : choiceInputs.entrySet()) {
                JComponent input = entry.getValue();
                String value;
                if (input instanceof JCheckBox checkBox) {
                    value = checkBox.isSelected() ? Choice.BOOLEAN_TRUE : Choice.BOOLEAN_FALSE;
                } else {
                    Object selected = ((JComboBox<?>) input).getSelectedItem();
                    if (!(selected instanceof VariantItem item)) {
                        continue;
                    }
                    value = item.variant().id();
                }
                selections.add(new FinalChoiceSelection(entry.getKey(), value));
            }
            return selections;
        }

        private List<String> selectedUris(JFileChooser fc) {
            File[] files = fc.isMultiSelectionEnabled() ? fc.getSelectedFiles() : new File[0];
            if (files.length == 0 && fc.getSelectedFile() != null) {
                files = new File[]{fc.getSelectedFile()};
            }
            List<String> uris = new ArrayList<>(files.length);
            for (File file : files) {
                uris.add(file.toPath().toAbsolutePath().toUri().toString());
            }
            return uris;
        }

        private Filter selectedFilter(JFileChooser fc) {
            FileFilter selected = fc.getFileFilter();
            return (selected instanceof PortalFileFilter portalFilter) ? portalFilter.filter() : null;
        }
    }

    private record VariantItem(ChoiceVariant variant) {
        @Override
        public String toString() {
            return variant.label();
        }
    }
}
