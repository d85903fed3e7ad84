package org.portal.chooser;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.portal.chooser.dto.OpenFileOptions;
import org.portal.chooser.dto.OpenFileResults;
import org.portal.chooser.dto.SaveFileOptions;
import org.portal.chooser.dto.SaveFileResults;
import org.portal.chooser.dto.SaveFilesOptions;
import org.portal.chooser.dto.WireChoice;
import org.portal.chooser.dto.WireChoiceSelection;
import org.portal.chooser.dto.WireChoiceVariant;
import org.portal.chooser.dto.WireFilter;
import org.portal.chooser.dto.WireFilterRule;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InteractionMapperTest {

    private static final WireFilter TEXT_FILES = new WireFilter("Text files", List.of(
            new WireFilterRule(0, "*.txt"),
            new WireFilterRule(1, "text/plain"),
            new WireFilterRule(9, "ignored")
    ));

    @Test
    void toFilter_dropsUnknownKinds() {
        Filter filter = InteractionMapper.toFilter(TEXT_FILES);

        assertThat(filter.name()).isEqualTo("Text files");
        assertThat(filter.rules()).containsExactly(FilterRule.glob("*.txt"), FilterRule.mime("text/plain"));
    }

    @Test
    void toFilter_dropsKindsBeyondSignedIntRange() throws Exception {
        String json = "{\"filters\":[{\"name\":\"T\",\"rules\":["
                + "{\"kind\":0,\"value\":\"*.txt\"},{\"kind\":4294967295,\"value\":\"x\"}]}]}";
        OpenFileOptions options = new ObjectMapper().readValue(json, OpenFileOptions.class);

        InteractionSpec spec = InteractionMapper.forOpenFile("app", "", "Open", options);

        assertThat(options.filters().get(0).rules().get(1).kind()).isEqualTo(4294967295L);
        assertThat(spec.filters()).containsExactly(new Filter("T", List.of(FilterRule.glob("*.txt"))));
    }

    @Test
    void toWireFilter_roundTripDoesNotCarryUnknownKinds() {
        WireFilter back = InteractionMapper.toWireFilter(InteractionMapper.toFilter(TEXT_FILES));

        assertThat(back).isEqualTo(new WireFilter("Text files", List.of(
                new WireFilterRule(0, "*.txt"),
                new WireFilterRule(1, "text/plain")
        )));
    }

    @Test
    void filter_equalityIsStructural() {
        assertThat(InteractionMapper.toFilter(TEXT_FILES))
                .isEqualTo(new Filter("Text files", List.of(FilterRule.glob("*.txt"), FilterRule.mime("text/plain"))));
    }

    @Test
    void forOpenFile_appliesDefaults() {
        InteractionSpec spec = InteractionMapper.forOpenFile("app", "x11:1", "Open", OpenFileOptions.defaults());

        assertThat(spec.mode()).isEqualTo(InteractionMode.OPEN);
        assertThat(spec.save()).isFalse();
        assertThat(spec.multiple()).isFalse();
        assertThat(spec.modal()).isTrue();
        assertThat(spec.filters()).isEmpty();
        assertThat(spec.currentFilter()).isNull();
        assertThat(spec.choices()).isNull();
        assertThat(spec.hasChoices()).isFalse();
        assertThat(spec.appId()).isEqualTo("app");
        assertThat(spec.parentWindow()).isEqualTo("x11:1");
        assertThat(spec.title()).isEqualTo("Open");
    }

    @Test
    void forOpenFile_nullOptionsBehaveLikeDefaults() {
        InteractionSpec spec = InteractionMapper.forOpenFile("app", "", "Open", null);

        assertThat(spec.mode()).isEqualTo(InteractionMode.OPEN);
        assertThat(spec.modal()).isTrue();
    }

    @Test
    void forOpenFile_directoryWinsAndOverridesAreKept() {
        OpenFileOptions options = new OpenFileOptions(
                "Pick", false, true, true,
                List.of(TEXT_FILES), TEXT_FILES,
                List.of(new WireChoice("encoding", "Encoding",
                        List.of(new WireChoiceVariant("utf8", "UTF-8"), new WireChoiceVariant("latin1", "Latin-1")),
                        "utf8")),
                FilePathBytes.of("/home/user")
        );

        InteractionSpec spec = InteractionMapper.forOpenFile("app", "", "Pick a folder", options);

        assertThat(spec.mode()).isEqualTo(InteractionMode.SELECT_FOLDER);
        assertThat(spec.multiple()).isTrue();
        assertThat(spec.modal()).isFalse();
        assertThat(spec.acceptLabel()).isEqualTo("Pick");
        assertThat(spec.filters()).hasSize(1);
        assertThat(spec.currentFilter()).isEqualTo(spec.filters().get(0));
        assertThat(spec.currentFolder()).isEqualTo("/home/user");
        assertThat(spec.choices()).containsExactly(new Choice("encoding", "Encoding", "utf8", List.of(
                new ChoiceVariant("utf8", "UTF-8"), new ChoiceVariant("latin1", "Latin-1"))));
    }

    @Test
    void forSaveFile_usesSaveModeAndDecodesPaths() {
        SaveFileOptions options = new SaveFileOptions(
                null, null, null, null, null, List.of(), "report.txt",
                FilePathBytes.of("/home/user/docs"), FilePathBytes.of("/home/user/docs/old.txt"));

        InteractionSpec spec = InteractionMapper.forSaveFile("app", "", "Save", options);

        assertThat(spec.mode()).isEqualTo(InteractionMode.SAVE);
        assertThat(spec.save()).isTrue();
        assertThat(spec.currentName()).isEqualTo("report.txt");
        assertThat(spec.currentFolder()).isEqualTo("/home/user/docs");
        assertThat(spec.currentFilename()).isEqualTo("/home/user/docs/old.txt");
        // 传了空 choices 与没传 choices 含义不同
        assertThat(spec.hasChoices()).isTrue();
        assertThat(spec.choices()).isEmpty();
    }

    @Test
    void forSaveFile_malformedPathFails() {
        SaveFileOptions options = new SaveFileOptions(
                null, null, null, null, null, null, null, new FilePathBytes("/tmp".getBytes()), null);

        assertThatThrownBy(() -> InteractionMapper.forSaveFile("app", "", "Save", options))
                .isInstanceOf(PortalRequestException.class)
                .extracting(e -> ((PortalRequestException) e).error())
                .isEqualTo(PortalError.MALFORMED_PATH);
    }

    @Test
    void forSaveFiles_selectsSingleFolderWithoutFilters() {
        SaveFilesOptions options = new SaveFilesOptions("Here", null, null, FilePathBytes.of("/tmp"),
                List.of(FilePathBytes.of("a.txt")));

        InteractionSpec spec = InteractionMapper.forSaveFiles("app", "", "Save all", options);

        assertThat(spec.mode()).isEqualTo(InteractionMode.SELECT_FOLDER);
        assertThat(spec.save()).isTrue();
        assertThat(spec.multiple()).isFalse();
        assertThat(spec.modal()).isTrue();
        assertThat(spec.filters()).isEmpty();
        assertThat(spec.acceptLabel()).isEqualTo("Here");
        assertThat(spec.currentFolder()).isEqualTo("/tmp");
    }

    @Test
    void toOpenFileResults_mapsOutcome() {
        Filter filter = new Filter("Images", List.of(FilterRule.mime("image/*")));
        InteractionOutcome outcome = new InteractionOutcome(
                List.of("file:///tmp/a.png"), filter,
                List.of(new FinalChoiceSelection("encoding", "latin1")), true);

        OpenFileResults results = InteractionMapper.toOpenFileResults(outcome);

        assertThat(results.uris()).containsExactly("file:///tmp/a.png");
        assertThat(results.currentFilter()).isEqualTo(new WireFilter("Images", List.of(new WireFilterRule(1, "image/*"))));
        assertThat(results.choices()).containsExactly(new WireChoiceSelection("encoding", "latin1"));
        assertThat(results.writable()).isTrue();
    }

    @Test
    void toSaveFileResults_keepsAbsentFieldsAbsent() {
        InteractionOutcome outcome = new InteractionOutcome(List.of("file:///tmp/a.txt"), null, null, false);

        SaveFileResults results = InteractionMapper.toSaveFileResults(outcome);

        assertThat(results.uris()).containsExactly("file:///tmp/a.txt");
        assertThat(results.choices()).isNull();
        assertThat(results.currentFilter()).isNull();
    }
}
