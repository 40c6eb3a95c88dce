package com.gedcomreader.parser;

import com.gedcomreader.model.GedcomDocument;
import com.gedcomreader.model.PointerStatus;
import com.gedcomreader.model.Record;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GedcomParserTest {

    private final GedcomParser parser = new GedcomParser();

    @Nested
    @DisplayName("parse")
    class Parse {

        @Test
        void buildsAndResolvesTheSpouseFamilyCycle() throws Exception {
            GedcomDocument document = parser.parse(List.of(
                    "0 @I1@ INDI",
                    "1 NAME John /Doe/",
                    "1 FAMS @F1@",
                    "0 @F1@ FAM",
                    "1 HUSB @I1@"));

            assertThat(document.getRoots()).extracting(r -> r.getXrefId().orElseThrow())
                    .containsExactly("@I1@", "@F1@");

            Record indi = document.lookup("@I1@").orElseThrow();
            Record fam = document.lookup("@F1@").orElseThrow();
            Record fams = indi.firstChild("FAMS").orElseThrow();
            Record husb = fam.firstChild("HUSB").orElseThrow();

            assertThat(document.target(fams)).containsSame(fam);
            assertThat(document.target(husb)).containsSame(indi);
            assertThat(document.referrers("@I1@")).containsExactly(husb);
        }

        @Test
        void foldsContinuationsBeforeBuildingTheTree() throws Exception {
            GedcomDocument document = parser.parse(List.of(
                    "0 @N1@ NOTE Line one",
                    "1 CONC , still one",
                    "1 CONT Line two",
                    "0 TRLR"));

            Record note = document.getRoots().get(0);
            assertThat(note.getValue()).contains("Line one, still one\nLine two");
            assertThat(note.getChildren()).isEmpty();
        }

        @Test
        void rootCountMatchesLevelZeroLines() throws Exception {
            List<String> lines = new ArrayList<>();
            lines.add("0 HEAD");
            for (int i = 1; i <= 50; i++) {
                lines.add("0 @I" + i + "@ INDI");
                lines.add("1 NAME Person " + i);
                lines.add("1 BIRT");
                lines.add("2 DATE " + (1800 + i));
            }
            lines.add("0 TRLR");

            GedcomDocument document = parser.parse(lines);

            assertThat(document.getRoots()).hasSize(52);
            assertThat(document.getXrefIndex()).hasSize(50);
        }

        @Test
        void danglingPointerDoesNotFailTheParse() throws Exception {
            GedcomDocument document = parser.parse(List.of("0 @F1@ FAM", "1 CHIL @I99@"));

            Record chil = document.getRoots().get(0).getChildren().get(0);
            assertThat(chil.getPointerStatus()).isEqualTo(PointerStatus.UNRESOLVED);
            assertThat(document.getWarnings()).hasSize(1);
        }

        @Test
        void sealsTheDocument() throws Exception {
            GedcomDocument document = parser.parse(List.of("0 @I1@ INDI"));
            Record indi = document.getRoots().get(0);

            assertThat(document.isSealed()).isTrue();
            assertThatThrownBy(() -> indi.addChild(new Record(1, null, "NAME", "X", 2)))
                    .isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> document.addRoot(new Record(0, null, "TRLR", null, 3)))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        void usesParallelTokenizingAboveTheThreshold() throws Exception {
            GedcomParser parallel = new GedcomParser(new ParserSettings(99, Set.of(), 10));
            List<String> lines = new ArrayList<>();
            for (int i = 0; i < 100; i++) {
                lines.add("0 @I" + i + "@ INDI");
                lines.add("1 FAMC @F1@");
            }
            lines.add("0 @F1@ FAM");

            GedcomDocument document = parallel.parse(lines);

            assertThat(document.getRoots()).hasSize(101);
            assertThat(document.referrers("@F1@")).hasSize(100);
        }
    }

    @Nested
    @DisplayName("fatal errors")
    class FatalErrors {

        @Test
        void duplicateXrefFailsTheParse() {
            assertThatThrownBy(() -> parser.parse(List.of("0 @I1@ INDI", "0 @I1@ INDI")))
                    .isInstanceOf(DuplicateXrefException.class);
        }

        @Test
        void levelSkipFailsTheParse() {
            assertThatThrownBy(() -> parser.parse(List.of("0 HEAD", "2 BAD")))
                    .isInstanceOf(StructuralException.class);
        }

        @Test
        void malformedLineFailsTheParse() {
            assertThatThrownBy(() -> parser.parse(List.of("0 HEAD", "one NAME x")))
                    .isInstanceOf(MalformedLineException.class)
                    .satisfies(e -> assertThat(((GedcomParseException) e).getLineNumber()).isEqualTo(2));
        }

        @Test
        void respectsConfiguredMaximumLevel() {
            GedcomParser shallow = new GedcomParser(new ParserSettings(2, Set.of(), 0));

            assertThatThrownBy(() -> shallow.parse(List.of("0 HEAD", "1 SOUR x", "2 VERS 1", "3 NAME y")))
                    .isInstanceOf(MalformedLineException.class)
                    .hasMessageContaining("exceeds maximum 2");
        }
    }
}
