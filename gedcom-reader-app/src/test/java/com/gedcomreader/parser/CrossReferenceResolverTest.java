package com.gedcomreader.parser;

import com.gedcomreader.model.GedcomDocument;
import com.gedcomreader.model.ParseWarning;
import com.gedcomreader.model.PointerStatus;
import com.gedcomreader.model.Record;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class CrossReferenceResolverTest {

    private final CrossReferenceResolver resolver = new CrossReferenceResolver();

    private GedcomDocument build(String... lines) throws GedcomParseException {
        LineTokenizer tokenizer = new LineTokenizer(99);
        return new TreeBuilder(Set.of())
                .build(new ContinuationFolder().fold(tokenizer.tokenizeAll(List.of(lines), false)));
    }

    @Nested
    @DisplayName("resolve")
    class Resolve {

        @Test
        void resolvesPointersInBothDirections() throws Exception {
            GedcomDocument document = build(
                    "0 @I1@ INDI",
                    "1 NAME John /Doe/",
                    "1 FAMS @F1@",
                    "0 @F1@ FAM",
                    "1 HUSB @I1@");

            int unresolved = resolver.resolve(document);

            Record indi = document.getRoots().get(0);
            Record fam = document.getRoots().get(1);
            Record fams = indi.getChildren().get(1);
            Record husb = fam.getChildren().get(0);
            assertThat(unresolved).isZero();
            assertThat(fams.getPointerStatus()).isEqualTo(PointerStatus.RESOLVED);
            assertThat(document.target(fams)).containsSame(fam);
            assertThat(husb.getPointerStatus()).isEqualTo(PointerStatus.RESOLVED);
            assertThat(document.target(husb)).containsSame(indi);
        }

        @Test
        void leavesNonPointerValuesAlone() throws Exception {
            GedcomDocument document = build("0 @I1@ INDI", "1 NAME John /Doe/", "1 NOTE mail me @ home@");

            resolver.resolve(document);

            assertThat(document.getRoots().get(0).getChildren())
                    .extracting(Record::getPointerStatus)
                    .containsOnly(PointerStatus.NONE);
        }

        @Test
        void ignoresDateEscapes() throws Exception {
            GedcomDocument document = build("0 @I1@ INDI", "1 BIRT", "2 DATE @#DJULIAN@ 1 JAN 1700");

            resolver.resolve(document);

            Record date = document.getRoots().get(0).getChildren().get(0).getChildren().get(0);
            assertThat(date.getPointerStatus()).isEqualTo(PointerStatus.NONE);
        }

        @Test
        void marksDanglingPointersUnresolvedWithoutFailing() throws Exception {
            GedcomDocument document = build("0 @F1@ FAM", "1 HUSB @I99@");

            int unresolved = resolver.resolve(document);

            Record husb = document.getRoots().get(0).getChildren().get(0);
            assertThat(unresolved).isEqualTo(1);
            assertThat(husb.getPointerStatus()).isEqualTo(PointerStatus.UNRESOLVED);
            assertThat(document.target(husb)).isEmpty();
            assertThat(document.getWarnings()).extracting(ParseWarning::type)
                    .containsExactly(ParseWarning.Type.UNRESOLVED_POINTER);
            assertThat(document.unresolvedPointers()).containsExactly(husb);
        }

        @Test
        void collectsReferrersInDocumentOrder() throws Exception {
            GedcomDocument document = build(
                    "0 @I1@ INDI",
                    "1 FAMS @F1@",
                    "0 @I2@ INDI",
                    "1 FAMS @F1@",
                    "0 @F1@ FAM");

            resolver.resolve(document);

            assertThat(document.referrers("@F1@")).extracting(r -> r.getParent().getXrefId().orElseThrow())
                    .containsExactly("@I1@", "@I2@");
            assertThat(document.referrers("@I1@")).isEmpty();
        }

        @Test
        void doesNotChangeTheXrefIndex() throws Exception {
            GedcomDocument document = build("0 @I1@ INDI", "1 FAMS @F1@", "1 FAMC @F2@", "0 @F1@ FAM");
            Map<String, Record> before = Map.copyOf(document.getXrefIndex());

            resolver.resolve(document);

            assertThat(document.getXrefIndex()).isEqualTo(before);
        }
    }
}
