package com.gedcomreader.controller;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.io.InputStream;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class GedcomExportControllerTest {

    @Autowired
    private MockMvc mockMvc;

    private static final String EXAMPLE = """
            0 @I1@ INDI
            1 NAME John /Doe/
            1 FAMS @F1@
            0 @F1@ FAM
            1 HUSB @I1@
            1 CHIL @I99@
            """;

    @Nested
    @DisplayName("POST /api/gedcom/export")
    class Export {

        @Test
        void exportsDefaultKindsFromTextBody() throws Exception {
            mockMvc.perform(post("/api/gedcom/export")
                            .contentType(MediaType.TEXT_PLAIN)
                            .content(EXAMPLE))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.individuals", hasSize(1)))
                    .andExpect(jsonPath("$.individuals[0].children[1].ref").value("@F1@"))
                    .andExpect(jsonPath("$.families[0].children[0].ref").value("@I1@"))
                    .andExpect(jsonPath("$.families[0].children[1].value").value("@I99@"))
                    .andExpect(jsonPath("$.families[0].children[1].unresolved").value(true));
        }

        @Test
        void honoursKindsAndPointerParameters() throws Exception {
            mockMvc.perform(post("/api/gedcom/export")
                            .param("kinds", "families")
                            .param("pointers", "nested")
                            .contentType(MediaType.TEXT_PLAIN)
                            .content(EXAMPLE))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.individuals").doesNotExist())
                    .andExpect(jsonPath("$.families[0].children[0].target.xref").value("@I1@"))
                    .andExpect(jsonPath("$.families[0].children[0].target.children[1].ref").value("@F1@"));
        }

        @Test
        void exportsUploadedFile() throws Exception {
            byte[] content;
            try (InputStream in = getClass().getResourceAsStream("/sample-family.ged")) {
                content = in.readAllBytes();
            }
            MockMultipartFile file = new MockMultipartFile("file", "sample-family.ged", "application/octet-stream", content);

            mockMvc.perform(multipart("/api/gedcom/export").file(file).param("kinds", "INDI,NOTE"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.individuals", hasSize(3)))
                    .andExpect(jsonPath("$.notes[0].value").value(
                            "First line of the note continued on the same line.\nSecond line.\n\nFourth line."));
        }

        @Test
        void rejectsUnknownKind() throws Exception {
            mockMvc.perform(post("/api/gedcom/export")
                            .param("kinds", "planets")
                            .contentType(MediaType.TEXT_PLAIN)
                            .content(EXAMPLE))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("Unknown record kind: planets"));
        }

        @Test
        void reportsParseErrorsWithLineNumber() throws Exception {
            mockMvc.perform(post("/api/gedcom/export")
                            .contentType(MediaType.TEXT_PLAIN)
                            .content("0 HEAD\n2 BAD\n"))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.type").value("StructuralException"))
                    .andExpect(jsonPath("$.lineNumber").value(2))
                    .andExpect(jsonPath("$.line").value("2 BAD"));
        }

        @Test
        void reportsDuplicateXref() throws Exception {
            mockMvc.perform(post("/api/gedcom/export")
                            .contentType(MediaType.TEXT_PLAIN)
                            .content("0 @I1@ INDI\n0 @I1@ INDI\n"))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.type").value("DuplicateXrefException"));
        }
    }

    @Nested
    @DisplayName("POST /api/gedcom/summary")
    class Summary {

        @Test
        void summarizesTextBody() throws Exception {
            mockMvc.perform(post("/api/gedcom/summary")
                            .contentType(MediaType.TEXT_PLAIN)
                            .content(EXAMPLE))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.roots").value(2))
                    .andExpect(jsonPath("$.xrefIds").value(2))
                    .andExpect(jsonPath("$.unresolvedPointers").value(1))
                    .andExpect(jsonPath("$.recordCounts.individuals").value(1))
                    .andExpect(jsonPath("$.warnings", hasSize(1)));
        }
    }
}
