package com.gedcomreader.config;

import com.gedcomreader.export.PointerRendering;
import com.gedcomreader.export.ProjectionOptions;
import com.gedcomreader.model.RecordKind;
import com.gedcomreader.parser.ParserSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;

/**
 * GEDCOM parsing and export settings.
 * Define them in application.yml under 'gedcom'.
 */
@Configuration
@ConfigurationProperties(prefix = "gedcom")
@Validated
public class GedcomProperties {

    @NotBlank
    private String charset = "UTF-8";

    @Min(1)
    @Max(99)
    private int maxLevel = ParserSettings.DEFAULT_MAX_LEVEL;

    @Min(0)
    private int parallelTokenizeThreshold = 50_000;

    private List<String> obsoleteTags = new ArrayList<>(List.of("SSN", "FSID"));

    @Valid
    private Export export = new Export();

    public ParserSettings toParserSettings() {
        return new ParserSettings(maxLevel, new HashSet<>(obsoleteTags), parallelTokenizeThreshold);
    }

    public String getCharset() { return charset; }
    public void setCharset(String charset) { this.charset = charset; }

    public int getMaxLevel() { return maxLevel; }
    public void setMaxLevel(int maxLevel) { this.maxLevel = maxLevel; }

    public int getParallelTokenizeThreshold() { return parallelTokenizeThreshold; }
    public void setParallelTokenizeThreshold(int parallelTokenizeThreshold) { this.parallelTokenizeThreshold = parallelTokenizeThreshold; }

    public List<String> getObsoleteTags() { return obsoleteTags; }
    public void setObsoleteTags(List<String> obsoleteTags) { this.obsoleteTags = obsoleteTags; }

    public Export getExport() { return export; }
    public void setExport(Export export) { this.export = export; }

    /**
     * Defaults for projections that don't specify their own options.
     */
    public static class Export {
        @NotNull
        private PointerRendering pointerRendering = PointerRendering.REFERENCE;
        private boolean pruneEmpty = true;
        private List<RecordKind> defaultKinds = new ArrayList<>(List.of(RecordKind.INDI, RecordKind.FAM));

        public ProjectionOptions toOptions() {
            return new ProjectionOptions(
                defaultKinds.isEmpty() ? EnumSet.noneOf(RecordKind.class) : EnumSet.copyOf(defaultKinds),
                pointerRendering,
                pruneEmpty
            );
        }

        public PointerRendering getPointerRendering() { return pointerRendering; }
        public void setPointerRendering(PointerRendering pointerRendering) { this.pointerRendering = pointerRendering; }

        public boolean isPruneEmpty() { return pruneEmpty; }
        public void setPruneEmpty(boolean pruneEmpty) { this.pruneEmpty = pruneEmpty; }

        public List<RecordKind> getDefaultKinds() { return defaultKinds; }
        public void setDefaultKinds(List<RecordKind> defaultKinds) { this.defaultKinds = defaultKinds; }
    }
}
