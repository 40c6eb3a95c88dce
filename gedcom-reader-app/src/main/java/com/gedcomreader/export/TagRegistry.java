package com.gedcomreader.export;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Lookup table from tag to {@link TagHandler}.
 * <p>
 * Tags without an entry are unsupported: the projector passes them through
 * as raw tag/value/children and reports them, it never fails on them.
 */
public class TagRegistry {

    // GEDCOM 5.5.1/5.5.5 tags that project fine as plain tag/value nodes
    private static final List<String> STANDARD_TAGS = List.of(
            "HEAD", "TRLR", "GEDC", "VERS", "FORM", "CHAR", "DEST", "SOUR", "CORP", "DATA", "DATE",
            "TIME", "COPR", "LANG", "SUBM", "SUBN", "FILE", "NOTE", "PLAC", "MAP", "LATI", "LONG",
            "ADDR", "ADR1", "ADR2", "ADR3", "CITY", "STAE", "POST", "CTRY", "PHON", "EMAIL", "FAX",
            "WWW", "INDI", "FAM", "HUSB", "WIFE", "CHIL", "FAMC", "FAMS", "PEDI", "STAT", "ASSO",
            "RELA", "ALIA", "ANCI", "DESI", "RFN", "AFN", "REFN", "RIN", "TYPE", "CHAN", "AGE",
            "AGNC", "CAUS", "RESN", "NPFX", "GIVN", "NICK", "SPFX", "SURN", "NSFX", "FONE", "ROMN",
            "OBJE", "TITL", "REPO", "CALN", "MEDI", "AUTH", "ABBR", "PUBL", "TEXT", "PAGE", "EVEN",
            "ROLE", "QUAY", "CERT", "COMM"
    );

    private static final Map<String, String> INDIVIDUAL_EVENTS = Map.ofEntries(
            Map.entry("BIRT", "Birth"),
            Map.entry("CHR", "Christening"),
            Map.entry("DEAT", "Death"),
            Map.entry("BURI", "Burial"),
            Map.entry("CREM", "Cremation"),
            Map.entry("ADOP", "Adoption"),
            Map.entry("BAPM", "Baptism"),
            Map.entry("BARM", "Bar Mitzvah"),
            Map.entry("BASM", "Bas Mitzvah"),
            Map.entry("BLES", "Blessing"),
            Map.entry("CHRA", "Adult Christening"),
            Map.entry("CONF", "Confirmation"),
            Map.entry("FCOM", "First Communion"),
            Map.entry("ORDN", "Ordination"),
            Map.entry("NATU", "Naturalization"),
            Map.entry("EMIG", "Emigration"),
            Map.entry("IMMI", "Immigration"),
            Map.entry("CENS", "Census"),
            Map.entry("PROB", "Probate"),
            Map.entry("WILL", "Will"),
            Map.entry("GRAD", "Graduation"),
            Map.entry("RETI", "Retirement")
    );

    private static final Map<String, String> FAMILY_EVENTS = Map.ofEntries(
            Map.entry("ANUL", "Annulment"),
            Map.entry("DIV", "Divorce"),
            Map.entry("DIVF", "Divorce Filed"),
            Map.entry("ENGA", "Engagement"),
            Map.entry("MARB", "Marriage Banns"),
            Map.entry("MARC", "Marriage Contract"),
            Map.entry("MARR", "Marriage"),
            Map.entry("MARL", "Marriage License"),
            Map.entry("MARS", "Marriage Settlement")
    );

    private static final Map<String, String> ATTRIBUTES = Map.ofEntries(
            Map.entry("CAST", "Caste"),
            Map.entry("DSCR", "Physical Description"),
            Map.entry("EDUC", "Education"),
            Map.entry("IDNO", "Identification Number"),
            Map.entry("NATI", "Nationality"),
            Map.entry("NCHI", "Number of Children"),
            Map.entry("NMR", "Number of Marriages"),
            Map.entry("OCCU", "Occupation"),
            Map.entry("PROP", "Property"),
            Map.entry("RELI", "Religion"),
            Map.entry("RESI", "Residence"),
            Map.entry("FACT", "")
    );

    private final Map<String, TagHandler> handlers = new HashMap<>();

    public static TagRegistry standard() {
        TagRegistry registry = new TagRegistry();
        STANDARD_TAGS.forEach(tag -> registry.register(tag, TagHandler.PLAIN));
        INDIVIDUAL_EVENTS.forEach((tag, label) -> registry.register(tag, new LabelTagHandler("event", label)));
        FAMILY_EVENTS.forEach((tag, label) -> registry.register(tag, new LabelTagHandler("event", label)));
        ATTRIBUTES.forEach((tag, label) -> registry.register(tag, new LabelTagHandler("attribute", label)));
        registry.register("EVEN", new LabelTagHandler("event", ""));
        registry.register("NAME", new NameTagHandler());
        registry.register("SEX", new SexTagHandler());
        return registry;
    }

    public TagRegistry register(String tag, TagHandler handler) {
        handlers.put(tag, handler);
        return this;
    }

    public boolean isSupported(String tag) {
        return handlers.containsKey(tag);
    }

    /**
     * The handler for {@code tag}, or {@link TagHandler#PLAIN} for unsupported tags.
     */
    public TagHandler handlerFor(String tag) {
        return handlers.getOrDefault(tag, TagHandler.PLAIN);
    }
}
