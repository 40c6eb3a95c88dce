package com.gedcomreader.config;

import com.gedcomreader.export.ExportProjector;
import com.gedcomreader.export.TagRegistry;
import com.gedcomreader.parser.GedcomParser;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the plain parser and projector classes as beans.
 */
@Configuration
public class GedcomConfig {

    @Bean
    public GedcomParser gedcomParser(GedcomProperties properties) {
        return new GedcomParser(properties.toParserSettings());
    }

    @Bean
    public TagRegistry tagRegistry() {
        return TagRegistry.standard();
    }

    @Bean
    public ExportProjector exportProjector(TagRegistry tagRegistry) {
        return new ExportProjector(tagRegistry);
    }
}
