package com.confluenceparser.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code confluence-parser.yaml}.
 *
 * @param parser parser settings, defaults when the section is missing
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ParserConfig(
    @JsonProperty("parser") ParserSettings parser
) {
    public ParserConfig {
        if (parser == null) {
            parser = ParserSettings.defaults();
        }
    }

    public static ParserConfig defaults() {
        return new ParserConfig(ParserSettings.defaults());
    }
}
