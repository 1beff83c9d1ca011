package com.confluenceparser.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Behaviour switches of {@link com.confluenceparser.core.parser.ConfluenceParser}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * parser:
 *   strictOnDiagnostics: false
 * }</pre>
 *
 * @param strictOnDiagnostics whether any diagnostic fails the parse; defaults to true
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ParserSettings(
    @JsonProperty("strictOnDiagnostics") Boolean strictOnDiagnostics
) {
    public ParserSettings {
        if (strictOnDiagnostics == null) {
            strictOnDiagnostics = Boolean.TRUE;
        }
    }

    /**
     * Returns the default settings: strict on diagnostics.
     *
     * @return default settings
     */
    public static ParserSettings defaults() {
        return new ParserSettings(Boolean.TRUE);
    }

    public static ParserSettings lenient() {
        return new ParserSettings(Boolean.FALSE);
    }

    public boolean isStrict() {
        return strictOnDiagnostics;
    }
}
