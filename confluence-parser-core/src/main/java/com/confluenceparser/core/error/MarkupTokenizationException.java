package com.confluenceparser.core.error;

import java.util.List;

/**
 * Thrown when raw markup cannot be turned into an element forest at all.
 *
 * <p>No tree is produced in that case.
 */
public class MarkupTokenizationException extends ContentParseException {

    public MarkupTokenizationException(String message) {
        super(message, List.of(), null);
    }

    public MarkupTokenizationException(String message, Throwable cause) {
        super(message, List.of(), cause);
    }
}
