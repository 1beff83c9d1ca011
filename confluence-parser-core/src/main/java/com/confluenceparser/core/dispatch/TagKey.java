package com.confluenceparser.core.dispatch;

import com.confluenceparser.core.markup.MarkupElement;

import java.util.Locale;
import java.util.Objects;

/**
 * Dispatch table key: namespace prefix and local tag name, both lower-cased.
 *
 * @param namespace namespace prefix, empty for default-namespace tags
 * @param localName tag name without prefix
 */
public record TagKey(String namespace, String localName) {

    public TagKey {
        Objects.requireNonNull(namespace, "namespace must not be null");
        Objects.requireNonNull(localName, "localName must not be null");
        namespace = namespace.toLowerCase(Locale.ROOT);
        localName = localName.toLowerCase(Locale.ROOT);
    }

    /**
     * Creates a key from a qualified name such as {@code ac:layout} or {@code p}.
     *
     * @param qualifiedName tag name with optional prefix
     * @return key
     */
    public static TagKey of(String qualifiedName) {
        int colon = qualifiedName.indexOf(':');
        return colon < 0
            ? new TagKey("", qualifiedName)
            : new TagKey(qualifiedName.substring(0, colon), qualifiedName.substring(colon + 1));
    }

    public static TagKey of(MarkupElement element) {
        return new TagKey(element.namespace(), element.localName());
    }
}
