package com.confluenceparser.core.markup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An element of the neutral markup forest.
 *
 * <p>Names are kept exactly as written, including the namespace prefix
 * ({@code ac:structured-macro}, {@code ri:page}). Default-namespace tags have an empty prefix.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * MarkupElement macro = ...;
 * if ("ac".equals(macro.namespace()) && "structured-macro".equals(macro.localName())) {
 *     String name = macro.attr("ac:name");
 *     Optional<MarkupElement> body = macro.firstChild("ac:rich-text-body");
 * }
 * }</pre>
 *
 * @param name qualified tag name
 * @param attributes attributes in source order, keyed by qualified name
 * @param children ordered child nodes
 */
public record MarkupElement(
    String name,
    Map<String, String> attributes,
    List<MarkupNode> children
) implements MarkupNode {

    public MarkupElement {
        Objects.requireNonNull(name, "name must not be null");
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * Creates an element without attributes.
     *
     * @param name qualified tag name
     * @param children child nodes
     * @return element
     */
    public static MarkupElement of(String name, MarkupNode... children) {
        return new MarkupElement(name, Map.of(), List.of(children));
    }

    /**
     * Returns the namespace prefix, or an empty string for default-namespace tags.
     *
     * @return namespace prefix
     */
    public String namespace() {
        int colon = name.indexOf(':');
        return colon < 0 ? "" : name.substring(0, colon);
    }

    /**
     * Returns the tag name without its namespace prefix.
     *
     * @return local name
     */
    public String localName() {
        int colon = name.indexOf(':');
        return colon < 0 ? name : name.substring(colon + 1);
    }

    /**
     * Returns an attribute value.
     *
     * @param attributeName qualified attribute name
     * @return value, or null if absent
     */
    public String attr(String attributeName) {
        return attributes.get(attributeName);
    }

    /**
     * Returns the first non-empty value among several attribute names.
     *
     * @param attributeNames candidate names in priority order
     * @return value, or null if none is present
     */
    public String firstAttr(String... attributeNames) {
        for (String attributeName : attributeNames) {
            String value = attributes.get(attributeName);
            if (value != null && !value.isEmpty()) {
                return value;
            }
        }
        return null;
    }

    /**
     * Returns the child elements, skipping character data.
     *
     * @return child elements in source order
     */
    public List<MarkupElement> childElements() {
        List<MarkupElement> elements = new ArrayList<>();
        for (MarkupNode child : children) {
            if (child instanceof MarkupElement element) {
                elements.add(element);
            }
        }
        return elements;
    }

    /**
     * Returns the child elements with the given qualified name.
     *
     * @param childName qualified tag name
     * @return matching child elements in source order
     */
    public List<MarkupElement> childElements(String childName) {
        List<MarkupElement> elements = new ArrayList<>();
        for (MarkupElement element : childElements()) {
            if (element.name().equals(childName)) {
                elements.add(element);
            }
        }
        return elements;
    }

    /**
     * Returns the first child element with the given qualified name.
     *
     * @param childName qualified tag name
     * @return matching child, if any
     */
    public Optional<MarkupElement> firstChild(String childName) {
        for (MarkupElement element : childElements()) {
            if (element.name().equals(childName)) {
                return Optional.of(element);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the concatenated character data of this element and its descendants, unmodified.
     *
     * @return text content
     */
    public String textContent() {
        StringBuilder sb = new StringBuilder();
        appendText(this, sb);
        return sb.toString();
    }

    private static void appendText(MarkupElement element, StringBuilder sb) {
        for (MarkupNode child : element.children()) {
            if (child instanceof MarkupText text) {
                sb.append(text.text());
            } else if (child instanceof MarkupElement nested) {
                appendText(nested, sb);
            }
        }
    }
}
