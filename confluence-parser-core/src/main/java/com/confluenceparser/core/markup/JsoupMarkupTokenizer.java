package com.confluenceparser.core.markup;

import com.confluenceparser.core.error.MarkupTokenizationException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.CDataNode;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link MarkupTokenizer} backed by jsoup's XML parser.
 *
 * <p>The XML parser keeps tag and attribute names exactly as written, so {@code ac:} and
 * {@code ri:} prefixes survive without namespace declarations. Comments, XML declarations and
 * doctypes are dropped. CDATA sections become {@link MarkupText} runs flagged as CDATA.
 *
 * <p>HTML void tags written without a closing slash ({@code <br>}, {@code <hr>}, {@code <img>},
 * {@code <col>}) swallow their following siblings in XML mode. Those children are moved back
 * out so they follow the void element.
 */
public final class JsoupMarkupTokenizer implements MarkupTokenizer {

    private static final Logger log = LoggerFactory.getLogger(JsoupMarkupTokenizer.class);

    private static final Set<String> VOID_TAGS = Set.of("br", "hr", "img", "col");

    @Override
    public List<MarkupNode> tokenize(String markup) {
        if (markup == null) {
            throw new MarkupTokenizationException("Markup must not be null");
        }

        org.jsoup.nodes.Document parsed;
        try {
            parsed = Jsoup.parse(markup, "", Parser.xmlParser());
        } catch (RuntimeException e) {
            throw new MarkupTokenizationException("Failed to tokenize markup: " + e.getMessage(), e);
        }

        List<MarkupNode> forest = new ArrayList<>();
        for (Node child : parsed.childNodes()) {
            convert(child, forest);
        }
        log.trace("Tokenized {} characters into {} top-level nodes", markup.length(), forest.size());
        return forest;
    }

    private static void convert(Node node, List<MarkupNode> out) {
        if (node instanceof CDataNode cdata) {
            out.add(new MarkupText(cdata.getWholeText(), true));
        } else if (node instanceof TextNode text) {
            out.add(MarkupText.of(text.getWholeText()));
        } else if (node instanceof Element element) {
            Map<String, String> attributes = new LinkedHashMap<>();
            for (Attribute attribute : element.attributes()) {
                attributes.put(attribute.getKey(), attribute.getValue());
            }

            List<MarkupNode> children = new ArrayList<>();
            for (Node child : element.childNodes()) {
                convert(child, children);
            }

            if (VOID_TAGS.contains(element.tagName())) {
                out.add(new MarkupElement(element.tagName(), attributes, List.of()));
                out.addAll(children);
            } else {
                out.add(new MarkupElement(element.tagName(), attributes, children));
            }
        }
        // Comments, declarations and doctypes carry no content
    }
}
