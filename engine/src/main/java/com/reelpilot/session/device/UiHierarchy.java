package com.reelpilot.session.device;

import com.reelpilot.session.screen.Bounds;
import com.reelpilot.session.screen.ScreenElement;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.jsoup.select.Selector;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed window hierarchy dump. uiautomator emits every view as {@code <node class="...">}; nodes
 * are renamed to their class so locators can address {@code //android.widget.TextView}.
 */
final class UiHierarchy {
    private static final Pattern BOUNDS = Pattern.compile("\\[(-?\\d+),(-?\\d+)]\\[(-?\\d+),(-?\\d+)]");
    private static final Pattern XML_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_.-]*");

    private final Document document;

    private UiHierarchy(Document document) {
        this.document = document;
    }

    static UiHierarchy parse(String xml) {
        Document document = Jsoup.parse(xml == null ? "" : xml, "", Parser.xmlParser());
        for (Element node : document.getElementsByTag("node")) {
            String className = node.attr("class");
            // inner classes ($) are not valid element names; they stay addressable as //node[@class]
            if (XML_NAME.matcher(className).matches()) {
                node.tagName(className);
            }
        }
        return new UiHierarchy(document);
    }

    /**
     * @throws Selector.SelectorParseException when {@code xpath} is not a valid expression
     */
    List<ScreenElement> select(String xpath) {
        List<ScreenElement> elements = new ArrayList<>();
        for (Element element : document.selectXpath(xpath)) {
            elements.add(toScreenElement(element));
        }
        return elements;
    }

    static Bounds parseBounds(String raw) {
        if (raw == null) {
            return null;
        }
        Matcher matcher = BOUNDS.matcher(raw);
        if (!matcher.find()) {
            return null;
        }
        return new Bounds(
            Integer.parseInt(matcher.group(1)),
            Integer.parseInt(matcher.group(2)),
            Integer.parseInt(matcher.group(3)),
            Integer.parseInt(matcher.group(4))
        );
    }

    private static ScreenElement toScreenElement(Element element) {
        return new ScreenElement(
            emptyToNull(element.attr("text")),
            emptyToNull(element.attr("content-desc")),
            parseBounds(element.attr("bounds")),
            "true".equals(element.attr("selected"))
        );
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
