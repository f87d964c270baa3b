package com.reelpilot.session.screen;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Element to locator table. An explicit alternate set can be configured per element; otherwise
 * the alternate is the primary list without its first (most specific) expression.
 */
public class LocatorCatalog {
    private static final Logger log = LoggerFactory.getLogger(LocatorCatalog.class);

    private final Map<UiElement, LocatorSet> primary = new EnumMap<>(UiElement.class);
    private final Map<UiElement, LocatorSet> alternates = new EnumMap<>(UiElement.class);

    public LocatorCatalog(Map<String, List<String>> locators, Map<String, List<String>> alternateLocators) {
        load(locators, primary);
        load(alternateLocators, alternates);
        List<String> missing = new ArrayList<>();
        for (UiElement element : UiElement.values()) {
            if (!primary.containsKey(element)) {
                missing.add(element.key());
            }
        }
        if (!missing.isEmpty()) {
            log.warn("No locators configured for {} elements: {}", missing.size(), missing);
        }
    }

    public LocatorSet get(UiElement element) {
        LocatorSet set = primary.get(element);
        return set == null ? new LocatorSet(element.key(), List.of()) : set;
    }

    public LocatorSet alternate(UiElement element) {
        LocatorSet explicit = alternates.get(element);
        if (explicit != null) {
            return explicit;
        }
        LocatorSet set = get(element);
        if (set.xpaths().size() < 2) {
            return null;
        }
        return new LocatorSet(element.key() + ":alternate", set.xpaths().subList(1, set.xpaths().size()));
    }

    public boolean has(UiElement element) {
        return !get(element).isEmpty();
    }

    private static void load(Map<String, List<String>> source, Map<UiElement, LocatorSet> target) {
        if (source == null) {
            return;
        }
        for (Map.Entry<String, List<String>> entry : source.entrySet()) {
            UiElement element = UiElement.fromKey(entry.getKey());
            if (element == null) {
                log.warn("Ignoring locator for unknown element '{}'", entry.getKey());
                continue;
            }
            List<String> xpaths = new ArrayList<>();
            if (entry.getValue() != null) {
                for (String xpath : entry.getValue()) {
                    if (xpath != null && !xpath.isBlank()) {
                        xpaths.add(xpath.trim());
                    }
                }
            }
            if (!xpaths.isEmpty()) {
                target.put(element, new LocatorSet(element.key(), xpaths));
            }
        }
    }
}
