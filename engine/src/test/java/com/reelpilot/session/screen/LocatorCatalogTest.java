package com.reelpilot.session.screen;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

class LocatorCatalogTest {

    @Test
    void unknownKeysAndBlankExpressionsAreIgnored() {
        LocatorCatalog catalog = new LocatorCatalog(
            Map.of(
                "like-button", List.of(" //*[@content-desc='Like'] ", ""),
                "no-such-element", List.of("//*")
            ),
            null
        );

        assertEquals(List.of("//*[@content-desc='Like']"), catalog.get(UiElement.LIKE_BUTTON).xpaths());
        assertFalse(catalog.has(UiElement.HOME_TAB));
        assertEquals("home-tab", catalog.get(UiElement.HOME_TAB).name());
    }

    @Test
    void alternateDropsTheMostSpecificExpression() {
        LocatorCatalog catalog = new LocatorCatalog(
            Map.of(
                "home-tab", List.of("//a", "//b", "//c"),
                "like-button", List.of("//only")
            ),
            Map.of()
        );

        LocatorSet alternate = catalog.alternate(UiElement.HOME_TAB);
        assertEquals("home-tab:alternate", alternate.name());
        assertEquals(List.of("//b", "//c"), alternate.xpaths());
        assertNull(catalog.alternate(UiElement.LIKE_BUTTON));
    }

    @Test
    void explicitAlternateWins() {
        LocatorCatalog catalog = new LocatorCatalog(
            Map.of("home-tab", List.of("//a", "//b")),
            Map.of("Home_Tab", List.of("//z"))
        );

        assertEquals(List.of("//z"), catalog.alternate(UiElement.HOME_TAB).xpaths());
    }
}
