package com.reelpilot.session.screen;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class BundledLocatorsTest {

    @Autowired
    private LocatorCatalog catalog;

    @Test
    void everyElementHasLocators() {
        List<UiElement> missing = new ArrayList<>();
        for (UiElement element : UiElement.values()) {
            if (!catalog.has(element)) {
                missing.add(element);
            }
        }
        assertThat(missing).isEmpty();
    }
}
