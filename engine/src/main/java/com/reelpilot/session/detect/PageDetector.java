package com.reelpilot.session.detect;

import com.reelpilot.session.model.PageState;

public interface PageDetector {

    /**
     * Classifies the current screen. Only existence checks are made; nothing is clicked.
     */
    PageState classify();

    default boolean isOn(PageState state) {
        return classify() == state;
    }
}
