package com.reelpilot.session.recovery;

import com.reelpilot.session.model.PageState;

import java.util.function.BooleanSupplier;

/**
 * Last known good position of a workflow and the navigation that gets back to it.
 */
public record Checkpoint(
    PageState state,
    String description,
    BooleanSupplier reach
) {
}
