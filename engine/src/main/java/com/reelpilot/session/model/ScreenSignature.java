package com.reelpilot.session.model;

public record ScreenSignature(
    PageState state,
    String discriminator
) {
    public boolean isBlank() {
        return discriminator == null || discriminator.isBlank();
    }
}
