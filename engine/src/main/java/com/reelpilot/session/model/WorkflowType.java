package com.reelpilot.session.model;

import java.util.Locale;

public enum WorkflowType {
    FEED,
    FOLLOWERS,
    SEARCH,
    SCRAPER,
    UNFOLLOW,
    DM;

    public static WorkflowType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String key = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if ("FOR_YOU".equals(key)) {
            return FEED;
        }
        if ("DIRECT_MESSAGES".equals(key) || "MESSAGES".equals(key)) {
            return DM;
        }
        for (WorkflowType type : values()) {
            if (type.name().equals(key)) {
                return type;
            }
        }
        return null;
    }
}
