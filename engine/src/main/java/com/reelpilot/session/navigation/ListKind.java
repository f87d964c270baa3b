package com.reelpilot.session.navigation;

public enum ListKind {
    FOLLOWERS,
    FOLLOWING
}
