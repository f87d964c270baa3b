package com.reelpilot.session.util;

public enum ErrorKind {
    NOT_FOUND,
    TRANSIENT,
    FATAL
}
