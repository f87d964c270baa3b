package com.reelpilot.session.action;

/**
 * Where the target is being acted on; decides which buttons are pressed.
 */
public enum Surface {
    VIDEO,
    PROFILE,
    STORY
}
