package com.reelpilot.session.model;

/**
 * A thread row of the inbox. {@code name} is what the row shows: a username for one-to-one
 * threads, a free-form title for groups and system threads.
 */
public record InboxConversation(
    String name,
    int centerX,
    int centerY
) {
}
