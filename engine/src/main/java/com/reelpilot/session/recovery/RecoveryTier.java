package com.reelpilot.session.recovery;

public enum RecoveryTier {
    /** Popups or a back press cleared the condition. */
    SOFT,
    /** App restarted and checkpoint reached. */
    HARD,
    FAILED
}
