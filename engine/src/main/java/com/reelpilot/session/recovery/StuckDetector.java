package com.reelpilot.session.recovery;

import com.reelpilot.session.model.ScreenSignature;

/**
 * Declares non-progress on the Nth consecutive identical signature. Blank signatures carry no
 * information and reset the run.
 */
public class StuckDetector {
    private final int threshold;
    private ScreenSignature last;
    private int repeats;

    public StuckDetector(int threshold) {
        this.threshold = Math.max(2, threshold);
    }

    public boolean observe(ScreenSignature signature) {
        if (signature == null || signature.isBlank()) {
            reset();
            return false;
        }
        if (signature.equals(last)) {
            repeats++;
        } else {
            last = signature;
            repeats = 1;
        }
        if (repeats >= threshold) {
            reset();
            return true;
        }
        return false;
    }

    public void reset() {
        last = null;
        repeats = 0;
    }

    public int repeats() {
        return repeats;
    }

    public int threshold() {
        return threshold;
    }
}
