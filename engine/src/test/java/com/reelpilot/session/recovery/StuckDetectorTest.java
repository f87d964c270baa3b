package com.reelpilot.session.recovery;

import com.reelpilot.session.model.PageState;
import com.reelpilot.session.model.ScreenSignature;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StuckDetectorTest {
    private static final ScreenSignature A = new ScreenSignature(PageState.FEED, "alice_10");
    private static final ScreenSignature B = new ScreenSignature(PageState.FEED, "bob_3");

    @Test
    void firesOnThirdIdenticalSignatureAndResets() {
        StuckDetector detector = new StuckDetector(3);

        assertFalse(detector.observe(A));
        assertFalse(detector.observe(A));
        assertTrue(detector.observe(A));
        assertEquals(0, detector.repeats());
        assertFalse(detector.observe(A));
    }

    @Test
    void differentSignatureRestartsTheCount() {
        StuckDetector detector = new StuckDetector(3);

        detector.observe(A);
        detector.observe(A);
        assertFalse(detector.observe(B));
        assertEquals(1, detector.repeats());
    }

    @Test
    void blankSignaturesNeverCount() {
        StuckDetector detector = new StuckDetector(2);
        ScreenSignature blank = new ScreenSignature(PageState.FEED, " ");

        assertFalse(detector.observe(blank));
        assertFalse(detector.observe(blank));
        assertFalse(detector.observe(null));
        assertEquals(0, detector.repeats());
    }

    @Test
    void thresholdBelowTwoIsRaised() {
        assertEquals(2, new StuckDetector(1).threshold());
        assertEquals(2, new StuckDetector(-4).threshold());
    }
}
