package com.reelpilot.session.recovery;

/**
 * Scroll attempts to spend looking for unseen rows, from how much of the list was already visited.
 */
public final class SmartScrollBudget {

    private SmartScrollBudget() {}

    /**
     * @param alreadyVisited targets of this list already in the ledger
     * @param totalKnown     list size when known, otherwise null
     * @return one of 5, 10, 15, 20 (20 only when the total is known)
     */
    public static int attempts(int alreadyVisited, Long totalKnown) {
        int visited = Math.max(0, alreadyVisited);
        if (totalKnown != null && totalKnown > 0) {
            double ratio = (double) visited / totalKnown;
            if (ratio >= 0.9) {
                return 5;
            }
            if (ratio >= 0.7) {
                return 10;
            }
            if (ratio >= 0.5) {
                return 15;
            }
            return 20;
        }
        if (visited < 50) {
            return 15;
        }
        if (visited < 100) {
            return 10;
        }
        return 5;
    }
}
