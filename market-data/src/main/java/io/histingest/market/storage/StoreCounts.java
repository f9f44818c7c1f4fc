package io.histingest.market.storage;

/**
 * Outcome of one store call. {@code inserted + alreadyPresent == attempted}.
 */
public record StoreCounts(int attempted, int inserted, int alreadyPresent) {
    public static final StoreCounts NONE = new StoreCounts(0, 0, 0);

    /** Records now persisted for this call, whether new or already there. */
    public int stored() { return attempted; }
}
