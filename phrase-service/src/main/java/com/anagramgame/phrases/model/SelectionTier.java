package com.anagramgame.phrases.model;

/**
 * Where a selected phrase came from, in the order the tiers are consulted.
 */
public enum SelectionTier {
    /**
     * Sent privately to the player and not yet delivered. Never difficulty filtered.
     */
    TARGETED,

    /**
     * Approved global phrase under the player's effective difficulty ceiling.
     */
    GLOBAL,

    /**
     * A phrase the player skipped earlier, offered again once everything else is exhausted.
     */
    SKIP_FALLBACK
}
