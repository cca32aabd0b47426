package com.anagramgame.phrases.model;

/**
 * Per (player, phrase) progress. COMPLETED is terminal.
 */
public enum PhraseProgress {
    UNSEEN,
    SKIPPED,
    COMPLETED
}
