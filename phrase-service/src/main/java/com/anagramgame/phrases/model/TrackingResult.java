package com.anagramgame.phrases.model;

import lombok.Builder;
import lombok.Data;

import java.util.UUID;

/**
 * Outcome of a completion or skip. {@code recorded} is false when the call was a retry
 * or the phrase was already completed; that is a successful no-op, not a failure.
 */
@Data
@Builder
public class TrackingResult {
    private UUID playerId;
    private UUID phraseId;
    private boolean recorded;
    private PhraseProgress progress;
    private Integer score; // Only for completions
}
