package com.anagramgame.phrases.model;

import com.anagramgame.phrases.entity.Phrase;
import com.anagramgame.phrases.entity.PhraseAssignment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Result of one selection request: a ranked, immediately playable batch from a single tier.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PhraseSelection {
    private UUID playerId;
    private SelectionTier tier;
    @Builder.Default
    private List<Phrase> phrases = new ArrayList<>();
    private PhraseAssignment assignment; // Only for TARGETED
    private int effectiveCeiling;

    public static PhraseSelection empty(UUID playerId, int effectiveCeiling) {
        return PhraseSelection.builder()
                .playerId(playerId)
                .effectiveCeiling(effectiveCeiling)
                .build();
    }

    public boolean isEmpty() {
        return phrases == null || phrases.isEmpty();
    }

    public Phrase first() {
        return isEmpty() ? null : phrases.get(0);
    }
}
