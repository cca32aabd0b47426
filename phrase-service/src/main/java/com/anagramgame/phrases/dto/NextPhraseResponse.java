package com.anagramgame.phrases.dto;

import com.anagramgame.phrases.model.SelectionTier;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * The phrase to play now, plus the rest of the batch when prefetch was requested.
 */
@Data
@Builder
public class NextPhraseResponse {
    private SelectionTier tier;
    private PhraseResponse phrase;
    private List<PhraseResponse> batch;
    private int effectiveCeiling;
}
