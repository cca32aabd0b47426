package com.anagramgame.phrases.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class PhraseStatsResponse {
    private long totalPhrases;
    private long globalPhrases;
    private long targetedPhrases;
    private double averageUsage;
    private int maxUsage;
}
