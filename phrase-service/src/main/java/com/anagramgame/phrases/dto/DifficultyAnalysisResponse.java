package com.anagramgame.phrases.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class DifficultyAnalysisResponse {
    private String phrase;
    private String language;
    private int score;
    private String difficulty;
    private int letterCount;
    private double letterRarity;
    private double structuralComplexity;
}
