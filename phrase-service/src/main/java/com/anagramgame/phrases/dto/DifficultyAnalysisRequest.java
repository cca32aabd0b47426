package com.anagramgame.phrases.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class DifficultyAnalysisRequest {

    @NotBlank(message = "Phrase is required")
    private String phrase;

    private String language;
}
