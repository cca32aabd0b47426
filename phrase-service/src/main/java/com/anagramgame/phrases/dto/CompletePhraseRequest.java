package com.anagramgame.phrases.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class CompletePhraseRequest {

    @Min(value = 0, message = "Score cannot be negative")
    private Integer score; // Optional, computed from difficulty and hints when absent

    @Min(value = 0, message = "Hints used cannot be negative")
    @Max(value = 3, message = "At most 3 hints can be used")
    private int hintsUsed;

    @Min(value = 0, message = "Completion time cannot be negative")
    private long completionTimeMs;
}
