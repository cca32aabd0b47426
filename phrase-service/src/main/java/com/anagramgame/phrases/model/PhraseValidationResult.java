package com.anagramgame.phrases.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of validating phrase content and hint. Carries the cleaned values
 * and every violation found, never just the first.
 */
@Data
@Builder
public class PhraseValidationResult {
    private String content;
    private String hint;
    @Builder.Default
    private List<String> errors = new ArrayList<>();

    public boolean isValid() {
        return errors.isEmpty();
    }
}
