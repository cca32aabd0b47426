package com.anagramgame.phrases.exception;

import java.util.List;

/**
 * Thrown when phrase content or hint breaks the shape rules. Carries every violation found.
 */
public class PhraseValidationException extends RuntimeException {

    private final List<String> errors;

    public PhraseValidationException(List<String> errors) {
        super("Validation failed: " + String.join(", ", errors));
        this.errors = List.copyOf(errors);
    }

    public PhraseValidationException(String error) {
        this(List.of(error));
    }

    public List<String> getErrors() {
        return errors;
    }
}
