package com.anagramgame.phrases.exception;

import java.util.UUID;

public class PhraseNotFoundException extends RuntimeException {

    private final UUID phraseId;

    public PhraseNotFoundException(UUID phraseId) {
        super(String.format("Phrase with ID %s not found", phraseId));
        this.phraseId = phraseId;
    }

    public UUID getPhraseId() {
        return phraseId;
    }
}
