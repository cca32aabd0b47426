package com.anagramgame.phrases.exception;

import java.util.UUID;

public class PlayerNotFoundException extends RuntimeException {

    private final UUID playerId;

    public PlayerNotFoundException(UUID playerId) {
        super(String.format("Player with ID %s not found", playerId));
        this.playerId = playerId;
    }

    public UUID getPlayerId() {
        return playerId;
    }
}
