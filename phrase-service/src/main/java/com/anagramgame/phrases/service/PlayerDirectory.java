package com.anagramgame.phrases.service;

import com.anagramgame.phrases.model.PlayerProfile;

import java.util.Optional;
import java.util.UUID;

/**
 * Read-only access to players, which are owned by the registration service.
 */
public interface PlayerDirectory {

    Optional<PlayerProfile> findPlayer(UUID playerId);

    default boolean exists(UUID playerId) {
        return findPlayer(playerId).isPresent();
    }
}
