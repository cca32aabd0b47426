package com.anagramgame.phrases.service;

import com.anagramgame.phrases.model.PlayerProfile;
import com.anagramgame.phrases.repository.PlayerRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

@Service
public class JpaPlayerDirectory implements PlayerDirectory {

    private final PlayerRepository playerRepository;

    public JpaPlayerDirectory(PlayerRepository playerRepository) {
        this.playerRepository = playerRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<PlayerProfile> findPlayer(UUID playerId) {
        if (playerId == null) {
            return Optional.empty();
        }
        return playerRepository.findById(playerId)
                .map(p -> new PlayerProfile(p.getId(), p.getName(), p.getTotalScore()));
    }
}
