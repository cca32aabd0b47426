package com.anagramgame.phrases.service;

import com.anagramgame.phrases.entity.Phrase;
import com.anagramgame.phrases.model.PlayerProfile;
import org.springframework.stereotype.Component;

/**
 * Display name for whoever sent a phrase: stored contributor name, then the
 * sending player's name, then "System".
 */
@Component
public class SenderNameResolver {

    public static final String SYSTEM_SENDER = "System";

    private final PlayerDirectory playerDirectory;

    public SenderNameResolver(PlayerDirectory playerDirectory) {
        this.playerDirectory = playerDirectory;
    }

    public String resolve(Phrase phrase) {
        if (phrase.getContributorName() != null && !phrase.getContributorName().isBlank()) {
            return phrase.getContributorName();
        }
        if (phrase.getCreatedByPlayerId() != null) {
            return playerDirectory.findPlayer(phrase.getCreatedByPlayerId())
                    .map(PlayerProfile::getName)
                    .orElse(SYSTEM_SENDER);
        }
        return SYSTEM_SENDER;
    }
}
