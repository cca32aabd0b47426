package com.anagramgame.phrases.service;

import com.anagramgame.phrases.config.PhraseProperties;
import com.anagramgame.phrases.model.PlayerProfile;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps a player's accumulated score to the highest difficulty they may draw from the global pool.
 */
@Component
public class DifficultyCeilingResolver {

    private final List<PhraseProperties.SkillLevel> levels;
    private final int defaultCeiling;

    public DifficultyCeilingResolver(PhraseProperties properties) {
        this.levels = properties.getSkillLevels().stream()
                .sorted(Comparator.comparingInt(PhraseProperties.SkillLevel::getMinScore))
                .collect(Collectors.toList());
        this.defaultCeiling = properties.getSelection().getDefaultCeiling();
    }

    public int ceilingFor(PlayerProfile player) {
        PhraseProperties.SkillLevel reached = null;
        for (PhraseProperties.SkillLevel level : levels) {
            if (player.getTotalScore() >= level.getMinScore()) {
                reached = level;
            }
        }
        return reached != null ? reached.getMaxDifficulty() : defaultCeiling;
    }
}
