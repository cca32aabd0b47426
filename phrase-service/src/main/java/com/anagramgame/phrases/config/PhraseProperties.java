package com.anagramgame.phrases.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Tunables for phrase validation, selection and moderation, bound from {@code phrases.*}.
 */
@Data
@ConfigurationProperties(prefix = "phrases")
public class PhraseProperties {

    private Validation validation = new Validation();
    private Selection selection = new Selection();
    private Moderation moderation = new Moderation();
    private List<SkillLevel> skillLevels = new ArrayList<>();

    /**
     * Whole phrases are capped at 200 characters and hints at 300 by the storage columns,
     * whatever these settings say.
     */
    @Data
    public static class Validation {
        private int minWords = 2;
        private int maxWords = 6;
        private int maxWordLength = 7;
        private int maxHintLength = 300;
    }

    @Data
    public static class Selection {
        /**
         * Players whose ceiling is below this value draw from the widened beginner pool.
         */
        private int beginnerThreshold = 50;
        private int beginnerCeiling = 75;
        private int batchSize = 25;
        private int defaultCeiling = 100;
    }

    @Data
    public static class Moderation {
        private boolean autoApproveGlobal = false;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SkillLevel {
        private String title;
        private int minScore;
        private int maxDifficulty;
    }
}
