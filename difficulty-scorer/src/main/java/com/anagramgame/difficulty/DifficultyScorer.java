package com.anagramgame.difficulty;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Scores anagram phrases from 1 (trivial) to 100 (very hard).
 *
 * <p>The score combines how rare the phrase's letters are in the chosen language
 * (70%) with how varied its letter pairs are (30%). The computation is pure and
 * deterministic, so a phrase scored once keeps the same score forever.</p>
 */
public class DifficultyScorer {

    public static final int MIN_SCORE = 1;
    public static final int MAX_SCORE = 100;

    /**
     * Score a phrase.
     *
     * @param phrase   The phrase text, words separated by whitespace
     * @param language The language whose letter frequencies apply
     * @return score in [1, 100]
     */
    public int score(String phrase, Language language) {
        return analyze(phrase, language).getTotalScore();
    }

    /**
     * Score a phrase and keep the component breakdown.
     */
    public DifficultyScore analyze(String phrase, Language language) {
        Language effective = language != null ? language : Language.EN;
        String letters = effective.normalize(phrase);
        if (letters.isEmpty()) {
            return DifficultyScore.minimum();
        }

        List<DifficultyScore.ScoreComponent> components = new ArrayList<>();
        components.add(new DifficultyScore.ScoreComponent(
                DifficultyScore.ScoreType.LETTER_RARITY,
                letterRarity(letters, effective)
        ));
        components.add(new DifficultyScore.ScoreComponent(
                DifficultyScore.ScoreType.STRUCTURAL_COMPLEXITY,
                structuralComplexity(letters)
        ));

        double combined = components.stream()
                .mapToDouble(DifficultyScore.ScoreComponent::getWeightedValue)
                .sum();
        int total = (int) Math.max(MIN_SCORE, Math.min(MAX_SCORE, Math.round(combined)));

        return new DifficultyScore(components, letters.length(), total);
    }

    private double letterRarity(String letters, Language language) {
        double totalRarity = 0;
        for (int i = 0; i < letters.length(); i++) {
            int frequency = language.frequencyOf(letters.charAt(i));
            // Letters that never show up in the corpus count as the rarest
            totalRarity += 1000.0 / (frequency > 0 ? frequency : 1);
        }
        return totalRarity / letters.length();
    }

    private double structuralComplexity(String letters) {
        if (letters.length() < 2) {
            return 0;
        }

        Set<String> bigrams = new HashSet<>();
        int totalBigrams = 0;
        for (int i = 0; i < letters.length() - 1; i++) {
            bigrams.add(letters.substring(i, i + 2));
            totalBigrams++;
        }

        return (double) bigrams.size() / totalBigrams * 100;
    }
}
