package com.anagramgame.difficulty;

import java.util.ArrayList;
import java.util.List;

/**
 * Represents the detailed breakdown of a phrase difficulty score.
 */
public class DifficultyScore {
    private final List<ScoreComponent> components;
    private final int letterCount;
    private final int totalScore;

    public DifficultyScore(List<ScoreComponent> components, int letterCount, int totalScore) {
        this.components = new ArrayList<>(components);
        this.letterCount = letterCount;
        this.totalScore = totalScore;
    }

    public static DifficultyScore minimum() {
        return new DifficultyScore(new ArrayList<>(), 0, DifficultyScorer.MIN_SCORE);
    }

    public List<ScoreComponent> getComponents() {
        return new ArrayList<>(components);
    }

    public int getLetterCount() {
        return letterCount;
    }

    public int getTotalScore() {
        return totalScore;
    }

    public DifficultyLabel getLabel() {
        return DifficultyLabel.forScore(totalScore);
    }

    public double getRarity() {
        return valueOf(ScoreType.LETTER_RARITY);
    }

    public double getComplexity() {
        return valueOf(ScoreType.STRUCTURAL_COMPLEXITY);
    }

    private double valueOf(ScoreType type) {
        return components.stream()
                .filter(c -> c.getType() == type)
                .mapToDouble(ScoreComponent::getRawValue)
                .sum();
    }

    @Override
    public String toString() {
        if (components.isEmpty()) {
            return "Total: " + totalScore + " (" + getLabel().getDisplayName() + ")";
        }

        StringBuilder sb = new StringBuilder();
        sb.append("Difficulty Breakdown:\n");
        for (ScoreComponent component : components) {
            sb.append("  ").append(component).append("\n");
        }
        sb.append("Total: ").append(totalScore).append(" (").append(getLabel().getDisplayName()).append(")");
        return sb.toString();
    }

    public enum ScoreType {
        LETTER_RARITY("Letter rarity", 0.7),
        STRUCTURAL_COMPLEXITY("Structural complexity", 0.3);

        private final String displayName;
        private final double weight;

        ScoreType(String displayName, double weight) {
            this.displayName = displayName;
            this.weight = weight;
        }

        public String getDisplayName() {
            return displayName;
        }

        public double getWeight() {
            return weight;
        }
    }

    public static class ScoreComponent {
        private final ScoreType type;
        private final double rawValue;

        public ScoreComponent(ScoreType type, double rawValue) {
            this.type = type;
            this.rawValue = rawValue;
        }

        public ScoreType getType() {
            return type;
        }

        public double getRawValue() {
            return rawValue;
        }

        public double getWeightedValue() {
            return rawValue * type.getWeight();
        }

        @Override
        public String toString() {
            return String.format("%s: %.1f (weighted %.1f)", type.getDisplayName(), rawValue, getWeightedValue());
        }
    }
}
