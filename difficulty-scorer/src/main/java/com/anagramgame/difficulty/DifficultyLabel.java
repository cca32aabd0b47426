package com.anagramgame.difficulty;

/**
 * Human readable bands over the 1-100 difficulty scale.
 */
public enum DifficultyLabel {
    VERY_EASY("Very Easy", 20),
    EASY("Easy", 40),
    MEDIUM("Medium", 60),
    HARD("Hard", 80),
    VERY_HARD("Very Hard", 100);

    private final String displayName;
    private final int upperBound;

    DifficultyLabel(String displayName, int upperBound) {
        this.displayName = displayName;
        this.upperBound = upperBound;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getUpperBound() {
        return upperBound;
    }

    public static DifficultyLabel forScore(int score) {
        for (DifficultyLabel label : values()) {
            if (score <= label.upperBound) {
                return label;
            }
        }
        return VERY_HARD;
    }
}
