package com.anagramgame.phrases.service;

import org.springframework.stereotype.Component;

/**
 * Server-side score for a solved phrase when the client does not send one.
 */
@Component
public class CompletionScoreCalculator {

    /**
     * Start from the phrase difficulty and apply one penalty per hint level used:
     * 20% off for the first, then 25% and 33% off the running score (roughly 80/60/40%).
     */
    public int calculate(int difficultyScore, int hintsUsed) {
        int score = difficultyScore;
        if (hintsUsed >= 1) {
            score = (int) Math.round(score * 0.8);
        }
        if (hintsUsed >= 2) {
            score = (int) Math.round(score * 0.75);
        }
        if (hintsUsed >= 3) {
            score = (int) Math.round(score * 0.67);
        }
        return Math.max(1, score);
    }
}
