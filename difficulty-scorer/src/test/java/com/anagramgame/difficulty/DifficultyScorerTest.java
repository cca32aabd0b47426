package com.anagramgame.difficulty;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DifficultyScorerTest {

    private final DifficultyScorer scorer = new DifficultyScorer();

    @Test
    void testCommonLettersScoreLow() {
        // helloworld: mean rarity ~20.75, every bigram unique
        assertEquals(45, scorer.score("hello world", Language.EN), "hello world should score 45");
    }

    @Test
    void testRareLettersClampToMaximum() {
        assertEquals(100, scorer.score("jazz quiz", Language.EN), "Rare letters should clamp at 100");
    }

    @Test
    void testRepeatedLettersReduceComplexity() {
        DifficultyScore score = scorer.analyze("aaaa aaaa", Language.EN);
        assertEquals(13, score.getTotalScore());
        assertEquals(8, score.getLetterCount());
        assertEquals(100.0 / 7, score.getComplexity(), 0.0001, "One unique bigram out of seven");
    }

    @Test
    void testSwedishLettersOnlyCountInSwedish() {
        assertEquals(62, scorer.score("sjö kärlek", Language.SV));
        // In English the å/ä/ö are dropped before scoring
        assertEquals(100, scorer.score("sjö kärlek", Language.EN));
    }

    @Test
    void testSingleLetterHasNoComplexity() {
        DifficultyScore score = scorer.analyze("a", Language.EN);
        assertEquals(0.0, score.getComplexity());
        assertEquals(9, score.getTotalScore());
    }

    @Test
    void testEmptyAndNullInputScoreMinimum() {
        assertEquals(1, scorer.score("", Language.EN));
        assertEquals(1, scorer.score("123 456", Language.EN), "Digits are not letters");
        assertEquals(1, scorer.score(null, Language.SV));
    }

    @Test
    void testNullLanguageDefaultsToEnglish() {
        assertEquals(scorer.score("be kind", Language.EN), scorer.score("be kind", null));
    }

    @Test
    void testScoringIsDeterministic() {
        int first = scorer.score("lilla åsnan", Language.SV);
        for (int i = 0; i < 10; i++) {
            assertEquals(first, scorer.score("lilla åsnan", Language.SV));
        }
    }

    @Test
    void testBreakdownDescribesComponents() {
        DifficultyScore score = scorer.analyze("eat tea", Language.EN);
        assertEquals(2, score.getComponents().size());
        assertEquals(31, score.getTotalScore());
        assertEquals(DifficultyLabel.EASY, score.getLabel());
        assertTrue(score.toString().contains("Letter rarity"));
    }
}
