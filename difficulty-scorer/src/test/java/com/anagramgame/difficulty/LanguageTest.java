package com.anagramgame.difficulty;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LanguageTest {

    @Test
    void testFromCodeIgnoresCase() {
        assertEquals(Language.SV, Language.fromCode("SV"));
        assertEquals(Language.EN, Language.fromCode(" en "));
    }

    @Test
    void testFromCodeRejectsUnknown() {
        assertThrows(IllegalArgumentException.class, () -> Language.fromCode("de"));
        assertThrows(IllegalArgumentException.class, () -> Language.fromCode(null));
    }

    @Test
    void testFromCodeOrDefaultFallsBackToEnglish() {
        assertEquals(Language.EN, Language.fromCodeOrDefault("xx"));
        assertEquals(Language.EN, Language.fromCodeOrDefault(null));
        assertEquals(Language.SV, Language.fromCodeOrDefault("sv"));
    }

    @Test
    void testNormalizeKeepsOnlyLanguageLetters() {
        assertEquals("kärlek", Language.SV.normalize("Kär-lek!"));
        assertEquals("krlek", Language.EN.normalize("Kär-lek!"));
        assertEquals("", Language.EN.normalize(null));
    }

    @Test
    void testFrequencyTable() {
        assertEquals(127, Language.EN.frequencyOf('e'));
        assertEquals(0, Language.SV.frequencyOf('q'));
        assertEquals(0, Language.EN.frequencyOf('ö'));
    }

    @Test
    void testDifficultyLabels() {
        assertEquals(DifficultyLabel.VERY_EASY, DifficultyLabel.forScore(20));
        assertEquals(DifficultyLabel.EASY, DifficultyLabel.forScore(21));
        assertEquals(DifficultyLabel.MEDIUM, DifficultyLabel.forScore(60));
        assertEquals(DifficultyLabel.HARD, DifficultyLabel.forScore(80));
        assertEquals(DifficultyLabel.VERY_HARD, DifficultyLabel.forScore(81));
        assertEquals("Very Hard", DifficultyLabel.forScore(100).getDisplayName());
    }
}
