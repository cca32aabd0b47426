package com.anagramgame.difficulty;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Languages a phrase can be written in, each with its letter frequency table.
 */
public enum Language {
    EN("en", "abcdefghijklmnopqrstuvwxyz", new int[]{
            82, 15, 28, 43, 127, 22, 20, 61, 70, 2, 8, 40, 24,
            67, 75, 19, 1, 60, 63, 91, 28, 10, 24, 2, 20, 1
    }),
    SV("sv", "abcdefghijklmnopqrstuvwxyzåäö", new int[]{
            94, 13, 15, 45, 101, 20, 28, 21, 58, 6, 32, 52, 35,
            89, 44, 18, 0, 84, 68, 77, 18, 24, 1, 1, 7, 1, 18, 18, 13
    });

    private final String code;
    private final String alphabet;
    private final Map<Character, Integer> frequencies;

    Language(String code, String alphabet, int[] frequencies) {
        this.code = code;
        this.alphabet = alphabet;
        this.frequencies = new HashMap<>();
        for (int i = 0; i < alphabet.length(); i++) {
            this.frequencies.put(alphabet.charAt(i), frequencies[i]);
        }
    }

    public String getCode() {
        return code;
    }

    /**
     * Occurrences per 1000 letters of typical text, 0 for letters outside the alphabet.
     */
    public int frequencyOf(char letter) {
        return frequencies.getOrDefault(letter, 0);
    }

    public boolean isLetter(char c) {
        return alphabet.indexOf(c) >= 0;
    }

    /**
     * Lower-case the text and keep only this language's letters.
     */
    public String normalize(String text) {
        if (text == null) {
            return "";
        }
        String lower = text.toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(lower.length());
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            if (isLetter(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Parse a language code such as "en" or "SV".
     */
    public static Language fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Language code is required");
        }
        for (Language language : values()) {
            if (language.code.equalsIgnoreCase(code.trim())) {
                return language;
            }
        }
        throw new IllegalArgumentException("Unsupported language: " + code);
    }

    public static Language fromCodeOrDefault(String code) {
        if (code == null || code.isBlank()) {
            return EN;
        }
        try {
            return fromCode(code);
        } catch (IllegalArgumentException e) {
            return EN;
        }
    }
}
