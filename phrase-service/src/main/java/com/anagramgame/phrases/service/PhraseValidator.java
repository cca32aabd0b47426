package com.anagramgame.phrases.service;

import com.anagramgame.phrases.config.PhraseProperties;
import com.anagramgame.phrases.entity.Phrase;
import com.anagramgame.phrases.model.PhraseValidationResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks phrase content and hint shape before anything is persisted.
 * Pure: no lookups, no side effects.
 */
@Component
public class PhraseValidator {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern VALID_WORD = Pattern.compile("^[\\p{L}\\p{N}'\\-]+$");
    private static final Pattern HINT_WORD_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}'\\-]+");

    private final PhraseProperties.Validation rules;
    private final int maxHintLength;

    public PhraseValidator(PhraseProperties properties) {
        this.rules = properties.getValidation();
        // Never accept more than the columns can hold
        this.maxHintLength = Math.min(rules.getMaxHintLength(), Phrase.MAX_HINT_LENGTH);
    }

    /**
     * Validate content and optional hint, collecting every violation.
     */
    public PhraseValidationResult validate(String content, String hint) {
        List<String> errors = new ArrayList<>();

        String cleanContent = content == null ? "" : content.trim();
        List<String> words = new ArrayList<>();
        if (cleanContent.isEmpty()) {
            errors.add("Content cannot be empty");
        } else {
            words.addAll(Arrays.asList(WHITESPACE.split(cleanContent)));
            cleanContent = String.join(" ", words);
            validateWords(words, errors);
            if (codePoints(cleanContent) > Phrase.MAX_CONTENT_LENGTH) {
                errors.add(String.format("Phrase cannot be longer than %d characters", Phrase.MAX_CONTENT_LENGTH));
            }
        }

        String cleanHint = hint == null ? null : hint.trim();
        if (cleanHint != null && cleanHint.isEmpty()) {
            cleanHint = null;
        }
        if (cleanHint != null) {
            validateHint(cleanHint, words, errors);
        }

        return PhraseValidationResult.builder()
                .content(cleanContent)
                .hint(cleanHint)
                .errors(errors)
                .build();
    }

    private void validateWords(List<String> words, List<String> errors) {
        if (words.size() < rules.getMinWords()) {
            errors.add(String.format("Phrase must contain at least %d words", rules.getMinWords()));
        }
        if (words.size() > rules.getMaxWords()) {
            errors.add(String.format("Phrase cannot contain more than %d words", rules.getMaxWords()));
        }

        for (String word : words) {
            if (!VALID_WORD.matcher(word).matches()) {
                errors.add(String.format("Word '%s' can only contain letters, numbers, hyphens and apostrophes", word));
            }
            if (codePoints(word) > rules.getMaxWordLength()) {
                errors.add(String.format("Word '%s' is longer than %d characters", word, rules.getMaxWordLength()));
            }
        }
    }

    private void validateHint(String hint, List<String> contentWords, List<String> errors) {
        if (codePoints(hint) > maxHintLength) {
            errors.add(String.format("Hint cannot be longer than %d characters", maxHintLength));
        }

        Set<String> answerWords = new LinkedHashSet<>();
        for (String word : contentWords) {
            answerWords.add(word.toLowerCase(Locale.ROOT));
        }

        Set<String> leaked = new LinkedHashSet<>();
        for (String token : HINT_WORD_SEPARATOR.split(hint.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty() && answerWords.contains(token)) {
                leaked.add(token);
            }
        }
        for (String word : leaked) {
            errors.add(String.format("Hint cannot contain the word '%s' from the phrase", word));
        }
    }

    private static int codePoints(String value) {
        return value.codePointCount(0, value.length());
    }
}
