package com.anagramgame.phrases.service;

import com.anagramgame.phrases.entity.CompletionRecord;
import com.anagramgame.phrases.entity.Phrase;
import com.anagramgame.phrases.event.PhraseCompletedEvent;
import com.anagramgame.phrases.exception.PhraseNotFoundException;
import com.anagramgame.phrases.model.PhraseProgress;
import com.anagramgame.phrases.model.TrackingResult;
import com.anagramgame.phrases.repository.PhraseStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

/**
 * Records completions and skips. Retried calls are successful no-ops and never double-score.
 */
@Slf4j
@Service
public class PhraseProgressTracker {

    private final PhraseStore store;
    private final CompletionScoreCalculator scoreCalculator;
    private final ApplicationEventPublisher eventPublisher;

    public PhraseProgressTracker(PhraseStore store,
                                 CompletionScoreCalculator scoreCalculator,
                                 ApplicationEventPublisher eventPublisher) {
        this.store = store;
        this.scoreCalculator = scoreCalculator;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Record that a player solved a phrase. When {@code score} is null it is derived from
     * the phrase difficulty and the hints used.
     */
    @Transactional
    public TrackingResult complete(UUID playerId, UUID phraseId, Integer score, int hintsUsed, long timeMs) {
        Phrase phrase = store.findPhrase(phraseId)
                .orElseThrow(() -> new PhraseNotFoundException(phraseId));

        int hints = Math.max(0, hintsUsed);
        int finalScore = score != null ? score : scoreCalculator.calculate(phrase.getDifficultyScore(), hints);

        boolean recorded = store.recordCompletion(playerId, phraseId, finalScore, hints, Math.max(0L, timeMs));
        if (!recorded) {
            log.debug("Completion of phrase {} by player {} already recorded", phraseId, playerId);
            Integer storedScore = store.findCompletion(playerId, phraseId)
                    .map(CompletionRecord::getScore)
                    .orElse(null);
            return TrackingResult.builder()
                    .playerId(playerId)
                    .phraseId(phraseId)
                    .recorded(false)
                    .progress(PhraseProgress.COMPLETED)
                    .score(storedScore)
                    .build();
        }

        store.incrementUsageCount(phraseId);
        log.info("Player {} completed phrase {} with score {}", playerId, phraseId, finalScore);

        UUID authorId = phrase.getCreatedByPlayerId();
        if (authorId != null && !authorId.equals(playerId)) {
            eventPublisher.publishEvent(
                    new PhraseCompletedEvent(this, phraseId, playerId, authorId, finalScore, Instant.now()));
        }

        return TrackingResult.builder()
                .playerId(playerId)
                .phraseId(phraseId)
                .recorded(true)
                .progress(PhraseProgress.COMPLETED)
                .score(finalScore)
                .build();
    }

    /**
     * Defer a phrase for this player only. Has no effect once the phrase is completed.
     */
    @Transactional
    public TrackingResult skip(UUID playerId, UUID phraseId) {
        if (store.findPhrase(phraseId).isEmpty()) {
            throw new PhraseNotFoundException(phraseId);
        }

        boolean recorded = store.recordSkip(playerId, phraseId);
        if (recorded) {
            store.incrementUsageCount(phraseId);
            log.info("Player {} skipped phrase {}", playerId, phraseId);
        } else {
            log.debug("Skip of phrase {} by player {} ignored", phraseId, playerId);
        }

        return TrackingResult.builder()
                .playerId(playerId)
                .phraseId(phraseId)
                .recorded(recorded)
                .progress(store.progressOf(playerId, phraseId))
                .build();
    }
}
