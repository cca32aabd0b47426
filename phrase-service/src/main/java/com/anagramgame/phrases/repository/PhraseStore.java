package com.anagramgame.phrases.repository;

import com.anagramgame.phrases.entity.CompletionRecord;
import com.anagramgame.phrases.entity.Phrase;
import com.anagramgame.phrases.entity.PhraseAssignment;
import com.anagramgame.phrases.model.PhraseProgress;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Transactional operations over phrases, assignments, skips and completions.
 *
 * <p>All writes to skip and completion records go through conflict-ignoring inserts backed
 * by unique constraints, so concurrent duplicates settle on exactly one row and the losing
 * call simply reports that nothing was written.</p>
 */
@Slf4j
@Component
public class PhraseStore {

    private final PhraseRepository phraseRepository;
    private final PhraseAssignmentRepository assignmentRepository;
    private final SkipRecordRepository skipRepository;
    private final CompletionRecordRepository completionRepository;

    public PhraseStore(PhraseRepository phraseRepository,
                       PhraseAssignmentRepository assignmentRepository,
                       SkipRecordRepository skipRepository,
                       CompletionRecordRepository completionRepository) {
        this.phraseRepository = phraseRepository;
        this.assignmentRepository = assignmentRepository;
        this.skipRepository = skipRepository;
        this.completionRepository = completionRepository;
    }

    /**
     * Insert the phrase and one assignment per distinct target in a single transaction.
     * Any failure rolls back the phrase as well.
     */
    @Transactional
    public Phrase createPhraseWithTargets(Phrase phrase, Collection<UUID> targetPlayerIds) {
        Phrase saved = phraseRepository.saveAndFlush(phrase);

        Instant assignedAt = Instant.now();
        int assigned = 0;
        for (UUID targetId : new LinkedHashSet<>(targetPlayerIds)) {
            assigned += assignmentRepository.insertIgnoringConflict(
                    UUID.randomUUID(),
                    saved.getId(),
                    targetId,
                    PhraseAssignment.DEFAULT_PRIORITY,
                    assignedAt
            );
        }

        log.debug("Stored phrase {} with {} assignment(s)", saved.getId(), assigned);
        return saved;
    }

    /**
     * Oldest, highest-priority undelivered assignment whose phrase the player has neither
     * skipped nor completed.
     */
    @Transactional(readOnly = true)
    public Optional<PhraseAssignment> nextTargetedAssignment(UUID playerId) {
        List<PhraseAssignment> inbox = assignmentRepository.findInbox(playerId, PageRequest.of(0, 1));
        return inbox.stream().findFirst();
    }

    @Transactional(readOnly = true)
    public List<Phrase> eligibleGlobalPhrases(UUID playerId, int maxDifficulty, int limit) {
        return phraseRepository.findEligibleGlobal(playerId, maxDifficulty, limit);
    }

    @Transactional(readOnly = true)
    public List<Phrase> skipFallbackPhrases(UUID playerId, int limit) {
        return phraseRepository.findSkippedByPlayer(playerId, limit);
    }

    /**
     * @return false when a completion for the pair already exists
     */
    @Transactional
    public boolean recordCompletion(UUID playerId, UUID phraseId, int score, int hintsUsed, long timeMs) {
        Instant now = Instant.now();
        int inserted = completionRepository.insertIgnoringConflict(
                UUID.randomUUID(), playerId, phraseId, score, hintsUsed, timeMs, now);
        if (inserted == 0) {
            return false;
        }
        assignmentRepository.markDelivered(phraseId, playerId, now);
        return true;
    }

    /**
     * Record a skip and mark any assignment for the pair as delivered.
     *
     * @return false when the skip already exists or the phrase is already completed
     */
    @Transactional
    public boolean recordSkip(UUID playerId, UUID phraseId) {
        if (completionRepository.existsByPlayerIdAndPhraseId(playerId, phraseId)) {
            return false;
        }
        Instant now = Instant.now();
        int inserted = skipRepository.insertIgnoringConflict(UUID.randomUUID(), playerId, phraseId, now);
        assignmentRepository.markDelivered(phraseId, playerId, now);
        return inserted > 0;
    }

    /**
     * No-op when already delivered or when the phrase was never targeted at the player.
     */
    @Transactional
    public boolean markAssignmentDelivered(UUID phraseId, UUID playerId) {
        return assignmentRepository.markDelivered(phraseId, playerId, Instant.now()) > 0;
    }

    @Transactional
    public void incrementUsageCount(UUID phraseId) {
        phraseRepository.incrementUsageCount(phraseId);
    }

    @Transactional(readOnly = true)
    public Optional<Phrase> findPhrase(UUID phraseId) {
        return phraseRepository.findById(phraseId);
    }

    @Transactional(readOnly = true)
    public Optional<CompletionRecord> findCompletion(UUID playerId, UUID phraseId) {
        return completionRepository.findByPlayerIdAndPhraseId(playerId, phraseId);
    }

    @Transactional(readOnly = true)
    public PhraseProgress progressOf(UUID playerId, UUID phraseId) {
        if (completionRepository.existsByPlayerIdAndPhraseId(playerId, phraseId)) {
            return PhraseProgress.COMPLETED;
        }
        if (skipRepository.existsByPlayerIdAndPhraseId(playerId, phraseId)) {
            return PhraseProgress.SKIPPED;
        }
        return PhraseProgress.UNSEEN;
    }
}
