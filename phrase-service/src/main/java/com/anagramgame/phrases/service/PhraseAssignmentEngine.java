package com.anagramgame.phrases.service;

import com.anagramgame.difficulty.DifficultyScorer;
import com.anagramgame.difficulty.Language;
import com.anagramgame.phrases.config.PhraseProperties;
import com.anagramgame.phrases.entity.Phrase;
import com.anagramgame.phrases.entity.PhraseAssignment;
import com.anagramgame.phrases.event.PhraseCreatedEvent;
import com.anagramgame.phrases.exception.PhraseValidationException;
import com.anagramgame.phrases.exception.PlayerNotFoundException;
import com.anagramgame.phrases.model.CreatedPhrase;
import com.anagramgame.phrases.model.NewPhrase;
import com.anagramgame.phrases.model.PhraseSelection;
import com.anagramgame.phrases.model.PhraseValidationResult;
import com.anagramgame.phrases.model.SelectionTier;
import com.anagramgame.phrases.repository.PhraseStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Creates phrases together with their targets and decides which phrase a player gets next.
 */
@Slf4j
@Service
public class PhraseAssignmentEngine {

    private final PhraseValidator validator;
    private final DifficultyScorer scorer;
    private final PhraseStore store;
    private final PlayerDirectory playerDirectory;
    private final SenderNameResolver senderNameResolver;
    private final ApplicationEventPublisher eventPublisher;
    private final PhraseProperties properties;

    public PhraseAssignmentEngine(PhraseValidator validator,
                                  DifficultyScorer scorer,
                                  PhraseStore store,
                                  PlayerDirectory playerDirectory,
                                  SenderNameResolver senderNameResolver,
                                  ApplicationEventPublisher eventPublisher,
                                  PhraseProperties properties) {
        this.validator = validator;
        this.scorer = scorer;
        this.store = store;
        this.playerDirectory = playerDirectory;
        this.senderNameResolver = senderNameResolver;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
    }

    /**
     * Validate, score and store a phrase with all of its targets in one transaction.
     * A global phrase may carry targets too; both effects apply.
     */
    @Transactional
    public CreatedPhrase createPhrase(NewPhrase request) {
        PhraseValidationResult validation = validator.validate(request.getContent(), request.getHint());
        List<String> errors = new ArrayList<>(validation.getErrors());

        UUID senderId = request.getSenderId();
        List<UUID> targetIds = distinctTargets(request.getTargetIds());
        if (targetIds.isEmpty() && !request.isGlobal()) {
            errors.add("Phrase must be global or have at least one target");
        }
        if (senderId != null && targetIds.contains(senderId)) {
            errors.add("Cannot send a phrase to yourself");
        }
        if (!errors.isEmpty()) {
            throw new PhraseValidationException(errors);
        }

        if (senderId != null && !playerDirectory.exists(senderId)) {
            throw new PlayerNotFoundException(senderId);
        }
        for (UUID targetId : targetIds) {
            if (!playerDirectory.exists(targetId)) {
                throw new PlayerNotFoundException(targetId);
            }
        }

        Language language = request.getLanguage() != null ? request.getLanguage() : Language.EN;
        int difficulty = scoreOrMinimum(validation.getContent(), language);

        Phrase phrase = Phrase.builder()
                .content(validation.getContent())
                .hint(validation.getHint())
                .language(language)
                .difficultyScore(difficulty)
                .global(request.isGlobal())
                .approved(isApprovedOnCreation(request))
                .createdByPlayerId(senderId)
                .contributorName(blankToNull(request.getContributorName()))
                .usageCount(0)
                .createdAt(Instant.now())
                .build();

        Phrase saved = store.createPhraseWithTargets(phrase, targetIds);
        String senderName = senderNameResolver.resolve(saved);

        for (UUID targetId : targetIds) {
            eventPublisher.publishEvent(
                    new PhraseCreatedEvent(this, saved.getId(), targetId, senderName, saved.getCreatedAt()));
        }
        if (saved.isGlobal()) {
            eventPublisher.publishEvent(
                    new PhraseCreatedEvent(this, saved.getId(), null, senderName, saved.getCreatedAt()));
        }

        log.info("Created phrase {} (difficulty {}, global {}, {} target(s))",
                saved.getId(), difficulty, saved.isGlobal(), targetIds.size());

        return CreatedPhrase.builder()
                .phrase(saved)
                .targetIds(targetIds)
                .targetCount(targetIds.size())
                .senderName(senderName)
                .build();
    }

    /**
     * Pick the next phrase for a player whose difficulty ceiling is {@code ceiling}.
     * Tiers are tried in order: targeted inbox, global pool, the player's own skipped phrases.
     */
    public PhraseSelection selectNext(UUID playerId, int ceiling, int limit) {
        int batch = Math.max(1, limit);

        // Targeted content is never difficulty filtered
        Optional<PhraseAssignment> assignment = store.nextTargetedAssignment(playerId);
        if (assignment.isPresent()) {
            return PhraseSelection.builder()
                    .playerId(playerId)
                    .tier(SelectionTier.TARGETED)
                    .phrases(List.of(assignment.get().getPhrase()))
                    .assignment(assignment.get())
                    .effectiveCeiling(ceiling)
                    .build();
        }

        int effectiveCeiling = effectiveCeiling(ceiling);
        List<Phrase> global = store.eligibleGlobalPhrases(playerId, effectiveCeiling, batch);
        if (!global.isEmpty()) {
            return selection(playerId, SelectionTier.GLOBAL, global, effectiveCeiling);
        }

        List<Phrase> skipped = store.skipFallbackPhrases(playerId, batch);
        if (!skipped.isEmpty()) {
            return selection(playerId, SelectionTier.SKIP_FALLBACK, skipped, effectiveCeiling);
        }

        log.debug("No phrase available for player {} (ceiling {})", playerId, effectiveCeiling);
        return PhraseSelection.empty(playerId, effectiveCeiling);
    }

    /**
     * Beginner boost: ceilings under the threshold are widened to the beginner ceiling.
     */
    public int effectiveCeiling(int ceiling) {
        PhraseProperties.Selection selection = properties.getSelection();
        if (ceiling < selection.getBeginnerThreshold()) {
            return selection.getBeginnerCeiling();
        }
        return ceiling;
    }

    private int scoreOrMinimum(String content, Language language) {
        try {
            return scorer.score(content, language);
        } catch (RuntimeException e) {
            log.warn("Difficulty scoring failed for '{}' ({}), using minimum score: {}",
                    content, language.getCode(), e.getMessage());
            return DifficultyScorer.MIN_SCORE;
        }
    }

    private boolean isApprovedOnCreation(NewPhrase request) {
        if (!request.isGlobal()) {
            return true;
        }
        // Player submissions to the global pool wait for moderation unless configured otherwise
        return request.getSenderId() == null || properties.getModeration().isAutoApproveGlobal();
    }

    private static List<UUID> distinctTargets(List<UUID> targetIds) {
        if (targetIds == null) {
            return List.of();
        }
        Set<UUID> distinct = new LinkedHashSet<>();
        for (UUID id : targetIds) {
            if (id != null) {
                distinct.add(id);
            }
        }
        return new ArrayList<>(distinct);
    }

    private static PhraseSelection selection(UUID playerId, SelectionTier tier, List<Phrase> phrases, int ceiling) {
        return PhraseSelection.builder()
                .playerId(playerId)
                .tier(tier)
                .phrases(phrases)
                .effectiveCeiling(ceiling)
                .build();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
