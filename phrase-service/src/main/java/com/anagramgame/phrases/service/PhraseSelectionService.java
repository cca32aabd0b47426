package com.anagramgame.phrases.service;

import com.anagramgame.difficulty.Language;
import com.anagramgame.phrases.config.PhraseProperties;
import com.anagramgame.phrases.dto.CompletePhraseRequest;
import com.anagramgame.phrases.dto.CreatePhraseRequest;
import com.anagramgame.phrases.dto.CreatePhraseResponse;
import com.anagramgame.phrases.dto.NextPhraseResponse;
import com.anagramgame.phrases.dto.PhraseResponse;
import com.anagramgame.phrases.dto.TrackingResponse;
import com.anagramgame.phrases.entity.Phrase;
import com.anagramgame.phrases.exception.PlayerNotFoundException;
import com.anagramgame.phrases.model.CreatedPhrase;
import com.anagramgame.phrases.model.NewPhrase;
import com.anagramgame.phrases.model.PhraseSelection;
import com.anagramgame.phrases.model.PlayerProfile;
import com.anagramgame.phrases.model.SelectionTier;
import com.anagramgame.phrases.model.TrackingResult;
import com.anagramgame.phrases.repository.PhraseStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for players: create a phrase, get the next one to play, report completion or skip.
 */
@Slf4j
@Service
public class PhraseSelectionService {

    private final PhraseAssignmentEngine engine;
    private final PhraseProgressTracker tracker;
    private final PhraseStore store;
    private final PlayerDirectory playerDirectory;
    private final DifficultyCeilingResolver ceilingResolver;
    private final PhraseResponseMapper mapper;
    private final PhraseProperties properties;

    public PhraseSelectionService(PhraseAssignmentEngine engine,
                                  PhraseProgressTracker tracker,
                                  PhraseStore store,
                                  PlayerDirectory playerDirectory,
                                  DifficultyCeilingResolver ceilingResolver,
                                  PhraseResponseMapper mapper,
                                  PhraseProperties properties) {
        this.engine = engine;
        this.tracker = tracker;
        this.store = store;
        this.playerDirectory = playerDirectory;
        this.ceilingResolver = ceilingResolver;
        this.mapper = mapper;
        this.properties = properties;
    }

    /**
     * Create a phrase sent by a player. System contributions go straight through the engine.
     */
    public CreatePhraseResponse createPhrase(UUID senderId, CreatePhraseRequest request) {
        if (senderId == null) {
            throw new IllegalArgumentException("Sender is required");
        }
        NewPhrase newPhrase = NewPhrase.builder()
                .content(request.getContent())
                .hint(request.getHint())
                .language(Language.fromCodeOrDefault(request.getLanguage()))
                .senderId(senderId)
                .targetIds(request.getTargetIds())
                .global(request.isGlobal())
                .build();

        CreatedPhrase created = engine.createPhrase(newPhrase);

        return CreatePhraseResponse.builder()
                .phrase(mapper.toResponse(created.getPhrase(), created.getSenderName()))
                .targetIds(created.getTargetIds())
                .targetCount(created.getTargetCount())
                .build();
    }

    /**
     * Get the next phrase for a player, or empty when every tier is exhausted.
     * A targeted phrase counts as delivered once it is handed out here.
     */
    @Transactional
    public Optional<NextPhraseResponse> getNextPhrase(UUID playerId, boolean batch) {
        PlayerProfile player = playerDirectory.findPlayer(playerId)
                .orElseThrow(() -> new PlayerNotFoundException(playerId));

        int ceiling = ceilingResolver.ceilingFor(player);
        int limit = batch ? properties.getSelection().getBatchSize() : 1;
        PhraseSelection selection = engine.selectNext(playerId, ceiling, limit);
        if (selection.isEmpty()) {
            return Optional.empty();
        }

        Phrase first = selection.first();
        if (selection.getTier() == SelectionTier.TARGETED) {
            store.markAssignmentDelivered(first.getId(), playerId);
        }
        log.info("Serving phrase {} to player {} from {} tier", first.getId(), playerId, selection.getTier());

        List<PhraseResponse> phrases = mapper.toResponses(selection.getPhrases());
        return Optional.of(NextPhraseResponse.builder()
                .tier(selection.getTier())
                .phrase(phrases.get(0))
                .batch(batch ? phrases : List.of())
                .effectiveCeiling(selection.getEffectiveCeiling())
                .build());
    }

    /**
     * Report a solved phrase
     */
    public TrackingResponse completePhrase(UUID playerId, UUID phraseId, CompletePhraseRequest request) {
        TrackingResult result = tracker.complete(
                playerId, phraseId, request.getScore(), request.getHintsUsed(), request.getCompletionTimeMs());
        return toResponse(result);
    }

    /**
     * Report a skipped phrase
     */
    public TrackingResponse skipPhrase(UUID playerId, UUID phraseId) {
        return toResponse(tracker.skip(playerId, phraseId));
    }

    private TrackingResponse toResponse(TrackingResult result) {
        return TrackingResponse.builder()
                .phraseId(result.getPhraseId())
                .recorded(result.isRecorded())
                .progress(result.getProgress())
                .score(result.getScore())
                .build();
    }
}
