package com.anagramgame.phrases.service;

import com.anagramgame.difficulty.DifficultyScore;
import com.anagramgame.difficulty.DifficultyScorer;
import com.anagramgame.difficulty.Language;
import com.anagramgame.phrases.dto.DifficultyAnalysisRequest;
import com.anagramgame.phrases.dto.DifficultyAnalysisResponse;
import com.anagramgame.phrases.dto.GlobalPhrasePageResponse;
import com.anagramgame.phrases.dto.PhraseResponse;
import com.anagramgame.phrases.dto.PhraseStatsResponse;
import com.anagramgame.phrases.entity.Phrase;
import com.anagramgame.phrases.exception.PhraseNotFoundException;
import com.anagramgame.phrases.repository.PhraseAssignmentRepository;
import com.anagramgame.phrases.repository.PhraseRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Read side of the phrase catalogue plus moderation.
 */
@Slf4j
@Service
public class PhraseCatalogService {

    public static final int MAX_PAGE_SIZE = 100;

    private final PhraseRepository phraseRepository;
    private final PhraseAssignmentRepository assignmentRepository;
    private final DifficultyScorer scorer;
    private final PhraseResponseMapper mapper;

    public PhraseCatalogService(PhraseRepository phraseRepository,
                                PhraseAssignmentRepository assignmentRepository,
                                DifficultyScorer scorer,
                                PhraseResponseMapper mapper) {
        this.phraseRepository = phraseRepository;
        this.assignmentRepository = assignmentRepository;
        this.scorer = scorer;
        this.mapper = mapper;
    }

    /**
     * Get a single phrase
     */
    @Transactional(readOnly = true)
    public PhraseResponse getPhrase(UUID phraseId) {
        Phrase phrase = phraseRepository.findById(phraseId)
                .orElseThrow(() -> new PhraseNotFoundException(phraseId));
        return mapper.toResponse(phrase);
    }

    /**
     * List global phrases, newest first
     */
    @Transactional(readOnly = true)
    public GlobalPhrasePageResponse listGlobal(int page, int limit, boolean approved,
                                               Integer minDifficulty, Integer maxDifficulty) {
        int size = Math.min(Math.max(limit, 1), MAX_PAGE_SIZE);
        int pageNumber = Math.max(page, 0);

        Page<Phrase> result = phraseRepository.findGlobal(
                approved, minDifficulty, maxDifficulty, PageRequest.of(pageNumber, size));

        return GlobalPhrasePageResponse.builder()
                .phrases(mapper.toResponses(result.getContent()))
                .page(pageNumber)
                .limit(size)
                .total(result.getTotalElements())
                .count(result.getNumberOfElements())
                .hasMore(result.hasNext())
                .approved(approved)
                .minDifficulty(minDifficulty)
                .maxDifficulty(maxDifficulty)
                .build();
    }

    /**
     * Approve a global phrase so it enters selection
     */
    @Transactional
    public PhraseResponse approve(UUID phraseId) {
        if (phraseRepository.approveGlobal(phraseId) == 0) {
            throw new PhraseNotFoundException(phraseId);
        }
        log.info("Approved global phrase {}", phraseId);
        return getPhrase(phraseId);
    }

    /**
     * Score a phrase without storing it
     */
    public DifficultyAnalysisResponse analyzeDifficulty(DifficultyAnalysisRequest request) {
        Language language = Language.fromCodeOrDefault(request.getLanguage());
        DifficultyScore score = scorer.analyze(request.getPhrase(), language);

        return DifficultyAnalysisResponse.builder()
                .phrase(request.getPhrase())
                .language(language.getCode())
                .score(score.getTotalScore())
                .difficulty(score.getLabel().getDisplayName())
                .letterCount(score.getLetterCount())
                .letterRarity(score.getRarity())
                .structuralComplexity(score.getComplexity())
                .build();
    }

    @Transactional(readOnly = true)
    public PhraseStatsResponse getStats() {
        return PhraseStatsResponse.builder()
                .totalPhrases(phraseRepository.count())
                .globalPhrases(phraseRepository.countByGlobalTrueAndApprovedTrue())
                .targetedPhrases(assignmentRepository.countTargetedPhrases())
                .averageUsage(phraseRepository.averageUsageCount())
                .maxUsage(phraseRepository.maxUsageCount())
                .build();
    }
}
