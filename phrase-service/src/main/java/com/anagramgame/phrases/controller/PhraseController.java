package com.anagramgame.phrases.controller;

import com.anagramgame.phrases.dto.CompletePhraseRequest;
import com.anagramgame.phrases.dto.CreatePhraseRequest;
import com.anagramgame.phrases.dto.CreatePhraseResponse;
import com.anagramgame.phrases.dto.DifficultyAnalysisRequest;
import com.anagramgame.phrases.dto.DifficultyAnalysisResponse;
import com.anagramgame.phrases.dto.GlobalPhrasePageResponse;
import com.anagramgame.phrases.dto.NextPhraseResponse;
import com.anagramgame.phrases.dto.PhraseResponse;
import com.anagramgame.phrases.dto.PhraseStatsResponse;
import com.anagramgame.phrases.dto.TrackingResponse;
import com.anagramgame.phrases.security.JwtUtil;
import com.anagramgame.phrases.service.PhraseCatalogService;
import com.anagramgame.phrases.service.PhraseSelectionService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/phrases")
@CrossOrigin(origins = "${cors.allowed.origins}")
public class PhraseController {

    private final PhraseSelectionService selectionService;
    private final PhraseCatalogService catalogService;
    private final JwtUtil jwtUtil;

    public PhraseController(PhraseSelectionService selectionService,
                            PhraseCatalogService catalogService,
                            JwtUtil jwtUtil) {
        this.selectionService = selectionService;
        this.catalogService = catalogService;
        this.jwtUtil = jwtUtil;
    }

    /**
     * POST /api/phrases
     * Create a phrase sent by the calling player, optionally targeted and/or global
     */
    @PostMapping
    public ResponseEntity<CreatePhraseResponse> createPhrase(
            @RequestHeader("Authorization") String authHeader,
            @Valid @RequestBody CreatePhraseRequest request) {

        UUID senderId = jwtUtil.extractPlayerIdFromHeader(authHeader);
        CreatePhraseResponse response = selectionService.createPhrase(senderId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * GET /api/phrases/next
     * Get the next phrase for the calling player, 204 when nothing is available
     */
    @GetMapping("/next")
    public ResponseEntity<NextPhraseResponse> getNextPhrase(
            @RequestHeader("Authorization") String authHeader,
            @RequestParam(defaultValue = "false") boolean batch) {

        UUID playerId = jwtUtil.extractPlayerIdFromHeader(authHeader);
        return selectionService.getNextPhrase(playerId, batch)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    /**
     * POST /api/phrases/{id}/complete
     * Report a solved phrase
     */
    @PostMapping("/{id}/complete")
    public ResponseEntity<TrackingResponse> completePhrase(
            @RequestHeader("Authorization") String authHeader,
            @PathVariable UUID id,
            @Valid @RequestBody CompletePhraseRequest request) {

        UUID playerId = jwtUtil.extractPlayerIdFromHeader(authHeader);
        return ResponseEntity.ok(selectionService.completePhrase(playerId, id, request));
    }

    /**
     * POST /api/phrases/{id}/skip
     * Defer a phrase for the calling player
     */
    @PostMapping("/{id}/skip")
    public ResponseEntity<TrackingResponse> skipPhrase(
            @RequestHeader("Authorization") String authHeader,
            @PathVariable UUID id) {

        UUID playerId = jwtUtil.extractPlayerIdFromHeader(authHeader);
        return ResponseEntity.ok(selectionService.skipPhrase(playerId, id));
    }

    /**
     * GET /api/phrases/global
     * List global phrases
     */
    @GetMapping("/global")
    public ResponseEntity<GlobalPhrasePageResponse> listGlobal(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(defaultValue = "true") boolean approved,
            @RequestParam(required = false) Integer minDifficulty,
            @RequestParam(required = false) Integer maxDifficulty) {

        return ResponseEntity.ok(catalogService.listGlobal(page, limit, approved, minDifficulty, maxDifficulty));
    }

    /**
     * GET /api/phrases/stats
     * Get catalogue statistics
     */
    @GetMapping("/stats")
    public ResponseEntity<PhraseStatsResponse> getStats() {
        return ResponseEntity.ok(catalogService.getStats());
    }

    /**
     * POST /api/phrases/analyze-difficulty
     * Score a phrase without storing it
     */
    @PostMapping("/analyze-difficulty")
    public ResponseEntity<DifficultyAnalysisResponse> analyzeDifficulty(
            @Valid @RequestBody DifficultyAnalysisRequest request) {
        return ResponseEntity.ok(catalogService.analyzeDifficulty(request));
    }

    /**
     * GET /api/phrases/{id}
     * Get a phrase by ID
     */
    @GetMapping("/{id}")
    public ResponseEntity<PhraseResponse> getPhrase(@PathVariable UUID id) {
        return ResponseEntity.ok(catalogService.getPhrase(id));
    }
}
