package com.anagramgame.phrases.controller;

import com.anagramgame.phrases.dto.CreatePhraseRequest;
import com.anagramgame.phrases.dto.CreatePhraseResponse;
import com.anagramgame.phrases.dto.NextPhraseResponse;
import com.anagramgame.phrases.dto.PhraseResponse;
import com.anagramgame.phrases.dto.TrackingResponse;
import com.anagramgame.phrases.exception.PhraseNotFoundException;
import com.anagramgame.phrases.exception.PhraseValidationException;
import com.anagramgame.phrases.model.PhraseProgress;
import com.anagramgame.phrases.model.SelectionTier;
import com.anagramgame.phrases.security.JwtUtil;
import com.anagramgame.phrases.service.PhraseCatalogService;
import com.anagramgame.phrases.service.PhraseSelectionService;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PhraseController.class)
@Import(JwtUtil.class)
class PhraseControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PhraseSelectionService selectionService;
    @MockBean
    private PhraseCatalogService catalogService;

    @Value("${jwt.secret}")
    private String secret;

    private final UUID player = UUID.randomUUID();

    private String bearer(UUID playerId) {
        String token = Jwts.builder()
                .claim(JwtUtil.PLAYER_ID_CLAIM, playerId.toString())
                .signWith(Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8)))
                .compact();
        return "Bearer " + token;
    }

    private static PhraseResponse phrase(UUID id) {
        return PhraseResponse.builder()
                .id(id)
                .content("quick brown fox")
                .language("en")
                .difficultyScore(42)
                .difficultyLabel("Medium")
                .senderName("Bob")
                .build();
    }

    @Test
    void testCreatePhrase() throws Exception {
        UUID phraseId = UUID.randomUUID();
        when(selectionService.createPhrase(eq(player), any(CreatePhraseRequest.class)))
                .thenReturn(CreatePhraseResponse.builder()
                        .phrase(phrase(phraseId))
                        .targetIds(List.of())
                        .targetCount(0)
                        .build());

        mockMvc.perform(post("/api/phrases")
                        .header("Authorization", bearer(player))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"quick brown fox\",\"global\":true}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.phrase.id").value(phraseId.toString()))
                .andExpect(jsonPath("$.phrase.difficultyScore").value(42));
    }

    @Test
    void testAnonymousCreateIsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/phrases")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"quick brown fox\",\"global\":true}"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(selectionService);
    }

    @Test
    void testApproveIsNotExposed() throws Exception {
        mockMvc.perform(post("/api/phrases/{id}/approve", UUID.randomUUID()))
                .andExpect(status().is4xxClientError());

        verifyNoInteractions(catalogService);
    }

    @Test
    void testValidationErrorsReturnedTogether() throws Exception {
        when(selectionService.createPhrase(eq(player), any(CreatePhraseRequest.class)))
                .thenThrow(new PhraseValidationException(List.of(
                        "Phrase must contain at least 2 words",
                        "Cannot send a phrase to yourself")));

        mockMvc.perform(post("/api/phrases")
                        .header("Authorization", bearer(player))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"lonely\",\"targetIds\":[\"" + player + "\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.length()").value(2));
    }

    @Test
    void testBlankContentRejectedBeforeService() throws Exception {
        mockMvc.perform(post("/api/phrases")
                        .header("Authorization", bearer(player))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0]").value("Content is required"));
    }

    @Test
    void testNextPhrase() throws Exception {
        UUID phraseId = UUID.randomUUID();
        when(selectionService.getNextPhrase(player, false)).thenReturn(Optional.of(NextPhraseResponse.builder()
                .tier(SelectionTier.TARGETED)
                .phrase(phrase(phraseId))
                .batch(List.of())
                .effectiveCeiling(30)
                .build()));

        mockMvc.perform(get("/api/phrases/next").header("Authorization", bearer(player)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tier").value("TARGETED"))
                .andExpect(jsonPath("$.phrase.id").value(phraseId.toString()));
    }

    @Test
    void testNextPhraseEmptyIsNoContent() throws Exception {
        when(selectionService.getNextPhrase(player, true)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/phrases/next").param("batch", "true").header("Authorization", bearer(player)))
                .andExpect(status().isNoContent());
    }

    @Test
    void testMissingTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/api/phrases/next"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void testForgedTokenIsUnauthorized() throws Exception {
        String forged = Jwts.builder()
                .claim(JwtUtil.PLAYER_ID_CLAIM, player.toString())
                .signWith(Keys.hmacShaKeyFor("another-secret-another-secret-another-secret".getBytes(StandardCharsets.UTF_8)))
                .compact();

        mockMvc.perform(get("/api/phrases/next").header("Authorization", "Bearer " + forged))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void testDuplicateCompletionIsSuccess() throws Exception {
        UUID phraseId = UUID.randomUUID();
        when(selectionService.completePhrase(eq(player), eq(phraseId), any()))
                .thenReturn(TrackingResponse.builder()
                        .phraseId(phraseId)
                        .recorded(false)
                        .progress(PhraseProgress.COMPLETED)
                        .score(40)
                        .build());

        mockMvc.perform(post("/api/phrases/{id}/complete", phraseId)
                        .header("Authorization", bearer(player))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"hintsUsed\":1,\"completionTimeMs\":3000}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recorded").value(false))
                .andExpect(jsonPath("$.score").value(40));
    }

    @Test
    void testNegativeHintsRejected() throws Exception {
        mockMvc.perform(post("/api/phrases/{id}/complete", UUID.randomUUID())
                        .header("Authorization", bearer(player))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"hintsUsed\":-1,\"completionTimeMs\":3000}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testSkipUnknownPhraseIsNotFound() throws Exception {
        UUID phraseId = UUID.randomUUID();
        when(selectionService.skipPhrase(player, phraseId)).thenThrow(new PhraseNotFoundException(phraseId));

        mockMvc.perform(post("/api/phrases/{id}/skip", phraseId).header("Authorization", bearer(player)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Phrase with ID " + phraseId + " not found"));
    }

    @Test
    void testMalformedIdIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/phrases/not-a-uuid"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testStorageFailureIsServiceUnavailable() throws Exception {
        when(selectionService.createPhrase(eq(player), any(CreatePhraseRequest.class)))
                .thenThrow(new DataAccessResourceFailureException("connection lost"));

        mockMvc.perform(post("/api/phrases")
                        .header("Authorization", bearer(player))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"quick brown fox\",\"global\":true}"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void testGetPhrase() throws Exception {
        UUID phraseId = UUID.randomUUID();
        when(catalogService.getPhrase(phraseId)).thenReturn(phrase(phraseId));

        mockMvc.perform(get("/api/phrases/{id}", phraseId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.senderName").value("Bob"));
    }
}
