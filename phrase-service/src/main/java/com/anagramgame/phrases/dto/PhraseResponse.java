package com.anagramgame.phrases.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
public class PhraseResponse {
    private UUID id;
    private String content;
    private String hint;
    private String language;
    private int difficultyScore;
    private String difficultyLabel;
    private boolean global;
    private boolean approved;
    private UUID createdByPlayerId;
    private String senderName;
    private int usageCount;
    private Instant createdAt;
}
