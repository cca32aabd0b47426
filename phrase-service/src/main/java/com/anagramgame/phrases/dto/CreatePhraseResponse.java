package com.anagramgame.phrases.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.UUID;

@Data
@Builder
public class CreatePhraseResponse {
    private PhraseResponse phrase;
    private List<UUID> targetIds;
    private int targetCount;
}
