package com.anagramgame.phrases.dto;

import com.anagramgame.phrases.model.PhraseProgress;
import lombok.Builder;
import lombok.Data;

import java.util.UUID;

@Data
@Builder
public class TrackingResponse {
    private UUID phraseId;
    private boolean recorded; // False for retries, still a success
    private PhraseProgress progress;
    private Integer score;
}
