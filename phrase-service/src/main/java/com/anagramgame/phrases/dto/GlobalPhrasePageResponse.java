package com.anagramgame.phrases.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class GlobalPhrasePageResponse {
    private List<PhraseResponse> phrases;
    private int page;
    private int limit;
    private long total;
    private int count;
    private boolean hasMore;
    private boolean approved;
    private Integer minDifficulty;
    private Integer maxDifficulty;
}
