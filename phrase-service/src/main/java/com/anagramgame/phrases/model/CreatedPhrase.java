package com.anagramgame.phrases.model;

import com.anagramgame.phrases.entity.Phrase;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.UUID;

@Data
@Builder
public class CreatedPhrase {
    private Phrase phrase;
    private List<UUID> targetIds;
    private int targetCount;
    private String senderName;
}
