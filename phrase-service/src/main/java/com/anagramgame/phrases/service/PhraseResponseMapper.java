package com.anagramgame.phrases.service;

import com.anagramgame.difficulty.DifficultyLabel;
import com.anagramgame.phrases.dto.PhraseResponse;
import com.anagramgame.phrases.entity.Phrase;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

@Component
public class PhraseResponseMapper {

    private final SenderNameResolver senderNameResolver;

    public PhraseResponseMapper(SenderNameResolver senderNameResolver) {
        this.senderNameResolver = senderNameResolver;
    }

    public PhraseResponse toResponse(Phrase phrase) {
        return toResponse(phrase, senderNameResolver.resolve(phrase));
    }

    public PhraseResponse toResponse(Phrase phrase, String senderName) {
        return PhraseResponse.builder()
                .id(phrase.getId())
                .content(phrase.getContent())
                .hint(phrase.getHint())
                .language(phrase.getLanguage().getCode())
                .difficultyScore(phrase.getDifficultyScore())
                .difficultyLabel(DifficultyLabel.forScore(phrase.getDifficultyScore()).getDisplayName())
                .global(phrase.isGlobal())
                .approved(phrase.isApproved())
                .createdByPlayerId(phrase.getCreatedByPlayerId())
                .senderName(senderName)
                .usageCount(phrase.getUsageCount())
                .createdAt(phrase.getCreatedAt())
                .build();
    }

    public List<PhraseResponse> toResponses(List<Phrase> phrases) {
        return phrases.stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
    }
}
