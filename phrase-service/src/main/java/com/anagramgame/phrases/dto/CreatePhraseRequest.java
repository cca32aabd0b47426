package com.anagramgame.phrases.dto;

import com.anagramgame.phrases.entity.Phrase;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Data
public class CreatePhraseRequest {

    @NotBlank(message = "Content is required")
    @Size(max = Phrase.MAX_CONTENT_LENGTH, message = "Content cannot be longer than 200 characters")
    private String content;

    private String hint;

    private String language; // "en" or "sv", defaults to "en"

    private List<UUID> targetIds = new ArrayList<>();

    private boolean global;
}
