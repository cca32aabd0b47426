package com.anagramgame.phrases.model;

import com.anagramgame.difficulty.Language;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Everything needed to create a phrase. {@code senderId} is null for system or external contributions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NewPhrase {
    private String content;
    private String hint;
    private Language language;
    private UUID senderId;
    private String contributorName;
    @Builder.Default
    private List<UUID> targetIds = new ArrayList<>();
    private boolean global;
}
