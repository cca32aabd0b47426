package com.anagramgame.phrases.entity;

import com.anagramgame.difficulty.Language;
import com.anagramgame.phrases.config.LanguageConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Entity representing a word puzzle that can be targeted at players or published globally.
 * Content, language and difficulty are fixed at creation.
 */
@Entity
@Table(name = "phrases", indexes = {
        @Index(name = "idx_phrases_global", columnList = "is_global, is_approved, difficulty_score")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Phrase {

    public static final int MAX_CONTENT_LENGTH = 200;
    public static final int MAX_HINT_LENGTH = 300;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "content", nullable = false, length = MAX_CONTENT_LENGTH, updatable = false)
    private String content;

    @Column(name = "hint", length = MAX_HINT_LENGTH, updatable = false)
    private String hint;

    @Convert(converter = LanguageConverter.class)
    @Column(name = "language", nullable = false, length = 10, updatable = false)
    private Language language;

    @Column(name = "difficulty_score", nullable = false, updatable = false)
    private int difficultyScore;

    @Column(name = "is_global", nullable = false, updatable = false)
    private boolean global;

    @Column(name = "is_approved", nullable = false)
    private boolean approved;

    @Column(name = "created_by_player_id", updatable = false)
    private UUID createdByPlayerId;

    @Column(name = "contributor_name", length = 100, updatable = false)
    private String contributorName;

    @Column(name = "usage_count", nullable = false)
    private int usageCount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
