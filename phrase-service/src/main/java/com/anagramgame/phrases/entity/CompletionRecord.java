package com.anagramgame.phrases.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Entity recording that a player solved a phrase. At most one per (player, phrase).
 */
@Entity
@Table(name = "completion_records",
        uniqueConstraints = @UniqueConstraint(name = "uk_completion_player_phrase",
                columnNames = {"player_id", "phrase_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompletionRecord {

    @Id
    private UUID id;

    @Column(name = "player_id", nullable = false)
    private UUID playerId;

    @Column(name = "phrase_id", nullable = false)
    private UUID phraseId;

    @Column(name = "score", nullable = false)
    private int score;

    @Column(name = "hints_used", nullable = false)
    private int hintsUsed;

    @Column(name = "completion_time_ms", nullable = false)
    private long completionTimeMs;

    @Column(name = "completed_at", nullable = false)
    private Instant completedAt;
}
