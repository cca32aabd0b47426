package com.anagramgame.phrases.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Entity recording that a player deferred a phrase. The phrase stays visible to everyone else.
 */
@Entity
@Table(name = "skip_records",
        uniqueConstraints = @UniqueConstraint(name = "uk_skip_player_phrase",
                columnNames = {"player_id", "phrase_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SkipRecord {

    @Id
    private UUID id;

    @Column(name = "player_id", nullable = false)
    private UUID playerId;

    @Column(name = "phrase_id", nullable = false)
    private UUID phraseId;

    @Column(name = "skipped_at", nullable = false)
    private Instant skippedAt;
}
