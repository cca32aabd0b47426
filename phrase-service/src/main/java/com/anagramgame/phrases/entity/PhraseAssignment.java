package com.anagramgame.phrases.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

/**
 * Entity directing a targeted phrase at one player. Rows are written only
 * together with their phrase and only ever flip from undelivered to delivered.
 */
@Entity
@Table(name = "phrase_assignments",
        uniqueConstraints = @UniqueConstraint(name = "uk_assignment_phrase_target",
                columnNames = {"phrase_id", "target_player_id"}),
        indexes = @Index(name = "idx_assignment_inbox",
                columnList = "target_player_id, is_delivered, priority, assigned_at"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PhraseAssignment {

    public static final int DEFAULT_PRIORITY = 1;

    @Id
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "phrase_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Phrase phrase;

    @Column(name = "target_player_id", nullable = false)
    private UUID targetPlayerId;

    @Column(name = "priority", nullable = false)
    private int priority;

    @Column(name = "assigned_at", nullable = false)
    private Instant assignedAt;

    @Column(name = "is_delivered", nullable = false)
    private boolean delivered;

    @Column(name = "delivered_at")
    private Instant deliveredAt;
}
