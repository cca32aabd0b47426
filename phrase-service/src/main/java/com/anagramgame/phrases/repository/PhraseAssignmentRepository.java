package com.anagramgame.phrases.repository;

import com.anagramgame.phrases.entity.PhraseAssignment;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface PhraseAssignmentRepository extends JpaRepository<PhraseAssignment, UUID> {

    /**
     * Insert an undelivered assignment, doing nothing if the (phrase, target) pair already exists.
     *
     * @return 1 when a row was written, 0 on conflict
     */
    @Modifying
    @Query(value = "INSERT INTO phrase_assignments (id, phrase_id, target_player_id, priority, assigned_at, is_delivered) " +
            "VALUES (:id, :phraseId, :targetPlayerId, :priority, :assignedAt, FALSE) " +
            "ON CONFLICT DO NOTHING",
            nativeQuery = true)
    int insertIgnoringConflict(@Param("id") UUID id,
                               @Param("phraseId") UUID phraseId,
                               @Param("targetPlayerId") UUID targetPlayerId,
                               @Param("priority") int priority,
                               @Param("assignedAt") Instant assignedAt);

    @Query("SELECT a FROM PhraseAssignment a JOIN FETCH a.phrase p " +
           "WHERE a.targetPlayerId = :playerId AND a.delivered = false " +
           "AND NOT EXISTS (SELECT 1 FROM SkipRecord s WHERE s.playerId = :playerId AND s.phraseId = p.id) " +
           "AND NOT EXISTS (SELECT 1 FROM CompletionRecord c WHERE c.playerId = :playerId AND c.phraseId = p.id) " +
           "ORDER BY a.priority ASC, a.assignedAt ASC, a.id ASC")
    List<PhraseAssignment> findInbox(@Param("playerId") UUID playerId, Pageable pageable);

    @Modifying
    @Query("UPDATE PhraseAssignment a SET a.delivered = true, a.deliveredAt = :deliveredAt " +
           "WHERE a.phrase.id = :phraseId AND a.targetPlayerId = :playerId AND a.delivered = false")
    int markDelivered(@Param("phraseId") UUID phraseId,
                      @Param("playerId") UUID playerId,
                      @Param("deliveredAt") Instant deliveredAt);

    @Query("SELECT COUNT(DISTINCT a.phrase.id) FROM PhraseAssignment a")
    long countTargetedPhrases();
}
