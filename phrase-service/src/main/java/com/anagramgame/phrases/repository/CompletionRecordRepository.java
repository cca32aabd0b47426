package com.anagramgame.phrases.repository;

import com.anagramgame.phrases.entity.CompletionRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CompletionRecordRepository extends JpaRepository<CompletionRecord, UUID> {

    @Modifying
    @Query(value = "INSERT INTO completion_records (id, player_id, phrase_id, score, hints_used, completion_time_ms, completed_at) " +
            "VALUES (:id, :playerId, :phraseId, :score, :hintsUsed, :completionTimeMs, :completedAt) " +
            "ON CONFLICT DO NOTHING",
            nativeQuery = true)
    int insertIgnoringConflict(@Param("id") UUID id,
                               @Param("playerId") UUID playerId,
                               @Param("phraseId") UUID phraseId,
                               @Param("score") int score,
                               @Param("hintsUsed") int hintsUsed,
                               @Param("completionTimeMs") long completionTimeMs,
                               @Param("completedAt") Instant completedAt);

    boolean existsByPlayerIdAndPhraseId(UUID playerId, UUID phraseId);

    Optional<CompletionRecord> findByPlayerIdAndPhraseId(UUID playerId, UUID phraseId);
}
