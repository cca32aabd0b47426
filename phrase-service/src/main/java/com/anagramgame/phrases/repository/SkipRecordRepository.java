package com.anagramgame.phrases.repository;

import com.anagramgame.phrases.entity.SkipRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.UUID;

@Repository
public interface SkipRecordRepository extends JpaRepository<SkipRecord, UUID> {

    @Modifying
    @Query(value = "INSERT INTO skip_records (id, player_id, phrase_id, skipped_at) " +
            "VALUES (:id, :playerId, :phraseId, :skippedAt) " +
            "ON CONFLICT DO NOTHING",
            nativeQuery = true)
    int insertIgnoringConflict(@Param("id") UUID id,
                               @Param("playerId") UUID playerId,
                               @Param("phraseId") UUID phraseId,
                               @Param("skippedAt") Instant skippedAt);

    boolean existsByPlayerIdAndPhraseId(UUID playerId, UUID phraseId);
}
