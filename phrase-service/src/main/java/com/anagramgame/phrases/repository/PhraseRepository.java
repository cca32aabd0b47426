package com.anagramgame.phrases.repository;

import com.anagramgame.phrases.entity.Phrase;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PhraseRepository extends JpaRepository<Phrase, UUID> {

    @Query(value = "SELECT p.* FROM phrases p " +
            "WHERE p.is_global = TRUE AND p.is_approved = TRUE " +
            "AND (p.created_by_player_id IS NULL OR p.created_by_player_id <> :playerId) " +
            "AND p.difficulty_score <= :maxDifficulty " +
            "AND NOT EXISTS (SELECT 1 FROM completion_records c WHERE c.player_id = :playerId AND c.phrase_id = p.id) " +
            "AND NOT EXISTS (SELECT 1 FROM skip_records s WHERE s.player_id = :playerId AND s.phrase_id = p.id) " +
            "ORDER BY RANDOM() LIMIT :limit",
            nativeQuery = true)
    List<Phrase> findEligibleGlobal(@Param("playerId") UUID playerId,
                                    @Param("maxDifficulty") int maxDifficulty,
                                    @Param("limit") int limit);

    @Query(value = "SELECT p.* FROM phrases p " +
            "JOIN skip_records s ON s.phrase_id = p.id AND s.player_id = :playerId " +
            "WHERE p.is_approved = TRUE " +
            "AND (p.created_by_player_id IS NULL OR p.created_by_player_id <> :playerId) " +
            "AND (p.is_global = TRUE OR EXISTS (SELECT 1 FROM phrase_assignments a " +
            "     WHERE a.phrase_id = p.id AND a.target_player_id = :playerId)) " +
            "AND NOT EXISTS (SELECT 1 FROM completion_records c WHERE c.player_id = :playerId AND c.phrase_id = p.id) " +
            "ORDER BY RANDOM() LIMIT :limit",
            nativeQuery = true)
    List<Phrase> findSkippedByPlayer(@Param("playerId") UUID playerId, @Param("limit") int limit);

    @Modifying
    @Query("UPDATE Phrase p SET p.usageCount = p.usageCount + 1 WHERE p.id = :id")
    int incrementUsageCount(@Param("id") UUID id);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE Phrase p SET p.approved = true WHERE p.id = :id AND p.global = true")
    int approveGlobal(@Param("id") UUID id);

    @Query("SELECT p FROM Phrase p WHERE p.global = true AND p.approved = :approved " +
           "AND (:minDifficulty IS NULL OR p.difficultyScore >= :minDifficulty) " +
           "AND (:maxDifficulty IS NULL OR p.difficultyScore <= :maxDifficulty) " +
           "ORDER BY p.createdAt DESC")
    Page<Phrase> findGlobal(@Param("approved") boolean approved,
                            @Param("minDifficulty") Integer minDifficulty,
                            @Param("maxDifficulty") Integer maxDifficulty,
                            Pageable pageable);

    long countByGlobalTrueAndApprovedTrue();

    @Query("SELECT COALESCE(AVG(p.usageCount), 0.0) FROM Phrase p")
    double averageUsageCount();

    @Query("SELECT COALESCE(MAX(p.usageCount), 0) FROM Phrase p")
    int maxUsageCount();
}
