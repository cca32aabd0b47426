package com.anagramgame.phrases.repository;

import com.anagramgame.difficulty.Language;
import com.anagramgame.phrases.entity.Phrase;
import com.anagramgame.phrases.entity.PhraseAssignment;
import com.anagramgame.phrases.model.PhraseProgress;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(PhraseStore.class)
class PhraseStoreTest {

    @Autowired
    private PhraseStore store;
    @Autowired
    private PhraseRepository phraseRepository;
    @Autowired
    private PhraseAssignmentRepository assignmentRepository;
    @Autowired
    private CompletionRecordRepository completionRepository;
    @Autowired
    private SkipRecordRepository skipRepository;
    @Autowired
    private TestEntityManager entityManager;

    private final UUID alice = UUID.randomUUID();
    private final UUID bob = UUID.randomUUID();

    private Phrase newPhrase(String content, int difficulty, boolean global, boolean approved, UUID author) {
        return Phrase.builder()
                .content(content)
                .language(Language.EN)
                .difficultyScore(difficulty)
                .global(global)
                .approved(approved)
                .createdByPlayerId(author)
                .build();
    }

    private Phrase globalPhrase(String content, int difficulty) {
        return store.createPhraseWithTargets(newPhrase(content, difficulty, true, true, null), List.of());
    }

    private static Set<UUID> ids(List<Phrase> phrases) {
        return phrases.stream().map(Phrase::getId).collect(Collectors.toSet());
    }

    @Test
    void testCreateWithTargetsCollapsesDuplicates() {
        Phrase phrase = store.createPhraseWithTargets(
                newPhrase("quick brown fox", 40, false, true, bob), List.of(alice, alice));

        assertNotNull(phrase.getId());
        assertNotNull(phrase.getCreatedAt());
        List<PhraseAssignment> assignments = assignmentRepository.findAll().stream()
                .filter(a -> a.getPhrase().getId().equals(phrase.getId()))
                .collect(Collectors.toList());
        assertEquals(1, assignments.size(), "Duplicate target should produce one assignment");
        assertEquals(alice, assignments.get(0).getTargetPlayerId());
        assertFalse(assignments.get(0).isDelivered());
        assertEquals(PhraseAssignment.DEFAULT_PRIORITY, assignments.get(0).getPriority());
    }

    @Test
    void testCompletionIsIdempotent() {
        Phrase phrase = globalPhrase("quick brown fox", 40);

        assertTrue(store.recordCompletion(alice, phrase.getId(), 40, 0, 1000L));
        assertFalse(store.recordCompletion(alice, phrase.getId(), 99, 2, 5000L), "Retry must be a no-op");

        assertEquals(1, completionRepository.findAll().stream()
                .filter(c -> c.getPlayerId().equals(alice) && c.getPhraseId().equals(phrase.getId()))
                .count());
        assertEquals(40, store.findCompletion(alice, phrase.getId()).orElseThrow().getScore(),
                "First recording wins");
        assertEquals(PhraseProgress.COMPLETED, store.progressOf(alice, phrase.getId()));
    }

    @Test
    void testSkipDefersOnlyForSkippingPlayer() {
        Phrase phrase = globalPhrase("quick brown fox", 40);

        assertTrue(store.recordSkip(alice, phrase.getId()));
        assertFalse(store.recordSkip(alice, phrase.getId()), "Second skip is a no-op");
        assertEquals(1, skipRepository.findAll().stream()
                .filter(r -> r.getPlayerId().equals(alice) && r.getPhraseId().equals(phrase.getId()))
                .count());

        assertTrue(ids(store.eligibleGlobalPhrases(bob, 100, 10)).contains(phrase.getId()),
                "Other players still see a skipped phrase");
        assertFalse(ids(store.eligibleGlobalPhrases(alice, 100, 10)).contains(phrase.getId()),
                "Skipping player no longer sees it in the global tier");
        assertEquals(Set.of(phrase.getId()), ids(store.skipFallbackPhrases(alice, 10)));
        assertEquals(PhraseProgress.SKIPPED, store.progressOf(alice, phrase.getId()));
    }

    @Test
    void testSkipAfterCompletionHasNoEffect() {
        Phrase phrase = globalPhrase("quick brown fox", 40);
        store.recordCompletion(alice, phrase.getId(), 40, 0, 1000L);

        assertFalse(store.recordSkip(alice, phrase.getId()));
        assertFalse(skipRepository.existsByPlayerIdAndPhraseId(alice, phrase.getId()));
        assertEquals(PhraseProgress.COMPLETED, store.progressOf(alice, phrase.getId()));
    }

    @Test
    void testCompletedPhraseLeavesSkipFallback() {
        Phrase phrase = globalPhrase("quick brown fox", 40);
        store.recordSkip(alice, phrase.getId());
        store.recordCompletion(alice, phrase.getId(), 40, 0, 1000L);

        assertTrue(store.skipFallbackPhrases(alice, 10).isEmpty());
        assertEquals(PhraseProgress.COMPLETED, store.progressOf(alice, phrase.getId()));
    }

    @Test
    void testAuthorNeverGetsOwnPhrase() {
        Phrase own = store.createPhraseWithTargets(newPhrase("quick brown fox", 40, true, true, alice), List.of());

        assertFalse(ids(store.eligibleGlobalPhrases(alice, 100, 10)).contains(own.getId()));
        assertTrue(ids(store.eligibleGlobalPhrases(bob, 100, 10)).contains(own.getId()));
    }

    @Test
    void testGlobalPoolFilters() {
        Phrase easy = globalPhrase("easy one", 30);
        Phrase medium = globalPhrase("medium one", 60);
        globalPhrase("hard one", 80);
        store.createPhraseWithTargets(newPhrase("pending one", 10, true, false, bob), List.of());
        store.createPhraseWithTargets(newPhrase("private one", 10, false, true, bob), List.of(bob));

        assertEquals(Set.of(easy.getId(), medium.getId()), ids(store.eligibleGlobalPhrases(alice, 75, 10)),
                "Only approved global phrases under the ceiling");
        assertEquals(1, store.eligibleGlobalPhrases(alice, 75, 1).size(), "Limit caps the batch");
    }

    @Test
    void testTargetedOrderPriorityThenFifo() {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        Phrase later = store.createPhraseWithTargets(newPhrase("later one", 10, false, true, bob), List.of());
        Phrase earlier = store.createPhraseWithTargets(newPhrase("earlier one", 10, false, true, bob), List.of());
        Phrase lowPriority = store.createPhraseWithTargets(newPhrase("low one", 10, false, true, bob), List.of());

        assignmentRepository.insertIgnoringConflict(UUID.randomUUID(), later.getId(), alice, 1, now.plusSeconds(5));
        assignmentRepository.insertIgnoringConflict(UUID.randomUUID(), earlier.getId(), alice, 1, now);
        assignmentRepository.insertIgnoringConflict(UUID.randomUUID(), lowPriority.getId(), alice, 2, now.minusSeconds(60));

        assertEquals(earlier.getId(), store.nextTargetedAssignment(alice).orElseThrow().getPhrase().getId());
        assertTrue(store.markAssignmentDelivered(earlier.getId(), alice));

        assertEquals(later.getId(), store.nextTargetedAssignment(alice).orElseThrow().getPhrase().getId());
        assertTrue(store.markAssignmentDelivered(later.getId(), alice));

        assertEquals(lowPriority.getId(), store.nextTargetedAssignment(alice).orElseThrow().getPhrase().getId());
        assertTrue(store.markAssignmentDelivered(lowPriority.getId(), alice));

        assertTrue(store.nextTargetedAssignment(alice).isEmpty());
    }

    @Test
    void testDeliveryIsIdempotent() {
        Phrase phrase = store.createPhraseWithTargets(newPhrase("quick brown fox", 40, false, true, bob), List.of(alice));

        assertTrue(store.markAssignmentDelivered(phrase.getId(), alice));
        assertFalse(store.markAssignmentDelivered(phrase.getId(), alice), "Already delivered");
        assertFalse(store.markAssignmentDelivered(phrase.getId(), bob), "No assignment for this player");
    }

    @Test
    void testInboxSkipsHandledPhrases() {
        Phrase skipped = store.createPhraseWithTargets(newPhrase("skip me", 40, false, true, bob), List.of(alice));
        Phrase solved = store.createPhraseWithTargets(newPhrase("solve me", 40, false, true, bob), List.of(alice));

        store.recordSkip(alice, skipped.getId());
        store.recordCompletion(alice, solved.getId(), 40, 0, 100L);

        assertTrue(store.nextTargetedAssignment(alice).isEmpty());
        assertEquals(Set.of(skipped.getId()), ids(store.skipFallbackPhrases(alice, 10)),
                "A skipped targeted phrase comes back through the fallback tier");
    }

    @Test
    void testUsageCountIncrements() {
        Phrase phrase = globalPhrase("quick brown fox", 40);

        store.incrementUsageCount(phrase.getId());
        store.incrementUsageCount(phrase.getId());

        entityManager.clear();

        assertEquals(2, phraseRepository.findById(phrase.getId()).orElseThrow().getUsageCount());
    }

    @Test
    void testUnknownPhrase() {
        Optional<Phrase> missing = store.findPhrase(UUID.randomUUID());
        assertTrue(missing.isEmpty());
        assertEquals(PhraseProgress.UNSEEN, store.progressOf(alice, UUID.randomUUID()));
    }
}
