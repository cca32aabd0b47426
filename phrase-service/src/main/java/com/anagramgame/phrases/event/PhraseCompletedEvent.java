package com.anagramgame.phrases.event;

import org.springframework.context.ApplicationEvent;

import java.time.Instant;
import java.util.UUID;

/**
 * Published after a player solves, for the first time, a phrase another player wrote.
 */
public class PhraseCompletedEvent extends ApplicationEvent {

    private final UUID phraseId;
    private final UUID playerId;
    private final UUID authorId;
    private final int score;
    private final Instant completedAt;

    public PhraseCompletedEvent(Object source, UUID phraseId, UUID playerId, UUID authorId, int score, Instant completedAt) {
        super(source);
        this.phraseId = phraseId;
        this.playerId = playerId;
        this.authorId = authorId;
        this.score = score;
        this.completedAt = completedAt;
    }

    public UUID getPhraseId() {
        return phraseId;
    }

    public UUID getPlayerId() {
        return playerId;
    }

    public UUID getAuthorId() {
        return authorId;
    }

    public int getScore() {
        return score;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }
}
