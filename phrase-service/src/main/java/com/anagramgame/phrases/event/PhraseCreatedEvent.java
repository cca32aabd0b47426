package com.anagramgame.phrases.event;

import org.springframework.context.ApplicationEvent;

import java.time.Instant;
import java.util.UUID;

/**
 * Published once per target when a phrase is created, plus once with a null target
 * when the phrase goes to the global pool. Listeners only see it after the creating
 * transaction commits.
 */
public class PhraseCreatedEvent extends ApplicationEvent {

    private final UUID phraseId;
    private final UUID targetPlayerId;
    private final String senderName;
    private final Instant createdAt;

    public PhraseCreatedEvent(Object source, UUID phraseId, UUID targetPlayerId, String senderName, Instant createdAt) {
        super(source);
        this.phraseId = phraseId;
        this.targetPlayerId = targetPlayerId;
        this.senderName = senderName;
        this.createdAt = createdAt;
    }

    public UUID getPhraseId() {
        return phraseId;
    }

    /**
     * @return the receiving player, or null for a global publish
     */
    public UUID getTargetPlayerId() {
        return targetPlayerId;
    }

    public String getSenderName() {
        return senderName;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public boolean isGlobalPublish() {
        return targetPlayerId == null;
    }
}
