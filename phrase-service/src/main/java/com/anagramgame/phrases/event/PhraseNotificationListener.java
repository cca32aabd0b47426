package com.anagramgame.phrases.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Forwards phrase events to the notification gateway once the writing transaction has committed.
 * A failed push never affects the stored phrase or record.
 */
@Slf4j
@Component
public class PhraseNotificationListener {

    private final PhraseNotificationGateway gateway;

    public PhraseNotificationListener(PhraseNotificationGateway gateway) {
        this.gateway = gateway;
    }

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onPhraseCreated(PhraseCreatedEvent event) {
        try {
            gateway.phraseCreated(event);
        } catch (Exception e) {
            log.warn("Failed to notify creation of phrase {} for target {}: {}",
                    event.getPhraseId(), event.getTargetPlayerId(), e.getMessage());
        }
    }

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onPhraseCompleted(PhraseCompletedEvent event) {
        try {
            gateway.phraseCompleted(event);
        } catch (Exception e) {
            log.warn("Failed to notify author {} of completion of phrase {}: {}",
                    event.getAuthorId(), event.getPhraseId(), e.getMessage());
        }
    }
}
