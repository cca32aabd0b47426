package com.anagramgame.phrases.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default gateway used when no push transport is deployed alongside the service.
 */
@Slf4j
@Component
public class LoggingPhraseNotificationGateway implements PhraseNotificationGateway {

    @Override
    public void phraseCreated(PhraseCreatedEvent event) {
        if (event.isGlobalPublish()) {
            log.info("Phrase {} published globally by {}", event.getPhraseId(), event.getSenderName());
        } else {
            log.info("Phrase {} from {} ready for player {}",
                    event.getPhraseId(), event.getSenderName(), event.getTargetPlayerId());
        }
    }

    @Override
    public void phraseCompleted(PhraseCompletedEvent event) {
        log.info("Player {} solved phrase {} by {} for {} points",
                event.getPlayerId(), event.getPhraseId(), event.getAuthorId(), event.getScore());
    }
}
