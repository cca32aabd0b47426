package com.anagramgame.phrases.event;

/**
 * Transport that pushes real-time notices to connected players.
 */
public interface PhraseNotificationGateway {

    void phraseCreated(PhraseCreatedEvent event);

    void phraseCompleted(PhraseCompletedEvent event);
}
