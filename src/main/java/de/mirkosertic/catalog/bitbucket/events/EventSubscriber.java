package de.mirkosertic.catalog.bitbucket.events;

import java.util.List;

public interface EventSubscriber {

    List<String> supportsEventTopics();

    /**
     * Handle one event. Failures propagate to the publisher.
     */
    void onEvent(EventParams params) throws Exception;
}
