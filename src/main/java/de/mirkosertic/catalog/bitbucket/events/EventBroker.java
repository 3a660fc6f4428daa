package de.mirkosertic.catalog.bitbucket.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory, topic based event delivery.
 * <p>
 * Delivery is synchronous on the publishing thread. A failing subscriber does not
 * prevent delivery to the others; the number of failed deliveries is returned so
 * the publisher can decide whether to acknowledge or redeliver.
 */
public class EventBroker {

    private static final Logger logger = LoggerFactory.getLogger(EventBroker.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<EventSubscriber>> subscribersByTopic =
            new ConcurrentHashMap<>();

    /**
     * Register a subscriber for every topic it supports.
     *
     * @return a handle to unsubscribe later
     */
    public Subscription subscribe(final EventSubscriber subscriber) {
        final List<String> topics = List.copyOf(subscriber.supportsEventTopics());
        for (final String topic : topics) {
            subscribersByTopic.computeIfAbsent(topic, k -> new CopyOnWriteArrayList<>()).add(subscriber);
            logger.debug("Subscribed {} to topic {}", subscriber.getClass().getSimpleName(), topic);
        }
        return () -> {
            for (final String topic : topics) {
                final CopyOnWriteArrayList<EventSubscriber> subscribers = subscribersByTopic.get(topic);
                if (subscribers != null) {
                    subscribers.remove(subscriber);
                }
            }
        };
    }

    /**
     * Publish an event to all subscribers of its topic.
     *
     * @return number of subscribers that failed to handle the event
     */
    public int publish(final EventParams params) {
        final List<EventSubscriber> subscribers = subscribersByTopic.get(params.topic());
        if (subscribers == null || subscribers.isEmpty()) {
            logger.debug("No subscribers for topic {}", params.topic());
            return 0;
        }

        int failures = 0;
        for (final EventSubscriber subscriber : subscribers) {
            try {
                subscriber.onEvent(params);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while delivering event on topic {}", params.topic());
                return failures + 1;
            } catch (final Exception e) {
                failures++;
                logger.error("Subscriber {} failed to handle event on topic {}",
                        subscriber.getClass().getSimpleName(), params.topic(), e);
            }
        }
        return failures;
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }
}
