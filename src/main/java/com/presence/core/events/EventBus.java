package com.presence.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for turn and tracking events.
 * <p>
 * Supports per-user subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<PresenceEvent>>> userSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<PresenceEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(PresenceEvent event) {
        log.debug("Publishing event: {} for user {}", event.eventType(), event.userId());

        List<Consumer<PresenceEvent>> userSubs = event.userId() != null ? userSubscribers.get(event.userId()) : null;
        if (userSubs != null) {
            for (Consumer<PresenceEvent> subscriber : userSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<PresenceEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a single user.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String userId, Consumer<PresenceEvent> consumer) {
        userSubscribers.computeIfAbsent(userId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to user {}", userId);
        return () -> {
            CopyOnWriteArrayList<Consumer<PresenceEvent>> subs = userSubscribers.get(userId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    public Subscription subscribeAll(Consumer<PresenceEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<PresenceEvent> subscriber, PresenceEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
