package com.lyshra.open.claims.core.engine.event.impl;

import com.lyshra.open.claims.integration.contract.IClaimEventListener;
import com.lyshra.open.claims.integration.contract.IClaimEventPublisher;
import com.lyshra.open.claims.integration.enumerations.ClaimEventType;
import com.lyshra.open.claims.integration.models.ClaimEvent;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process event bus for claim events.
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Synchronous fan-out to registered listeners in registration order</li>
 *   <li>Hot {@link Flux} stream for reactive subscribers</li>
 *   <li>Bounded buffer of recent events for inspection</li>
 * </ul>
 *
 * <p>Each event is emitted to the stream first, then handed to listeners. A listener
 * that throws is logged and skipped; delivery to the remaining listeners continues.</p>
 */
@Slf4j
public class InMemoryClaimEventBus implements IClaimEventPublisher {

    public static final int DEFAULT_HISTORY_SIZE = 1000;

    private final List<IClaimEventListener> listeners = new CopyOnWriteArrayList<>();
    private final Sinks.Many<ClaimEvent> sink = Sinks.many().multicast().directBestEffort();
    private final Deque<ClaimEvent> recentEvents = new ArrayDeque<>();
    private final int historySize;

    private final AtomicLong publishedCount = new AtomicLong(0);
    private final AtomicLong listenerFailureCount = new AtomicLong(0);

    public InMemoryClaimEventBus() {
        this(DEFAULT_HISTORY_SIZE);
    }

    public InMemoryClaimEventBus(int historySize) {
        this.historySize = historySize;
    }

    @Override
    public void publish(ClaimEvent event) {
        publishedCount.incrementAndGet();
        log.debug("Publishing claim event: {} for claim {} (actor: {})",
                event.getType(), event.getClaimId(), event.getActor());

        synchronized (recentEvents) {
            recentEvents.addLast(event);
            while (recentEvents.size() > historySize) {
                recentEvents.removeFirst();
            }
        }

        Sinks.EmitResult result;
        synchronized (sink) {
            result = sink.tryEmitNext(event);
        }
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("Could not emit claim event {} for claim {} to stream: {}",
                    event.getType(), event.getClaimId(), result);
        }

        for (IClaimEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                listenerFailureCount.incrementAndGet();
                log.error("Claim event listener {} failed on {} for claim {}",
                        listener.getClass().getSimpleName(), event.getType(), event.getClaimId(), e);
            }
        }
    }

    @Override
    public void addListener(IClaimEventListener listener) {
        listeners.add(listener);
        log.debug("Added claim event listener: {}", listener.getClass().getSimpleName());
    }

    @Override
    public void removeListener(IClaimEventListener listener) {
        listeners.remove(listener);
    }

    @Override
    public Flux<ClaimEvent> events() {
        return sink.asFlux();
    }

    // ========================================================================
    // INSPECTION
    // ========================================================================

    /**
     * Recent events, oldest first.
     */
    public List<ClaimEvent> getRecentEvents() {
        synchronized (recentEvents) {
            return new ArrayList<>(recentEvents);
        }
    }

    public List<ClaimEvent> getRecentEvents(String claimId) {
        return getRecentEvents().stream()
                .filter(event -> event.getClaimId().equals(claimId))
                .toList();
    }

    public List<ClaimEvent> getRecentEvents(ClaimEventType type) {
        return getRecentEvents().stream()
                .filter(event -> event.getType() == type)
                .toList();
    }

    public long getPublishedCount() {
        return publishedCount.get();
    }

    public long getListenerFailureCount() {
        return listenerFailureCount.get();
    }

    public int getListenerCount() {
        return listeners.size();
    }

    public void clearHistory() {
        synchronized (recentEvents) {
            recentEvents.clear();
        }
    }
}
