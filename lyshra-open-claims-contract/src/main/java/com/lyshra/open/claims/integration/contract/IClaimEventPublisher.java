package com.lyshra.open.claims.integration.contract;

import com.lyshra.open.claims.integration.models.ClaimEvent;
import reactor.core.publisher.Flux;

/**
 * Fan-out point for claim events.
 *
 * <p>A failing listener never affects other listeners or the publisher.</p>
 */
public interface IClaimEventPublisher {

    void publish(ClaimEvent event);

    void addListener(IClaimEventListener listener);

    void removeListener(IClaimEventListener listener);

    /**
     * Hot stream of events published after subscription.
     */
    Flux<ClaimEvent> events();
}
