package com.casegovernor.hub;

import com.casegovernor.contract.ChannelMessage;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Named pub/sub topic carrying case data messages. Delivery is at-least-once with
 * no ordering promise; ordering and deduplication belong to the subscribers.
 */
public interface BroadcastChannel {

    /** Publishes a message and returns it stamped with its per-case sequence number. */
    ChannelMessage publish(ChannelMessage message);

    String subscribe(Consumer<ChannelMessage> listener);

    void unsubscribe(String subscriptionId);

    /** Latest message carrying page data for the case, replayed to late subscribers. */
    Optional<ChannelMessage> latest(String caseId);
}
