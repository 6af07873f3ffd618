package com.casegovernor.hub;

import com.casegovernor.contract.ChannelMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-process broadcast log. Sequence numbers increase monotonically per case id;
 * listeners are notified on the publishing thread and isolated from each other.
 */
@Component
public class InMemoryBroadcastChannel implements BroadcastChannel {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBroadcastChannel.class);

    private final ConcurrentHashMap<String, AtomicLong> sequences = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ChannelMessage> latestData = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Consumer<ChannelMessage>> subscribers = new ConcurrentHashMap<>();

    @Override
    public ChannelMessage publish(ChannelMessage message) {
        long sequence = sequences.computeIfAbsent(message.caseId(), id -> new AtomicLong()).incrementAndGet();
        ChannelMessage stamped = message.withSequenceNumber(sequence);
        if (stamped.hasPageData()) {
            latestData.merge(stamped.caseId(), stamped, (current, candidate) ->
                candidate.sequenceNumber() > current.sequenceNumber() ? candidate : current);
        }
        log.debug("Broadcast case={} event_type={} sequence={}",
            stamped.caseId(), stamped.eventType().getValue(), sequence);
        notifySubscribers(stamped);
        return stamped;
    }

    @Override
    public String subscribe(Consumer<ChannelMessage> listener) {
        String id = UUID.randomUUID().toString();
        subscribers.put(id, listener);
        return id;
    }

    @Override
    public void unsubscribe(String subscriptionId) {
        if (subscriptionId != null) {
            subscribers.remove(subscriptionId);
        }
    }

    @Override
    public Optional<ChannelMessage> latest(String caseId) {
        return Optional.ofNullable(latestData.get(caseId));
    }

    public long latestSequence(String caseId) {
        AtomicLong sequence = sequences.get(caseId);
        return sequence == null ? 0 : sequence.get();
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    private void notifySubscribers(ChannelMessage message) {
        subscribers.values().forEach(listener -> {
            try {
                listener.accept(message);
            } catch (Exception ex) {
                log.warn("Subscriber notification failed case={} sequence={}: {}",
                    message.caseId(), message.sequenceNumber(), ex.getMessage());
            }
        });
    }
}
