package com.casegovernor.hub;

import com.casegovernor.contract.ChannelEventType;
import com.casegovernor.contract.ChannelMessage;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryBroadcastChannelTest {

    private static final Instant TS = Instant.parse("2026-10-19T09:00:00Z");

    private final InMemoryBroadcastChannel channel = new InMemoryBroadcastChannel();

    @Test
    void sequenceNumbers_increasePerCase() {
        ChannelMessage a1 = channel.publish(ChannelMessage.load("500A", "{}", TS));
        ChannelMessage b1 = channel.publish(ChannelMessage.load("500B", "{}", TS));
        ChannelMessage a2 = channel.publish(ChannelMessage.refreshRequest("500A", null, TS));

        assertEquals(1L, a1.sequenceNumber());
        assertEquals(1L, b1.sequenceNumber());
        assertEquals(2L, a2.sequenceNumber());
        assertEquals(2L, channel.latestSequence("500A"));
        assertEquals(0L, channel.latestSequence("500C"));
    }

    @Test
    void latest_onlyTracksMessagesWithPageData() {
        channel.publish(ChannelMessage.load("500A", "{\"v\":1}", TS));
        channel.publish(ChannelMessage.refreshRequest("500A", "quotes", TS));
        channel.publish(ChannelMessage.error("500A", "Case data could not be loaded", TS));

        ChannelMessage latest = channel.latest("500A").orElseThrow();
        assertEquals(ChannelEventType.LOAD, latest.eventType());
        assertEquals("{\"v\":1}", latest.pageData());
        assertTrue(channel.latest("500B").isEmpty());
    }

    @Test
    void failingSubscriber_doesNotStopOthers() {
        List<ChannelMessage> received = new CopyOnWriteArrayList<>();
        channel.subscribe(message -> {
            throw new IllegalStateException("listener broke");
        });
        channel.subscribe(received::add);

        assertDoesNotThrow(() -> channel.publish(ChannelMessage.load("500A", "{}", TS)));
        assertEquals(1, received.size());
    }

    @Test
    void unsubscribe_stopsDelivery() {
        List<ChannelMessage> received = new CopyOnWriteArrayList<>();
        String id = channel.subscribe(received::add);

        channel.unsubscribe(id);
        channel.unsubscribe(id);
        channel.unsubscribe(null);
        channel.publish(ChannelMessage.load("500A", "{}", TS));

        assertTrue(received.isEmpty());
        assertEquals(0, channel.subscriberCount());
    }
}
