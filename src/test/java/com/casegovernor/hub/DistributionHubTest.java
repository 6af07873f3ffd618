package com.casegovernor.hub;

import com.casegovernor.aggregation.PageDataAggregator;
import com.casegovernor.contract.ChannelEventType;
import com.casegovernor.contract.ChannelMessage;
import com.casegovernor.contract.EntityType;
import com.casegovernor.contract.PageData;
import com.casegovernor.contract.Section;
import com.casegovernor.support.Eventually;
import com.casegovernor.support.GovernorFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.casegovernor.support.CaseRecords.record;
import static org.junit.jupiter.api.Assertions.*;

class DistributionHubTest {

    private final GovernorFixture fixture = new GovernorFixture();
    private final List<ChannelMessage> received = new CopyOnWriteArrayList<>();

    @BeforeEach
    void subscribe() {
        fixture.channel.subscribe(received::add);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        fixture.close();
    }

    private DistributionHub newHub(PageDataAggregator aggregator) {
        return new DistributionHub("page-1", aggregator, fixture.channel, fixture.codec, fixture.validator,
            fixture.clock);
    }

    private List<ChannelMessage> messagesOf(ChannelEventType type) {
        return received.stream().filter(m -> m.eventType() == type).toList();
    }

    @Nested
    @DisplayName("Mount")
    class Mount {

        @Test
        void publishesOneLoadWithCompletePageData() {
            fixture.seedCase("500A");
            DistributionHub hub = newHub(fixture.aggregator);

            PageData built = hub.onMount("500A").join();

            assertEquals(HubState.PUBLISHED, hub.state());
            List<ChannelMessage> loads = messagesOf(ChannelEventType.LOAD);
            assertEquals(1, loads.size());
            PageData published = fixture.codec.decode(loads.get(0).pageData());
            assertEquals(built, published);
            assertEquals("500A", loads.get(0).caseId());
            assertEquals(1L, loads.get(0).sequenceNumber());
        }

        @Test
        void secondMount_isRejected() {
            fixture.seedCase("500A");
            DistributionHub hub = newHub(fixture.aggregator);
            hub.onMount("500A").join();

            assertThrows(IllegalStateException.class, () -> hub.onMount("500A"));
        }

        @Test
        void missingCase_publishesErrorWithoutPayload() {
            DistributionHub hub = newHub(fixture.aggregator);

            assertThrows(CompletionException.class, () -> hub.onMount("500MISSING").join());

            assertEquals(HubState.FAILED, hub.state());
            assertTrue(messagesOf(ChannelEventType.LOAD).isEmpty());
            ChannelMessage error = messagesOf(ChannelEventType.ERROR).get(0);
            assertEquals("Case not found", error.errorMessage());
            assertFalse(error.hasPageData());
        }

        @Test
        void deniedCase_publishesAccessError() {
            fixture.seedCase("500A");
            fixture.recordSource.denyRead(EntityType.CASE, "500A");
            DistributionHub hub = newHub(fixture.aggregator);

            assertThrows(CompletionException.class, () -> hub.onMount("500A").join());

            assertEquals("You do not have access to this case", messagesOf(ChannelEventType.ERROR).get(0).errorMessage());
        }
    }

    @Nested
    @DisplayName("Refresh")
    class Refresh {

        @Test
        void refreshRequest_publishesNewerCompletePageData() {
            fixture.seedCase("500A");
            DistributionHub hub = newHub(fixture.aggregator);
            PageData loaded = hub.onMount("500A").join();
            fixture.recordSource.seed(record(EntityType.QUOTE, "0Q0-500A", "status", "Accepted"));

            PageData refreshed = hub.onRefreshRequest("500A", Section.QUOTES).join();

            assertEquals(HubState.PUBLISHED, hub.state());
            assertTrue(refreshed.newerThan(loaded));
            ChannelMessage refresh = messagesOf(ChannelEventType.REFRESH).get(0);
            assertEquals("quotes", refresh.section());
            PageData published = fixture.codec.decode(refresh.pageData());
            assertEquals("Accepted", published.relatedRecordSet().quotes().get("0Q0-500A").field("status"));
            assertNotNull(published.caseSnapshot());
            assertTrue(published.ruleResult().evaluated());
        }

        @Test
        void refreshDuringLoading_stillPublishesTheMountBuildAsLoad() {
            fixture.seedCase("500A");
            Queue<Runnable> queued = new ArrayDeque<>();
            PageDataAggregator gated = new PageDataAggregator(fixture.contextStore, fixture.ruleEvaluator,
                fixture.snapshotMapper, fixture.generationClock, queued::add, Runnable::run);
            DistributionHub hub = newHub(gated);

            hub.onMount("500A");
            hub.onRefreshRequest("500A", null);
            assertEquals(HubState.REFRESH_PENDING, hub.state());
            while (!queued.isEmpty()) {
                queued.poll().run();
            }

            assertEquals(List.of(ChannelEventType.LOAD, ChannelEventType.REFRESH),
                received.stream().map(ChannelMessage::eventType).toList());
            assertEquals(HubState.PUBLISHED, hub.state());
        }

        @Test
        void refreshForAnotherCase_isIgnored() {
            fixture.seedCase("500A");
            DistributionHub hub = newHub(fixture.aggregator);
            hub.onMount("500A").join();

            assertNull(hub.onRefreshRequest("500B", null).join());
            assertTrue(messagesOf(ChannelEventType.REFRESH).isEmpty());
        }

        @Test
        void refreshBeforeMount_isIgnored() {
            DistributionHub hub = newHub(fixture.aggregator);

            assertNull(hub.onRefreshRequest("500A", null).join());
            assertEquals(HubState.IDLE, hub.state());
        }

        @Test
        void payloadlessRefreshOnChannel_triggersRebuild() {
            fixture.seedCase("500A");
            DistributionHub hub = newHub(fixture.aggregator);
            hub.onMount("500A").join();

            fixture.channel.publish(ChannelMessage.refreshRequest("500A", "asset", fixture.clock.instant()));

            Eventually.await("refresh with page data", () -> received.stream()
                .anyMatch(m -> m.eventType() == ChannelEventType.REFRESH && m.hasPageData()));
            Eventually.await("hub settles", () -> hub.state() == HubState.PUBLISHED);
        }

        @Test
        void unknownSectionOnChannel_refreshesEverything() {
            fixture.seedCase("500A");
            DistributionHub hub = newHub(fixture.aggregator);
            hub.onMount("500A").join();

            fixture.channel.publish(ChannelMessage.refreshRequest("500A", "billing", fixture.clock.instant()));

            Eventually.await("full refresh", () -> received.stream()
                .anyMatch(m -> m.eventType() == ChannelEventType.REFRESH && m.hasPageData() && m.section() == null));
        }

        @Test
        void failedRefresh_publishesErrorAndMarksFailed() {
            fixture.seedCase("500A");
            DistributionHub hub = newHub(fixture.aggregator);
            hub.onMount("500A").join();
            fixture.recordSource.remove(EntityType.CASE, "500A");

            assertThrows(CompletionException.class, () -> hub.onRefreshRequest("500A", Section.CASE).join());

            assertEquals(HubState.FAILED, hub.state());
            assertEquals("Case not found", messagesOf(ChannelEventType.ERROR).get(0).errorMessage());
        }
    }

    @Nested
    @DisplayName("Teardown")
    class Teardown {

        @Test
        void isIdempotentAndReleasesSubscription() {
            fixture.seedCase("500A");
            DistributionHub hub = newHub(fixture.aggregator);
            hub.onMount("500A").join();
            int subscribers = fixture.channel.subscriberCount();

            hub.onTeardown();
            hub.onTeardown();

            assertEquals(HubState.TORN_DOWN, hub.state());
            assertEquals(subscribers - 1, fixture.channel.subscriberCount());
            assertNull(hub.onRefreshRequest("500A", null).join());
        }

        @Test
        void buildCompletingAfterTeardown_isNotPublished() {
            fixture.seedCase("500A");
            Queue<Runnable> queued = new ArrayDeque<>();
            PageDataAggregator gated = new PageDataAggregator(fixture.contextStore, fixture.ruleEvaluator,
                fixture.snapshotMapper, fixture.generationClock, queued::add, Runnable::run);
            DistributionHub hub = newHub(gated);

            hub.onMount("500A");
            hub.onTeardown();
            while (!queued.isEmpty()) {
                queued.poll().run();
            }

            assertEquals(HubState.TORN_DOWN, hub.state());
            assertTrue(received.isEmpty());
        }
    }

    @Test
    void publicMessage_neverLeaksDetails() {
        assertEquals("Case data could not be loaded",
            DistributionHub.publicMessage(new IllegalStateException("account 001 field secret=42")));
    }
}
