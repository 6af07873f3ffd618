package com.casegovernor.consumer;

import com.casegovernor.context.RecordPatch;
import com.casegovernor.context.WriteResult;
import com.casegovernor.contract.AggregationOptions;
import com.casegovernor.contract.ChannelMessage;
import com.casegovernor.contract.EntityType;
import com.casegovernor.contract.PageData;
import com.casegovernor.contract.Section;
import com.casegovernor.hub.DistributionHub;
import com.casegovernor.hub.HubState;
import com.casegovernor.support.Eventually;
import com.casegovernor.support.GovernorFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CaseDataConsumerTest {

    private static final Duration SHORT_WAIT = Duration.ofMillis(150);
    private static final Duration LONG_WAIT = Duration.ofSeconds(30);

    private final GovernorFixture fixture = new GovernorFixture();
    private final ThreadPoolTaskScheduler scheduler = scheduler();
    private final List<CaseDataConsumer> consumers = new CopyOnWriteArrayList<>();

    private static ThreadPoolTaskScheduler scheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("consumer-wait-test-");
        scheduler.initialize();
        return scheduler;
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        consumers.forEach(CaseDataConsumer::unmount);
        scheduler.shutdown();
        fixture.close();
    }

    private CaseDataConsumer consumer(String name, String caseId, Duration wait, RecordingListener listener) {
        CaseDataConsumerFactory factory = new CaseDataConsumerFactory(fixture.channel, fixture.queryService,
            fixture.codec, fixture.validator, fixture.recordSource, fixture.contextStore, scheduler, fixture.clock,
            new ConsumerProperties(wait));
        CaseDataConsumer consumer = factory.create(name, caseId, listener);
        consumers.add(consumer);
        return consumer;
    }

    private List<ChannelMessage> recordChannel() {
        List<ChannelMessage> received = new CopyOnWriteArrayList<>();
        fixture.channel.subscribe(received::add);
        return received;
    }

    private static PageData await(CaseDataConsumer consumer) throws Exception {
        return consumer.firstData().get(5, TimeUnit.SECONDS);
    }

    static class RecordingListener implements CaseDataListener {

        final List<PageData> received = new CopyOnWriteArrayList<>();
        final List<Throwable> errors = new CopyOnWriteArrayList<>();

        @Override
        public void onPageData(PageData pageData) {
            received.add(pageData);
        }

        @Override
        public void onError(String caseId, Throwable error) {
            errors.add(error);
        }
    }

    @Nested
    @DisplayName("With a governor")
    class Governed {

        @Test
        @DisplayName("Two consumers on a governed page share one build")
        void consumersShareTheGovernorBuild() throws Exception {
            fixture.seedCase("500A");
            fixture.registry.mount("page-1", "500A");
            CaseDataConsumer header = consumer("header", "500A", LONG_WAIT, new RecordingListener());
            CaseDataConsumer sidebar = consumer("sidebar", "500A", LONG_WAIT, new RecordingListener());

            header.mount();
            sidebar.mount();

            PageData headerData = await(header);
            PageData sidebarData = await(sidebar);
            assertEquals(headerData, sidebarData);
            assertTrue(header.hasReceivedGovernorData());
            assertTrue(sidebar.hasReceivedGovernorData());
            assertFalse(header.usedFallback());
            assertFalse(sidebar.usedFallback());
            assertEquals(1, fixture.recordSource.fetchCount(EntityType.CASE, "500A"));
        }

        @Test
        void lateMount_replaysLatestPublication() throws Exception {
            fixture.seedCase("500A");
            DistributionHub hub = fixture.registry.mount("page-1", "500A");
            Eventually.await("hub published", () -> hub.state() == HubState.PUBLISHED);

            CaseDataConsumer late = consumer("late", "500A", LONG_WAIT, new RecordingListener());
            late.mount();

            assertEquals("500A", late.current().orElseThrow().caseId());
            assertTrue(late.hasReceivedGovernorData());
        }

        @Test
        void governorError_startsFallbackImmediately() throws Exception {
            fixture.seedCase("500A");
            CaseDataConsumer consumer = consumer("header", "500A", LONG_WAIT, new RecordingListener());
            consumer.mount();

            fixture.channel.publish(ChannelMessage.error("500A", "Case data could not be loaded",
                fixture.clock.instant()));

            assertEquals("500A", await(consumer).caseId());
            assertTrue(consumer.usedFallback());
            assertFalse(consumer.hasReceivedGovernorData());
        }

        @Test
        void write_requestsGovernorRefreshInsteadOfReloading() throws Exception {
            fixture.seedCase("500A");
            fixture.registry.mount("page-1", "500A");
            CaseDataConsumer consumer = consumer("quotes", "500A", LONG_WAIT, new RecordingListener());
            consumer.mount();
            PageData before = await(consumer);
            List<ChannelMessage> received = recordChannel();

            WriteResult result = consumer.write(new RecordPatch(EntityType.QUOTE, "0Q0-500A", Map.of("status", "Sent")));

            assertTrue(result.success());
            Eventually.await("governor republishes the quote", () -> consumer.current()
                .map(p -> "Sent".equals(p.relatedRecordSet().quotes().get("0Q0-500A").field("status")))
                .orElse(false));
            assertTrue(consumer.current().orElseThrow().newerThan(before));
            assertEquals(1, received.stream().filter(ChannelMessage::refreshRequested).count());
            assertEquals("quotes", received.get(0).section());
            assertFalse(consumer.usedFallback());
        }
    }

    @Nested
    @DisplayName("Without a governor")
    class Ungoverned {

        @Test
        @DisplayName("Fallback after the wait yields the same rules as the governor path")
        void fallbackMatchesGovernorPath() throws Exception {
            fixture.seedCase("500A");
            RecordingListener listener = new RecordingListener();
            CaseDataConsumer consumer = consumer("header", "500A", SHORT_WAIT, listener);

            consumer.mount();
            PageData fallback = await(consumer);

            assertTrue(consumer.usedFallback());
            assertFalse(consumer.hasReceivedGovernorData());
            PageData governed = fixture.aggregator.buildPageData("500A", AggregationOptions.full());
            assertEquals(governed.ruleResult(), fallback.ruleResult());
            assertEquals(governed.caseSnapshot(), fallback.caseSnapshot());
            assertEquals(List.of(fallback), listener.received);
        }

        @Test
        void governorDataAfterFallback_isAppliedWhenNewer() throws Exception {
            fixture.seedCase("500A");
            CaseDataConsumer consumer = consumer("header", "500A", SHORT_WAIT, new RecordingListener());
            consumer.mount();
            PageData fallback = await(consumer);

            fixture.registry.mount("page-1", "500A");

            Eventually.await("governor data applied", consumer::hasReceivedGovernorData);
            assertTrue(consumer.current().orElseThrow().newerThan(fallback));
        }

        @Test
        void write_reloadsDirectlyWithoutPublishing() throws Exception {
            fixture.seedCase("500A");
            CaseDataConsumer consumer = consumer("case-form", "500A", SHORT_WAIT, new RecordingListener());
            consumer.mount();
            await(consumer);
            List<ChannelMessage> received = recordChannel();

            consumer.write(new RecordPatch(EntityType.CASE, "500A", Map.of("status", "Pending")));

            Eventually.await("reloaded case", () -> consumer.current()
                .map(p -> "Pending".equals(p.caseSnapshot().status()))
                .orElse(false));
            assertTrue(received.isEmpty());
        }

        @Test
        void fallbackFailure_isReportedToTheListener() {
            RecordingListener listener = new RecordingListener();
            CaseDataConsumer consumer = consumer("header", "500MISSING", SHORT_WAIT, listener);

            consumer.mount();

            Eventually.await("error reported", () -> !listener.errors.isEmpty());
            assertTrue(consumer.current().isEmpty());
        }

        @Test
        void unmountBeforeWait_cancelsFallback() throws InterruptedException {
            fixture.seedCase("500A");
            CaseDataConsumer consumer = consumer("header", "500A", SHORT_WAIT, new RecordingListener());

            consumer.mount();
            consumer.unmount();
            Thread.sleep(SHORT_WAIT.toMillis() * 3);

            assertFalse(consumer.usedFallback());
            assertEquals(0, fixture.recordSource.fetchCount(EntityType.CASE, "500A"));
        }
    }

    @Nested
    @DisplayName("Message handling")
    class Messages {

        private PageData older;
        private PageData newer;

        private CaseDataConsumer mounted() {
            fixture.seedCase("500A");
            older = fixture.aggregator.buildPageData("500A", AggregationOptions.full());
            newer = fixture.aggregator.buildPageData("500A", AggregationOptions.full());
            CaseDataConsumer consumer = consumer("header", "500A", LONG_WAIT, new RecordingListener());
            consumer.mount();
            return consumer;
        }

        private ChannelMessage load(PageData pageData) {
            return ChannelMessage.load(pageData.caseId(), fixture.codec.encode(pageData), fixture.clock.instant());
        }

        @Test
        void outOfOrderDelivery_keepsNewest() {
            CaseDataConsumer consumer = mounted();

            consumer.onMessage(load(newer));
            consumer.onMessage(ChannelMessage.refresh("500A", fixture.codec.encode(older), null,
                fixture.clock.instant()));

            assertEquals(newer, consumer.current().orElseThrow());
        }

        @Test
        void invalidPayload_isIgnored() {
            CaseDataConsumer consumer = mounted();

            consumer.onMessage(ChannelMessage.load("500A", "{\"schema_version\":\"1.0.0\"}", fixture.clock.instant()));
            consumer.onMessage(ChannelMessage.load("500A", "not json", fixture.clock.instant()));

            assertTrue(consumer.current().isEmpty());
            assertFalse(consumer.hasReceivedGovernorData());
        }

        @Test
        void otherCase_isIgnored() {
            CaseDataConsumer consumer = mounted();
            fixture.seedCase("500B");
            PageData other = fixture.aggregator.buildPageData("500B", AggregationOptions.full());

            consumer.onMessage(load(other));

            assertTrue(consumer.current().isEmpty());
        }

        @Test
        void refreshRequest_isNotData() {
            CaseDataConsumer consumer = mounted();

            consumer.onMessage(ChannelMessage.refreshRequest("500A", "quotes", fixture.clock.instant()));

            assertFalse(consumer.hasReceivedGovernorData());
        }

        @Test
        void failedWrite_publishesNothing() {
            CaseDataConsumer consumer = mounted();
            List<ChannelMessage> received = recordChannel();

            WriteResult result = consumer.write(new RecordPatch(EntityType.QUOTE, "0Q0-MISSING", Map.of("status", "Sent")));

            assertFalse(result.success());
            assertTrue(received.isEmpty());
        }
    }

    @Test
    void writtenRecordTypes_mapToSections() {
        assertEquals(Section.CASE, CaseDataConsumer.sectionOf(EntityType.CASE));
        assertEquals(Section.ACCOUNTS, CaseDataConsumer.sectionOf(EntityType.ACCOUNT));
        assertEquals(Section.TASKS, CaseDataConsumer.sectionOf(EntityType.TASK));
        assertEquals(Section.WORK_ORDERS, CaseDataConsumer.sectionOf(EntityType.WORK_ORDER));
        assertEquals(Section.QUOTES, CaseDataConsumer.sectionOf(EntityType.QUOTE));
    }
}
