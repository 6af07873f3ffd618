package com.casegovernor.consumer;

import com.casegovernor.context.ContextStore;
import com.casegovernor.context.RecordPatch;
import com.casegovernor.context.RecordSource;
import com.casegovernor.context.WriteResult;
import com.casegovernor.contract.ChannelEventType;
import com.casegovernor.contract.ChannelMessage;
import com.casegovernor.contract.ContractViolationException;
import com.casegovernor.contract.EntityType;
import com.casegovernor.contract.PageData;
import com.casegovernor.contract.PageDataContractValidator;
import com.casegovernor.contract.Section;
import com.casegovernor.hub.BroadcastChannel;
import com.casegovernor.hub.CaseDataQueryService;
import com.casegovernor.hub.PageDataCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Adapter between one UI component and the case data of its page.
 *
 * On mount it listens on the channel for its case and waits a bounded time for
 * governor data. Without a publication in time, or straight away on a governor
 * error, it fetches through the same query path the governor uses. Governor data
 * arriving after a fallback is still applied when newer.
 *
 * After a local write it asks the governor to refresh when one was detected, or
 * reloads directly otherwise; never both.
 */
public class CaseDataConsumer {

    private static final Logger log = LoggerFactory.getLogger(CaseDataConsumer.class);

    private final String name;
    private final String caseId;
    private final CaseDataListener listener;
    private final BroadcastChannel channel;
    private final CaseDataQueryService queryService;
    private final PageDataCodec codec;
    private final PageDataContractValidator validator;
    private final RecordSource recordSource;
    private final ContextStore contextStore;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final Duration governorWait;

    private final PageDataReducer reducer;
    private final AtomicBoolean mounted = new AtomicBoolean();
    private final AtomicBoolean hasReceivedGovernorData = new AtomicBoolean();
    private final AtomicBoolean fallbackStarted = new AtomicBoolean();
    private final CompletableFuture<PageData> firstData = new CompletableFuture<>();
    private volatile String subscriptionId;
    private volatile ScheduledFuture<?> waitTimer;

    CaseDataConsumer(String name,
                     String caseId,
                     CaseDataListener listener,
                     BroadcastChannel channel,
                     CaseDataQueryService queryService,
                     PageDataCodec codec,
                     PageDataContractValidator validator,
                     RecordSource recordSource,
                     ContextStore contextStore,
                     TaskScheduler scheduler,
                     Clock clock,
                     Duration governorWait) {
        this.name = name;
        this.caseId = caseId;
        this.listener = listener;
        this.channel = channel;
        this.queryService = queryService;
        this.codec = codec;
        this.validator = validator;
        this.recordSource = recordSource;
        this.contextStore = contextStore;
        this.scheduler = scheduler;
        this.clock = clock;
        this.governorWait = governorWait;
        this.reducer = new PageDataReducer(caseId);
    }

    public void mount() {
        if (!mounted.compareAndSet(false, true)) {
            return;
        }
        subscriptionId = channel.subscribe(this::onMessage);
        channel.latest(caseId).ifPresent(this::onMessage);
        if (!hasReceivedGovernorData.get()) {
            waitTimer = scheduler.schedule(this::onWaitExpired, scheduler.getClock().instant().plus(governorWait));
        }
        log.debug("Consumer mounted name={} case={} wait={}", name, caseId, governorWait);
    }

    public void unmount() {
        if (!mounted.compareAndSet(true, false)) {
            return;
        }
        cancelWaitTimer();
        channel.unsubscribe(subscriptionId);
        subscriptionId = null;
        log.debug("Consumer unmounted name={} case={}", name, caseId);
    }

    void onMessage(ChannelMessage message) {
        if (!mounted.get() || !caseId.equals(message.caseId())) {
            return;
        }
        if (message.eventType() == ChannelEventType.ERROR) {
            log.warn("Governor reported an error name={} case={} message={}, falling back",
                name, caseId, message.errorMessage());
            cancelWaitTimer();
            fallback(null);
            return;
        }
        if (!message.hasPageData()) {
            return;
        }

        PageData pageData;
        try {
            validator.validate(message);
            pageData = codec.decode(message.pageData());
            validator.validate(pageData);
        } catch (ContractViolationException ex) {
            log.warn("Discarding invalid governor message name={} case={} sequence={}: {}",
                name, caseId, message.sequenceNumber(), ex.getMessage());
            return;
        }

        hasReceivedGovernorData.set(true);
        cancelWaitTimer();
        apply(pageData);
    }

    /**
     * Persists {@code patch}, drops the written record from the cache and triggers
     * exactly one refresh path.
     */
    public WriteResult write(RecordPatch patch) {
        WriteResult result = recordSource.write(patch);
        if (!result.success()) {
            log.warn("Write rejected name={} record={} errors={}", name, patch.key(), result.errors());
            return result;
        }
        contextStore.invalidate(patch.type(), patch.id());
        Section section = sectionOf(patch.type());
        if (hasReceivedGovernorData.get()) {
            channel.publish(ChannelMessage.refreshRequest(caseId, section.getValue(), clock.instant()));
        } else {
            reload(section);
        }
        return result;
    }

    public Optional<PageData> current() {
        return reducer.current();
    }

    /** Completes with the first PageData this consumer applied, from either path. */
    public CompletableFuture<PageData> firstData() {
        return firstData;
    }

    public boolean hasReceivedGovernorData() {
        return hasReceivedGovernorData.get();
    }

    public boolean usedFallback() {
        return fallbackStarted.get();
    }

    public String name() {
        return name;
    }

    public String caseId() {
        return caseId;
    }

    private void onWaitExpired() {
        if (!mounted.get() || hasReceivedGovernorData.get()) {
            return;
        }
        log.info("No governor data within {} name={} case={}, fetching directly", governorWait, name, caseId);
        fallback(null);
    }

    private void fallback(Section section) {
        fallbackStarted.set(true);
        CompletableFuture<PageData> fetch = section == null
            ? queryService.getPageDataAsync(caseId)
            : queryService.reloadPageData(caseId, section);
        fetch.whenComplete((pageData, error) -> {
            if (error != null) {
                log.error("Direct fetch failed name={} case={}: {}", name, caseId, error.getMessage());
                listener.onError(caseId, error);
                return;
            }
            apply(pageData);
        });
    }

    private void reload(Section section) {
        log.debug("No governor detected name={} case={}, reloading section={}", name, caseId, section.getValue());
        fallback(section);
    }

    private void apply(PageData pageData) {
        if (!mounted.get()) {
            return;
        }
        if (reducer.apply(pageData)) {
            firstData.complete(pageData);
            listener.onPageData(pageData);
        }
    }

    private void cancelWaitTimer() {
        ScheduledFuture<?> timer = waitTimer;
        if (timer != null) {
            timer.cancel(false);
        }
    }

    static Section sectionOf(EntityType type) {
        return switch (type) {
            case CASE -> Section.CASE;
            case ACCOUNT -> Section.ACCOUNTS;
            case CONTACT -> Section.CONTACT;
            case ASSET -> Section.ASSET;
            case TASK -> Section.TASKS;
            case WORK_ORDER -> Section.WORK_ORDERS;
            case QUOTE -> Section.QUOTES;
        };
    }
}
