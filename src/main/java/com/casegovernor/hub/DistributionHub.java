package com.casegovernor.hub;

import com.casegovernor.aggregation.AggregationFailedException;
import com.casegovernor.aggregation.PageDataAggregator;
import com.casegovernor.context.RecordAccessDeniedException;
import com.casegovernor.context.RecordNotFoundException;
import com.casegovernor.contract.AggregationOptions;
import com.casegovernor.contract.ChannelMessage;
import com.casegovernor.contract.PageData;
import com.casegovernor.contract.PageDataContractValidator;
import com.casegovernor.contract.Section;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Governor of one mounted page: builds the page's case data once and broadcasts it,
 * then republishes a complete PageData for every refresh request.
 *
 * <pre>
 * IDLE -> LOADING -> PUBLISHED -> REFRESH_PENDING -> PUBLISHED ...
 *            \-> FAILED (error broadcast, no payload)
 * any state -> TORN_DOWN
 * </pre>
 *
 * Refresh requests arrive either as direct calls or as payload-less refresh
 * messages on the channel. Builds that complete after teardown are dropped.
 */
public class DistributionHub {

    private static final Logger log = LoggerFactory.getLogger(DistributionHub.class);

    private final String pageId;
    private final PageDataAggregator aggregator;
    private final BroadcastChannel channel;
    private final PageDataCodec codec;
    private final PageDataContractValidator validator;
    private final Clock clock;

    private final AtomicReference<HubState> state = new AtomicReference<>(HubState.IDLE);
    private final AtomicInteger pendingRefreshes = new AtomicInteger();
    private volatile String caseId;
    private volatile String subscriptionId;

    public DistributionHub(String pageId,
                           PageDataAggregator aggregator,
                           BroadcastChannel channel,
                           PageDataCodec codec,
                           PageDataContractValidator validator,
                           Clock clock) {
        this.pageId = pageId;
        this.aggregator = aggregator;
        this.channel = channel;
        this.codec = codec;
        this.validator = validator;
        this.clock = clock;
    }

    public CompletableFuture<PageData> onMount(String caseId) {
        if (caseId == null || caseId.isBlank()) {
            throw new IllegalArgumentException("caseId is required");
        }
        if (!state.compareAndSet(HubState.IDLE, HubState.LOADING)) {
            throw new IllegalStateException("hub for page " + pageId + " cannot mount from state " + state.get());
        }
        this.caseId = caseId;
        this.subscriptionId = channel.subscribe(this::onChannelMessage);
        log.info("Governor mounted page={} case={}", pageId, caseId);

        return aggregator.buildPageDataAsync(caseId, AggregationOptions.full())
            .whenComplete((pageData, error) -> {
                if (error == null && publishSafely(pageData, null, true)) {
                    state.compareAndSet(HubState.LOADING, HubState.PUBLISHED);
                    return;
                }
                if (error != null) {
                    publishError(error);
                }
                state.compareAndSet(HubState.LOADING, HubState.FAILED);
            });
    }

    /**
     * Rebuilds after a write. {@code section} narrows which cached records are
     * re-read; the published PageData is always complete.
     */
    public CompletableFuture<PageData> onRefreshRequest(String requestedCaseId, Section section) {
        HubState current = state.get();
        if (current == HubState.TORN_DOWN || current == HubState.IDLE) {
            log.debug("Ignoring refresh request page={} state={}", pageId, current);
            return CompletableFuture.completedFuture(null);
        }
        if (!caseId.equals(requestedCaseId)) {
            log.debug("Ignoring refresh request for case={} on page={} governing case={}",
                requestedCaseId, pageId, caseId);
            return CompletableFuture.completedFuture(null);
        }

        pendingRefreshes.incrementAndGet();
        state.getAndUpdate(s -> s == HubState.TORN_DOWN ? s : HubState.REFRESH_PENDING);
        log.info("Refresh requested page={} case={} section={}",
            pageId, caseId, section == null ? "all" : section.getValue());

        return aggregator.refresh(caseId, section)
            .whenComplete((pageData, error) -> {
                boolean last = pendingRefreshes.decrementAndGet() == 0;
                boolean published = error == null && publishSafely(pageData, section, false);
                if (error != null) {
                    publishError(error);
                }
                if (last) {
                    state.compareAndSet(HubState.REFRESH_PENDING, published ? HubState.PUBLISHED : HubState.FAILED);
                }
            });
    }

    /** Releases the channel subscription. Safe to call any number of times. */
    public void onTeardown() {
        HubState previous = state.getAndSet(HubState.TORN_DOWN);
        if (previous == HubState.TORN_DOWN) {
            return;
        }
        channel.unsubscribe(subscriptionId);
        subscriptionId = null;
        log.info("Governor torn down page={} case={}", pageId, caseId);
    }

    public HubState state() {
        return state.get();
    }

    public String pageId() {
        return pageId;
    }

    public String caseId() {
        return caseId;
    }

    private void onChannelMessage(ChannelMessage message) {
        if (!message.refreshRequested() || !message.caseId().equals(caseId)) {
            return;
        }
        Section section = null;
        if (message.section() != null && !message.section().isBlank()) {
            try {
                section = Section.fromValue(message.section());
            } catch (IllegalArgumentException ex) {
                log.warn("Unknown section in refresh request case={} section={}, refreshing all",
                    message.caseId(), message.section());
            }
        }
        onRefreshRequest(message.caseId(), section);
    }

    private boolean publishSafely(PageData pageData, Section section, boolean initialLoad) {
        try {
            publish(pageData, section, initialLoad);
            return true;
        } catch (RuntimeException ex) {
            publishError(ex);
            return false;
        }
    }

    /** {@code initialLoad} marks the mount build, published as a load whatever the state is by then. */
    private void publish(PageData pageData, Section section, boolean initialLoad) {
        if (state.get() == HubState.TORN_DOWN) {
            log.debug("Dropping page data built after teardown page={} case={}", pageId, pageData.caseId());
            return;
        }
        validator.validate(pageData);
        String payload = codec.encode(pageData);
        ChannelMessage message = initialLoad
            ? ChannelMessage.load(pageData.caseId(), payload, clock.instant())
            : ChannelMessage.refresh(pageData.caseId(), payload, section == null ? null : section.getValue(),
                clock.instant());
        validator.validate(message);
        ChannelMessage published = channel.publish(message);
        log.info("Published page data page={} case={} event_type={} sequence={} generated_at={}",
            pageId, pageData.caseId(), published.eventType().getValue(), published.sequenceNumber(),
            pageData.generatedAt());
    }

    private void publishError(Throwable error) {
        if (state.get() == HubState.TORN_DOWN) {
            return;
        }
        Throwable cause = unwrap(error);
        log.error("Governor build failed page={} case={}: {}", pageId, caseId, cause.getMessage());
        channel.publish(ChannelMessage.error(caseId, publicMessage(cause), clock.instant()));
    }

    /** User-safe text for a failed build; never includes record field values. */
    static String publicMessage(Throwable error) {
        Throwable cause = error instanceof AggregationFailedException && error.getCause() != null
            ? error.getCause()
            : error;
        if (cause instanceof RecordAccessDeniedException) {
            return "You do not have access to this case";
        }
        if (cause instanceof RecordNotFoundException) {
            return "Case not found";
        }
        return "Case data could not be loaded";
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
