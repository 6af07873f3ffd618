package com.casegovernor.hub;

import com.casegovernor.aggregation.PageDataAggregator;
import com.casegovernor.contract.AggregationOptions;
import com.casegovernor.contract.ChannelMessage;
import com.casegovernor.contract.PageData;
import com.casegovernor.contract.Section;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;

/**
 * Consumer-facing query surface. {@link #getPageData} is the same aggregation path
 * hubs use, so a consumer's fallback can never diverge from the governed data.
 */
@Service
public class CaseDataQueryService {

    private static final Logger log = LoggerFactory.getLogger(CaseDataQueryService.class);

    private final PageDataAggregator aggregator;
    private final BroadcastChannel channel;
    private final DistributionHubRegistry registry;
    private final Clock clock;

    public CaseDataQueryService(PageDataAggregator aggregator,
                                BroadcastChannel channel,
                                DistributionHubRegistry registry,
                                Clock clock) {
        this.aggregator = aggregator;
        this.channel = channel;
        this.registry = registry;
        this.clock = clock;
    }

    public PageData getPageData(String caseId) {
        return aggregator.buildPageData(caseId, AggregationOptions.full());
    }

    public CompletableFuture<PageData> getPageDataAsync(String caseId) {
        return aggregator.buildPageDataAsync(caseId, AggregationOptions.full());
    }

    /** Direct rebuild that re-reads the section's records first; used after a local write. */
    public CompletableFuture<PageData> reloadPageData(String caseId, Section section) {
        return aggregator.refresh(caseId, section);
    }

    /**
     * Fire-and-forget refresh signal. Governing hubs answer it on the channel; when no
     * hub governs the case the cached records are dropped so the next read is fresh.
     */
    public void requestRefresh(String caseId, Section section) {
        if (caseId == null || caseId.isBlank()) {
            throw new IllegalArgumentException("caseId is required");
        }
        channel.publish(ChannelMessage.refreshRequest(caseId, section == null ? null : section.getValue(),
            clock.instant()));
        if (!registry.governs(caseId)) {
            log.debug("No governor for case={}, invalidating section={}", caseId, section);
            aggregator.invalidate(caseId, section);
        }
    }
}
