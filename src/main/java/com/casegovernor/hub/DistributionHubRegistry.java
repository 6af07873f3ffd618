package com.casegovernor.hub;

import com.casegovernor.aggregation.PageDataAggregator;
import com.casegovernor.contract.PageDataContractValidator;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * At most one {@link DistributionHub} per page context. Mounting a page that already
 * governs the same case returns the existing hub; mounting it for another case tears
 * the old hub down first.
 */
@Service
public class DistributionHubRegistry {

    private static final Logger log = LoggerFactory.getLogger(DistributionHubRegistry.class);

    private final PageDataAggregator aggregator;
    private final BroadcastChannel channel;
    private final PageDataCodec codec;
    private final PageDataContractValidator validator;
    private final Clock clock;
    private final ConcurrentHashMap<String, DistributionHub> hubs = new ConcurrentHashMap<>();

    public DistributionHubRegistry(PageDataAggregator aggregator,
                                   BroadcastChannel channel,
                                   PageDataCodec codec,
                                   PageDataContractValidator validator,
                                   Clock clock) {
        this.aggregator = aggregator;
        this.channel = channel;
        this.codec = codec;
        this.validator = validator;
        this.clock = clock;
    }

    public DistributionHub mount(String pageId, String caseId) {
        if (pageId == null || pageId.isBlank()) {
            throw new IllegalArgumentException("pageId is required");
        }
        if (caseId == null || caseId.isBlank()) {
            throw new IllegalArgumentException("caseId is required");
        }
        DistributionHub[] created = new DistributionHub[1];
        DistributionHub hub = hubs.compute(pageId, (id, existing) -> {
            if (existing != null && existing.state() != HubState.TORN_DOWN && caseId.equals(existing.caseId())) {
                return existing;
            }
            if (existing != null) {
                existing.onTeardown();
            }
            created[0] = new DistributionHub(id, aggregator, channel, codec, validator, clock);
            return created[0];
        });
        if (created[0] != null) {
            hub.onMount(caseId);
        } else {
            log.debug("Page {} already governed for case={}", pageId, caseId);
        }
        return hub;
    }

    /** Returns true when a hub was torn down. */
    public boolean teardown(String pageId) {
        DistributionHub hub = hubs.remove(pageId);
        if (hub == null) {
            return false;
        }
        hub.onTeardown();
        return true;
    }

    public Optional<DistributionHub> find(String pageId) {
        return Optional.ofNullable(hubs.get(pageId));
    }

    public boolean governs(String caseId) {
        return hubs.values().stream()
            .anyMatch(hub -> hub.state() != HubState.TORN_DOWN && caseId.equals(hub.caseId()));
    }

    @PreDestroy
    public void teardownAll() {
        hubs.keySet().forEach(this::teardown);
    }
}
