package com.casegovernor.consumer;

import com.casegovernor.context.ContextStore;
import com.casegovernor.context.RecordSource;
import com.casegovernor.contract.PageDataContractValidator;
import com.casegovernor.hub.BroadcastChannel;
import com.casegovernor.hub.CaseDataQueryService;
import com.casegovernor.hub.PageDataCodec;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;

/** Creates consumer adapters wired to the shared channel, query path and wait timer. */
@Component
public class CaseDataConsumerFactory {

    private final BroadcastChannel channel;
    private final CaseDataQueryService queryService;
    private final PageDataCodec codec;
    private final PageDataContractValidator validator;
    private final RecordSource recordSource;
    private final ContextStore contextStore;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final ConsumerProperties properties;

    public CaseDataConsumerFactory(BroadcastChannel channel,
                                   CaseDataQueryService queryService,
                                   PageDataCodec codec,
                                   PageDataContractValidator validator,
                                   RecordSource recordSource,
                                   ContextStore contextStore,
                                   TaskScheduler scheduler,
                                   Clock clock,
                                   ConsumerProperties properties) {
        this.channel = channel;
        this.queryService = queryService;
        this.codec = codec;
        this.validator = validator;
        this.recordSource = recordSource;
        this.contextStore = contextStore;
        this.scheduler = scheduler;
        this.clock = clock;
        this.properties = properties;
    }

    /** Creates an unmounted consumer; call {@link CaseDataConsumer#mount()} to start it. */
    public CaseDataConsumer create(String name, String caseId, CaseDataListener listener) {
        if (caseId == null || caseId.isBlank()) {
            throw new IllegalArgumentException("caseId is required");
        }
        return new CaseDataConsumer(name, caseId, listener, channel, queryService, codec, validator,
            recordSource, contextStore, scheduler, clock, properties.governorWait());
    }
}
