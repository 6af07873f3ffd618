package com.casegovernor.api;

import com.casegovernor.contract.ChannelMessage;
import com.casegovernor.contract.PageData;
import com.casegovernor.contract.Section;
import com.casegovernor.hub.BroadcastChannel;
import com.casegovernor.hub.CaseDataQueryService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/v1/cases/{caseId}")
public class PageDataController {

    private final CaseDataQueryService queryService;
    private final BroadcastChannel channel;

    public PageDataController(CaseDataQueryService queryService, BroadcastChannel channel) {
        this.queryService = queryService;
        this.channel = channel;
    }

    @GetMapping("/page-data")
    public PageData pageData(@PathVariable String caseId) {
        return queryService.getPageData(caseId);
    }

    @PostMapping("/refresh")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, Object> refresh(@PathVariable String caseId,
                                       @RequestParam(required = false) String section) {
        Section parsed = section == null || section.isBlank() ? null : Section.fromValue(section);
        queryService.requestRefresh(caseId, parsed);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "accepted");
        body.put("case_id", caseId);
        body.put("section", parsed == null ? "all" : parsed.getValue());
        return body;
    }

    /** Channel messages for one case as Server-Sent Events, latest page data first. */
    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable String caseId) {
        SseEmitter emitter = new SseEmitter(0L);
        channel.latest(caseId).ifPresent(message -> send(emitter, message));
        String subscriptionId = channel.subscribe(message -> {
            if (caseId.equals(message.caseId())) {
                send(emitter, message);
            }
        });

        emitter.onCompletion(() -> channel.unsubscribe(subscriptionId));
        emitter.onTimeout(() -> channel.unsubscribe(subscriptionId));
        emitter.onError(ex -> channel.unsubscribe(subscriptionId));
        return emitter;
    }

    private void send(SseEmitter emitter, ChannelMessage message) {
        try {
            emitter.send(SseEmitter.event()
                .id(String.valueOf(message.sequenceNumber()))
                .name(message.eventType().getValue())
                .data(message));
        } catch (IOException ex) {
            emitter.completeWithError(ex);
        }
    }
}
