package com.casegovernor.api;

import com.casegovernor.hub.DistributionHub;
import com.casegovernor.hub.DistributionHubRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Page-level governor lifecycle.
 *
 * PUT mounts the page's hub for a case; DELETE tears it down and may be repeated.
 */
@RestController
@RequestMapping("/v1/pages/{pageId}/governor")
public class GovernorController {

    private final DistributionHubRegistry registry;

    public GovernorController(DistributionHubRegistry registry) {
        this.registry = registry;
    }

    @PutMapping
    public Map<String, Object> mount(@PathVariable String pageId, @RequestParam String caseId) {
        return describe(registry.mount(pageId, caseId));
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> status(@PathVariable String pageId) {
        return registry.find(pageId)
            .map(hub -> ResponseEntity.ok(describe(hub)))
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping
    public Map<String, Object> teardown(@PathVariable String pageId) {
        boolean removed = registry.teardown(pageId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("page_id", pageId);
        body.put("torn_down", removed);
        return body;
    }

    private Map<String, Object> describe(DistributionHub hub) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("page_id", hub.pageId());
        body.put("case_id", hub.caseId());
        body.put("state", hub.state().name());
        return body;
    }
}
