package com.casegovernor.hub;

import com.casegovernor.contract.ChannelMessage;
import com.casegovernor.contract.EntityType;
import com.casegovernor.contract.PageData;
import com.casegovernor.contract.Section;
import com.casegovernor.support.Eventually;
import com.casegovernor.support.GovernorFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.casegovernor.support.CaseRecords.record;
import static org.junit.jupiter.api.Assertions.*;

class CaseDataQueryServiceTest {

    private final GovernorFixture fixture = new GovernorFixture();
    private final CaseDataQueryService queryService = fixture.queryService;

    @AfterEach
    void tearDown() throws InterruptedException {
        fixture.close();
    }

    @Test
    void getPageData_returnsTheFullAggregation() {
        fixture.seedCase("500A");

        PageData pageData = queryService.getPageData("500A");

        assertTrue(pageData.ruleResult().evaluated());
        assertFalse(pageData.relatedRecordSet().accounts().isEmpty());
    }

    @Test
    void requestRefresh_withoutGovernor_invalidatesSoNextReadIsFresh() {
        fixture.seedCase("500A");
        queryService.getPageData("500A");
        fixture.recordSource.seed(record(EntityType.CONTACT, "003-500A", "name", "Renamed Contact"));

        queryService.requestRefresh("500A", Section.CONTACT);
        PageData next = queryService.getPageData("500A");

        assertEquals("Renamed Contact", next.relatedRecordSet().contact("003-500A").orElseThrow().field("name"));
    }

    @Test
    void requestRefresh_publishesPayloadlessRequest() {
        List<ChannelMessage> received = new CopyOnWriteArrayList<>();
        fixture.channel.subscribe(received::add);
        fixture.seedCase("500A");

        queryService.requestRefresh("500A", Section.QUOTES);

        ChannelMessage request = received.get(0);
        assertTrue(request.refreshRequested());
        assertEquals("quotes", request.section());
    }

    @Test
    void requestRefresh_withGovernor_leavesRebuildToTheHub() {
        fixture.seedCase("500A");
        DistributionHub hub = fixture.registry.mount("page-1", "500A");
        Eventually.await("initial load", () -> hub.state() == HubState.PUBLISHED);
        long before = fixture.channel.latestSequence("500A");

        queryService.requestRefresh("500A", null);

        Eventually.await("hub republishes", () -> fixture.channel.latest("500A")
            .map(m -> m.sequenceNumber() > before)
            .orElse(false));
    }

    @Test
    void reloadPageData_rebuildsWithFreshSection() {
        fixture.seedCase("500A");
        queryService.getPageData("500A");
        fixture.recordSource.seed(record(EntityType.QUOTE, "0Q0-500A", "status", "Accepted"));

        PageData reloaded = queryService.reloadPageData("500A", Section.QUOTES).join();

        assertEquals("Accepted", reloaded.relatedRecordSet().quotes().get("0Q0-500A").field("status"));
    }

    @Test
    void blankCaseId_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> queryService.requestRefresh("", null));
    }
}
