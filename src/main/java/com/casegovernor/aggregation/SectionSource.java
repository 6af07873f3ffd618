package com.casegovernor.aggregation;

import com.casegovernor.contract.CaseSnapshot;
import com.casegovernor.contract.EntityType;
import com.casegovernor.contract.Section;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** The records a related-data section is read from. */
record SectionSource(Section section, EntityType type, List<String> ids) {

    /** Sections loaded into the RelatedRecordSet, in a fixed order. */
    static Map<Section, SectionSource> relatedSources(CaseSnapshot snapshot) {
        Map<Section, SectionSource> sources = new LinkedHashMap<>();
        sources.put(Section.ACCOUNTS, new SectionSource(Section.ACCOUNTS, EntityType.ACCOUNT,
            present(snapshot.clientAccountId(), snapshot.locationAccountId(), snapshot.vendorAccountId())));
        sources.put(Section.CONTACT, new SectionSource(Section.CONTACT, EntityType.CONTACT,
            present(snapshot.contactId())));
        sources.put(Section.ASSET, new SectionSource(Section.ASSET, EntityType.ASSET,
            present(snapshot.assetId())));
        sources.put(Section.TASKS, new SectionSource(Section.TASKS, EntityType.TASK, snapshot.openTaskIds()));
        sources.put(Section.RELATED_CASES, new SectionSource(Section.RELATED_CASES, EntityType.CASE,
            snapshot.relatedCaseIds()));
        sources.put(Section.QUOTES, new SectionSource(Section.QUOTES, EntityType.QUOTE, snapshot.quoteIds()));
        sources.put(Section.WORK_ORDERS, new SectionSource(Section.WORK_ORDERS, EntityType.WORK_ORDER,
            present(snapshot.workOrderId())));
        return sources;
    }

    private static List<String> present(String... ids) {
        List<String> result = new ArrayList<>();
        for (String id : ids) {
            if (id != null && !id.isBlank() && !result.contains(id)) {
                result.add(id);
            }
        }
        return result;
    }
}
