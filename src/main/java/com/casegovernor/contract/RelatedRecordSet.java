package com.casegovernor.contract;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Related entities of one case, each collection keyed by entity id.
 *
 * Collections are never null. {@code unavailable} lists the sections with at
 * least one record that could not be loaded, so missing data caused by a failed
 * or denied fetch is distinguishable from data that is genuinely absent. Readable
 * records of such a section are still present.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RelatedRecordSet(
    Map<String, EntityRecord> accounts,
    Map<String, EntityRecord> contacts,
    Map<String, EntityRecord> assets,
    Map<String, EntityRecord> openTasks,
    Map<String, EntityRecord> relatedCases,
    Map<String, EntityRecord> quotes,
    Map<String, EntityRecord> workOrders,
    Set<Section> unavailable
) {

    public RelatedRecordSet {
        accounts = copy(accounts);
        contacts = copy(contacts);
        assets = copy(assets);
        openTasks = copy(openTasks);
        relatedCases = copy(relatedCases);
        quotes = copy(quotes);
        workOrders = copy(workOrders);
        unavailable = unavailable == null
            ? Collections.emptySortedSet()
            : Collections.unmodifiableSortedSet(new TreeSet<>(unavailable));
    }

    public static RelatedRecordSet empty() {
        return new RelatedRecordSet(null, null, null, null, null, null, null, null);
    }

    public Optional<EntityRecord> account(String accountId) {
        return accountId == null ? Optional.empty() : Optional.ofNullable(accounts.get(accountId));
    }

    public Optional<EntityRecord> contact(String contactId) {
        return contactId == null ? Optional.empty() : Optional.ofNullable(contacts.get(contactId));
    }

    public Optional<EntityRecord> asset(String assetId) {
        return assetId == null ? Optional.empty() : Optional.ofNullable(assets.get(assetId));
    }

    private static Map<String, EntityRecord> copy(Map<String, EntityRecord> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
