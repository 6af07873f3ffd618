package com.casegovernor.rules;

import com.casegovernor.contract.CaseSnapshot;
import com.casegovernor.contract.EntityRecord;
import com.casegovernor.contract.RelatedRecordSet;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * The names a rule condition may reference, resolved against one case.
 *
 * Snapshot fields come straight from the {@link CaseSnapshot}; a few carry the
 * short names rule authors use ({@code asset}, {@code customerPO}, {@code psi}).
 * Derived facts summarize the related records.
 */
public final class CaseFacts {

    /** Client account flags that make customer reference fields mandatory. */
    public static final String ACCOUNT_PO_REQUIRED = "po_required";
    public static final String ACCOUNT_PROFILE_NUMBER_REQUIRED = "profile_number_required";
    public static final String ACCOUNT_PSI_REQUIRED = "psi_required";

    private static final Map<String, Function<CaseSnapshot, Object>> SNAPSHOT_FIELDS = snapshotFields();

    private static final Map<String, Function<CaseFacts, Object>> DERIVED_FIELDS = derivedFields();

    private final CaseSnapshot snapshot;
    private final RelatedRecordSet related;

    private CaseFacts(CaseSnapshot snapshot, RelatedRecordSet related) {
        this.snapshot = snapshot;
        this.related = related == null ? RelatedRecordSet.empty() : related;
    }

    public static CaseFacts of(CaseSnapshot snapshot, RelatedRecordSet related) {
        return new CaseFacts(snapshot, related);
    }

    public static Set<String> snapshotFieldNames() {
        return SNAPSHOT_FIELDS.keySet();
    }

    public static Set<String> vocabulary() {
        Set<String> names = new LinkedHashSet<>(SNAPSHOT_FIELDS.keySet());
        names.addAll(DERIVED_FIELDS.keySet());
        return Collections.unmodifiableSet(names);
    }

    public static boolean isSnapshotField(String name) {
        return SNAPSHOT_FIELDS.containsKey(name);
    }

    public Object value(String name) {
        Function<CaseSnapshot, Object> snapshotField = SNAPSHOT_FIELDS.get(name);
        if (snapshotField != null) {
            return snapshotField.apply(snapshot);
        }
        Function<CaseFacts, Object> derived = DERIVED_FIELDS.get(name);
        if (derived != null) {
            return derived.apply(this);
        }
        throw new UnresolvableFieldException(name, "is not a known field");
    }

    public CaseSnapshot snapshot() {
        return snapshot;
    }

    private Object clientAccountFlag(String flag) {
        Optional<EntityRecord> account = related.account(snapshot.clientAccountId());
        if (account.isEmpty()) {
            return snapshot.clientAccountId() == null ? Boolean.FALSE : null;
        }
        Object value = account.get().field(flag);
        return value == null ? Boolean.FALSE : value;
    }

    private static Map<String, Function<CaseSnapshot, Object>> snapshotFields() {
        Map<String, Function<CaseSnapshot, Object>> fields = new HashMap<>();
        fields.put("id", CaseSnapshot::id);
        fields.put("caseNumber", CaseSnapshot::caseNumber);
        fields.put("status", CaseSnapshot::status);
        fields.put("recordType", CaseSnapshot::recordType);
        fields.put("serviceType", CaseSnapshot::serviceType);
        fields.put("subType", CaseSnapshot::subType);
        fields.put("reason", CaseSnapshot::reason);
        fields.put("priority", CaseSnapshot::priority);
        fields.put("clientAccount", CaseSnapshot::clientAccountId);
        fields.put("locationAccount", CaseSnapshot::locationAccountId);
        fields.put("vendorAccount", CaseSnapshot::vendorAccountId);
        fields.put("contact", CaseSnapshot::contactId);
        fields.put("asset", CaseSnapshot::assetId);
        fields.put("workOrder", CaseSnapshot::workOrderId);
        fields.put("createdAt", CaseSnapshot::createdAt);
        fields.put("serviceDate", CaseSnapshot::serviceDate);
        fields.put("slaDueDate", CaseSnapshot::slaDueDate);
        fields.put("customerPO", CaseSnapshot::purchaseOrderNumber);
        fields.put("profileNumber", CaseSnapshot::profileNumber);
        fields.put("psi", CaseSnapshot::projectSiteInformation);
        fields.put("companyCategory", CaseSnapshot::companyCategory);
        fields.put("value", CaseSnapshot::value);
        fields.put("riskFlag", CaseSnapshot::riskFlag);
        fields.put("approvalStatus", CaseSnapshot::approvalStatus);
        fields.put("subject", CaseSnapshot::subject);
        fields.put("description", CaseSnapshot::description);
        return Collections.unmodifiableMap(fields);
    }

    private static Map<String, Function<CaseFacts, Object>> derivedFields() {
        Map<String, Function<CaseFacts, Object>> fields = new HashMap<>();
        fields.put("openTaskCount", facts -> facts.snapshot.openTaskIds().size());
        fields.put("relatedCaseCount", facts -> facts.snapshot.relatedCaseIds().size());
        fields.put("quoteCount", facts -> facts.snapshot.quoteIds().size());
        fields.put("hasWorkOrder", facts -> !Operands.isBlank(facts.snapshot.workOrderId()));
        fields.put("clientPoRequired", facts -> facts.clientAccountFlag(ACCOUNT_PO_REQUIRED));
        fields.put("clientProfileNumberRequired", facts -> facts.clientAccountFlag(ACCOUNT_PROFILE_NUMBER_REQUIRED));
        fields.put("clientPsiRequired", facts -> facts.clientAccountFlag(ACCOUNT_PSI_REQUIRED));
        return Collections.unmodifiableMap(fields);
    }
}
