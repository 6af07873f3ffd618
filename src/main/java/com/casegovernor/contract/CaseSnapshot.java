package com.casegovernor.contract;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Immutable view of one case at a point in time.
 *
 * Produced only by the aggregator from the backing CASE record. Every component
 * is always present; a value the backing record does not carry is {@code null}
 * (scalars) or an empty list (id lists), never a partially built snapshot.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CaseSnapshot(
    String id,
    String caseNumber,
    String status,
    String recordType,
    String serviceType,
    String subType,
    String reason,
    String priority,
    String clientAccountId,
    String locationAccountId,
    String vendorAccountId,
    String contactId,
    String assetId,
    String workOrderId,
    List<String> quoteIds,
    List<String> openTaskIds,
    List<String> relatedCaseIds,
    Instant createdAt,
    LocalDate serviceDate,
    LocalDate slaDueDate,
    String purchaseOrderNumber,
    String profileNumber,
    String projectSiteInformation,
    String companyCategory,
    BigDecimal value,
    Boolean riskFlag,
    String approvalStatus,
    String subject,
    String description
) {

    public CaseSnapshot {
        Objects.requireNonNull(id, "id");
        quoteIds = quoteIds == null ? List.of() : List.copyOf(quoteIds);
        openTaskIds = openTaskIds == null ? List.of() : List.copyOf(openTaskIds);
        relatedCaseIds = relatedCaseIds == null ? List.of() : List.copyOf(relatedCaseIds);
    }
}
