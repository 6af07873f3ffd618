package com.casegovernor.aggregation;

import com.casegovernor.contract.CaseSnapshot;
import com.casegovernor.contract.EntityRecord;
import com.casegovernor.contract.EntityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

import static com.casegovernor.aggregation.CaseFields.*;

/**
 * Maps a backing CASE record onto a {@link CaseSnapshot}. A value of the wrong shape
 * becomes {@code null} so the rule evaluator can report it as missing.
 */
@Component
public class CaseSnapshotMapper {

    private static final Logger log = LoggerFactory.getLogger(CaseSnapshotMapper.class);

    public CaseSnapshot toSnapshot(EntityRecord record) {
        if (record.type() != EntityType.CASE) {
            throw new IllegalArgumentException("expected a CASE record but got " + record.type());
        }
        return new CaseSnapshot(
            record.id(),
            text(record, CASE_NUMBER),
            text(record, STATUS),
            text(record, RECORD_TYPE),
            text(record, SERVICE_TYPE),
            text(record, SUB_TYPE),
            text(record, REASON),
            text(record, PRIORITY),
            text(record, CLIENT_ACCOUNT_ID),
            text(record, LOCATION_ACCOUNT_ID),
            text(record, VENDOR_ACCOUNT_ID),
            text(record, CONTACT_ID),
            text(record, ASSET_ID),
            text(record, WORK_ORDER_ID),
            ids(record, QUOTE_IDS),
            ids(record, OPEN_TASK_IDS),
            ids(record, RELATED_CASE_IDS),
            instant(record, CREATED_AT),
            date(record, SERVICE_DATE),
            date(record, SLA_DUE_DATE),
            text(record, PURCHASE_ORDER_NUMBER),
            text(record, PROFILE_NUMBER),
            text(record, PROJECT_SITE_INFORMATION),
            text(record, COMPANY_CATEGORY),
            decimal(record, VALUE),
            flag(record, RISK_FLAG),
            text(record, APPROVAL_STATUS),
            text(record, SUBJECT),
            text(record, DESCRIPTION)
        );
    }

    private String text(EntityRecord record, String field) {
        String value = record.stringField(field);
        return value == null || value.isBlank() ? null : value;
    }

    private List<String> ids(EntityRecord record, String field) {
        Object value = record.field(field);
        Collection<?> raw;
        if (value == null) {
            return List.of();
        } else if (value instanceof Collection<?> collection) {
            raw = collection;
        } else if (value instanceof String text) {
            raw = Arrays.asList(text.split(","));
        } else {
            malformed(record, field, value);
            return List.of();
        }
        List<String> ids = new ArrayList<>();
        for (Object item : raw) {
            if (item != null && !String.valueOf(item).isBlank()) {
                ids.add(String.valueOf(item).trim());
            }
        }
        return ids;
    }

    private Instant instant(EntityRecord record, String field) {
        Object value = record.field(field);
        if (value == null || value instanceof Instant) {
            return (Instant) value;
        }
        try {
            return Instant.parse(String.valueOf(value));
        } catch (DateTimeParseException ex) {
            malformed(record, field, value);
            return null;
        }
    }

    private LocalDate date(EntityRecord record, String field) {
        Object value = record.field(field);
        if (value == null || value instanceof LocalDate) {
            return (LocalDate) value;
        }
        try {
            return LocalDate.parse(String.valueOf(value));
        } catch (DateTimeParseException ex) {
            malformed(record, field, value);
            return null;
        }
    }

    private BigDecimal decimal(EntityRecord record, String field) {
        Object value = record.field(field);
        if (value == null || value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        try {
            return new BigDecimal(String.valueOf(value).trim());
        } catch (NumberFormatException ex) {
            malformed(record, field, value);
            return null;
        }
    }

    private Boolean flag(EntityRecord record, String field) {
        Object value = record.field(field);
        if (value == null || value instanceof Boolean) {
            return (Boolean) value;
        }
        String text = String.valueOf(value).trim();
        if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
            return Boolean.valueOf(text);
        }
        malformed(record, field, value);
        return null;
    }

    private void malformed(EntityRecord record, String field, Object value) {
        log.warn("Malformed case field case={} field={} type={}",
            record.id(), field, value.getClass().getSimpleName());
    }
}
