package com.casegovernor.rules;

import com.casegovernor.contract.ApprovalStatus;
import com.casegovernor.contract.CaseSnapshot;
import com.casegovernor.contract.RelatedRecordSet;
import com.casegovernor.contract.RuleResult;
import com.casegovernor.contract.RuleResult.ApprovalOutcome;
import com.casegovernor.contract.RuleResult.RuleMessage;
import com.casegovernor.contract.RuleResult.SlaAssessment;
import com.casegovernor.contract.SlaStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Generic interpreter over the compiled {@link RuleSet}.
 *
 * Evaluation has no side effects beyond logging. The only time input is the
 * explicit {@code now} of the SLA assessment; the overloads without it read the
 * injected clock. A rule whose condition cannot be resolved against the case is
 * skipped as non-matching and logged.
 */
@Service
public class RuleEvaluator {

    private static final Logger log = LoggerFactory.getLogger(RuleEvaluator.class);

    private final RuleSet ruleSet;
    private final SlaPolicy slaPolicy;
    private final Clock clock;

    public RuleEvaluator(RuleSet ruleSet, SlaPolicy slaPolicy, Clock clock) {
        this.ruleSet = ruleSet;
        this.slaPolicy = slaPolicy;
        this.clock = clock;
    }

    public RuleResult evaluateAll(CaseSnapshot snapshot, RelatedRecordSet related) {
        return evaluateAll(snapshot, related, clock.instant());
    }

    public RuleResult evaluateAll(CaseSnapshot snapshot, RelatedRecordSet related, Instant now) {
        CaseFacts facts = CaseFacts.of(snapshot, related);
        List<RuleMessage> messages = new ArrayList<>();

        Map<String, Boolean> required = requiredFields(facts, messages);
        Set<String> actions = visibleActions(facts);
        SlaAssessment sla = evaluateSla(snapshot, now);
        ApprovalOutcome approval = approval(facts, messages);
        caseMessages(facts, messages);

        return new RuleResult(true, required, actions, sla, approval, messages);
    }

    /**
     * Every field named by an active requirement rule, mapped to whether at least one
     * matching rule requires it.
     */
    public Map<String, Boolean> evaluateFieldRequirements(CaseSnapshot snapshot) {
        return evaluateFieldRequirements(snapshot, RelatedRecordSet.empty());
    }

    public Map<String, Boolean> evaluateFieldRequirements(CaseSnapshot snapshot, RelatedRecordSet related) {
        return requiredFields(CaseFacts.of(snapshot, related), new ArrayList<>());
    }

    /** Visibility rules applied top to bottom; the last matching rule for an action id wins. */
    public Set<String> evaluateVisibleActions(CaseSnapshot snapshot) {
        return evaluateVisibleActions(snapshot, RelatedRecordSet.empty());
    }

    public Set<String> evaluateVisibleActions(CaseSnapshot snapshot, RelatedRecordSet related) {
        return visibleActions(CaseFacts.of(snapshot, related));
    }

    public ApprovalOutcome evaluateApproval(CaseSnapshot snapshot) {
        return evaluateApproval(snapshot, RelatedRecordSet.empty());
    }

    public ApprovalOutcome evaluateApproval(CaseSnapshot snapshot, RelatedRecordSet related) {
        return approval(CaseFacts.of(snapshot, related), new ArrayList<>());
    }

    public SlaAssessment evaluateSla(CaseSnapshot snapshot) {
        return evaluateSla(snapshot, clock.instant());
    }

    /**
     * Due date is the service type's business-day offset from the creation date, read
     * in the configured zone; without an offset the case's own SLA due date is used.
     * The due moment is the due date at the daily cutoff.
     */
    public SlaAssessment evaluateSla(CaseSnapshot snapshot, Instant now) {
        LocalDate dueDate = dueDate(snapshot);
        if (dueDate == null) {
            return SlaAssessment.unscheduled();
        }
        if (slaPolicy.isClosed(snapshot.status())) {
            return new SlaAssessment(dueDate, SlaStatus.ON_TRACK);
        }
        Instant dueMoment = dueDate.atTime(slaPolicy.cutoff()).atZone(slaPolicy.zone()).toInstant();
        if (!now.isBefore(dueMoment)) {
            return new SlaAssessment(dueDate, SlaStatus.BREACHED);
        }
        if (!now.isBefore(dueMoment.minus(slaPolicy.atRiskLeadTime()))) {
            return new SlaAssessment(dueDate, SlaStatus.AT_RISK);
        }
        return new SlaAssessment(dueDate, SlaStatus.ON_TRACK);
    }

    private LocalDate dueDate(CaseSnapshot snapshot) {
        Integer offset = slaPolicy.offsetFor(snapshot.serviceType());
        if (offset == null || snapshot.createdAt() == null) {
            return snapshot.slaDueDate();
        }
        LocalDate created = snapshot.createdAt().atZone(slaPolicy.zone()).toLocalDate();
        return slaPolicy.calendar().addBusinessDays(created, offset);
    }

    private Map<String, Boolean> requiredFields(CaseFacts facts, List<RuleMessage> messages) {
        Map<String, Boolean> required = new LinkedHashMap<>();
        for (CompiledRule rule : ruleSet.rules(RuleCategory.FIELD_REQUIREMENT)) {
            boolean matched = matches(rule, facts);
            for (String field : rule.definition().requiredFields()) {
                required.merge(field, matched, Boolean::logicalOr);
            }
            if (matched) {
                List<String> missing = rule.definition().requiredFields().stream()
                    .filter(field -> Operands.isBlank(facts.value(field)))
                    .toList();
                if (!missing.isEmpty()) {
                    messages.add(message(rule, missing));
                }
            }
        }
        return required;
    }

    private Set<String> visibleActions(CaseFacts facts) {
        Set<String> visible = new LinkedHashSet<>();
        for (CompiledRule rule : ruleSet.rules(RuleCategory.ACTION_VISIBILITY)) {
            if (!matches(rule, facts)) {
                continue;
            }
            switch (rule.definition().effect()) {
                case SHOW -> visible.add(rule.definition().actionId());
                case HIDE -> visible.remove(rule.definition().actionId());
            }
        }
        return visible;
    }

    private ApprovalOutcome approval(CaseFacts facts, List<RuleMessage> messages) {
        for (CompiledRule rule : ruleSet.rules(RuleCategory.APPROVAL_TRIGGER)) {
            if (matches(rule, facts)) {
                if (rule.definition().message() != null) {
                    messages.add(message(rule, List.of()));
                }
                return new ApprovalOutcome(true, approvalStatus(facts.snapshot()), rule.id());
            }
        }
        return ApprovalOutcome.none();
    }

    private ApprovalStatus approvalStatus(CaseSnapshot snapshot) {
        String recorded = snapshot.approvalStatus();
        if (recorded == null) {
            return ApprovalStatus.PENDING;
        }
        return switch (recorded.trim().toLowerCase()) {
            case "approved" -> ApprovalStatus.APPROVED;
            case "rejected" -> ApprovalStatus.REJECTED;
            default -> ApprovalStatus.PENDING;
        };
    }

    private void caseMessages(CaseFacts facts, List<RuleMessage> messages) {
        for (CompiledRule rule : ruleSet.rules(RuleCategory.CASE_MESSAGE)) {
            if (matches(rule, facts)) {
                messages.add(message(rule, List.of()));
            }
        }
    }

    private boolean matches(CompiledRule rule, CaseFacts facts) {
        try {
            return rule.condition().test(facts);
        } catch (UnresolvableFieldException ex) {
            log.warn("Rule evaluation skipped rule={} case={} reason={}",
                rule.id(), facts.snapshot().id(), ex.getMessage());
            return false;
        }
    }

    private RuleMessage message(CompiledRule rule, List<String> fields) {
        return new RuleMessage(rule.id(), rule.definition().severity(), rule.definition().message(), fields);
    }
}
