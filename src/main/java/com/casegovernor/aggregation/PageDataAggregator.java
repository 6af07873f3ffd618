package com.casegovernor.aggregation;

import com.casegovernor.config.GovernorConfiguration;
import com.casegovernor.context.ContextStore;
import com.casegovernor.context.RecordBatch;
import com.casegovernor.contract.AggregationOptions;
import com.casegovernor.contract.CaseSnapshot;
import com.casegovernor.contract.EntityRecord;
import com.casegovernor.contract.EntityType;
import com.casegovernor.contract.PageData;
import com.casegovernor.contract.RelatedRecordSet;
import com.casegovernor.contract.RuleResult;
import com.casegovernor.contract.Section;
import com.casegovernor.rules.RuleEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Composes one complete {@link PageData} per case id.
 *
 * Builds for the same case id never overlap: a request with the same options joins
 * the build already in flight, any other request (including every refresh) is
 * chained after it. Combined with {@link GenerationClock} this keeps the
 * {@code generatedAt} order of a case equal to its build order. Builds for
 * different cases run independently.
 */
@Service
public class PageDataAggregator {

    private static final Logger log = LoggerFactory.getLogger(PageDataAggregator.class);

    private final ContextStore contextStore;
    private final RuleEvaluator ruleEvaluator;
    private final CaseSnapshotMapper snapshotMapper;
    private final GenerationClock generationClock;
    private final Executor buildExecutor;
    private final Executor fetchExecutor;
    private final ConcurrentHashMap<String, Build> inFlight = new ConcurrentHashMap<>();

    public PageDataAggregator(ContextStore contextStore,
                              RuleEvaluator ruleEvaluator,
                              CaseSnapshotMapper snapshotMapper,
                              GenerationClock generationClock,
                              @Qualifier(GovernorConfiguration.BUILD_EXECUTOR) Executor buildExecutor,
                              @Qualifier(GovernorConfiguration.FETCH_EXECUTOR) Executor fetchExecutor) {
        this.contextStore = contextStore;
        this.ruleEvaluator = ruleEvaluator;
        this.snapshotMapper = snapshotMapper;
        this.generationClock = generationClock;
        this.buildExecutor = buildExecutor;
        this.fetchExecutor = fetchExecutor;
    }

    /**
     * Blocking variant of {@link #buildPageDataAsync}.
     *
     * @throws AggregationFailedException if the case record cannot be loaded
     */
    public PageData buildPageData(String caseId, AggregationOptions options) {
        try {
            return buildPageDataAsync(caseId, options).join();
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw ex;
        }
    }

    public CompletableFuture<PageData> buildPageDataAsync(String caseId, AggregationOptions options) {
        return submit(caseId, options, false);
    }

    /**
     * Drops the cached records behind {@code section} (all sections when null) and
     * schedules a complete rebuild that starts only after any build in flight.
     */
    public CompletableFuture<PageData> refresh(String caseId, Section section) {
        invalidate(caseId, section);
        return submit(caseId, AggregationOptions.full(), true);
    }

    private CompletableFuture<PageData> submit(String caseId, AggregationOptions options, boolean forceNew) {
        if (caseId == null || caseId.isBlank()) {
            throw new IllegalArgumentException("caseId is required");
        }
        Build build = inFlight.compute(caseId, (id, current) -> {
            if (current == null || current.future().isDone()) {
                return new Build(options, CompletableFuture.supplyAsync(() -> build(id, options), buildExecutor));
            }
            if (!forceNew && current.options().equals(options)) {
                log.debug("Joining in-flight build case={}", id);
                return current;
            }
            CompletableFuture<PageData> next = current.future()
                .handle((result, error) -> null)
                .thenApplyAsync(ignored -> build(id, options), buildExecutor);
            return new Build(options, next);
        });
        build.future().whenComplete((result, error) -> inFlight.remove(caseId, build));
        return build.future();
    }

    private PageData build(String caseId, AggregationOptions options) {
        EntityRecord caseRecord;
        try {
            caseRecord = contextStore.getById(EntityType.CASE, caseId);
        } catch (RuntimeException ex) {
            log.warn("Aggregation failed case={} cause={}", caseId, ex.getMessage());
            throw new AggregationFailedException(caseId, ex);
        }
        CaseSnapshot snapshot = snapshotMapper.toSnapshot(caseRecord);
        RelatedRecordSet related = options.includeRelated() ? loadRelated(snapshot) : RelatedRecordSet.empty();
        RuleResult ruleResult = options.evaluateRules()
            ? ruleEvaluator.evaluateAll(snapshot, related)
            : RuleResult.notEvaluated();

        PageData pageData = new PageData(
            PageData.SCHEMA_VERSION,
            caseId,
            snapshot,
            related,
            ruleResult,
            options,
            generationClock.next(caseId),
            UUID.randomUUID().toString()
        );
        log.info("Built page data case={} generated_at={} correlation_id={} unavailable={}",
            caseId, pageData.generatedAt(), pageData.correlationId(), related.unavailable());
        return pageData;
    }

    private RelatedRecordSet loadRelated(CaseSnapshot snapshot) {
        Map<Section, CompletableFuture<RecordBatch>> pending = new LinkedHashMap<>();
        SectionSource.relatedSources(snapshot).forEach((section, source) -> {
            if (source.ids().isEmpty()) {
                pending.put(section, CompletableFuture.completedFuture(RecordBatch.of(Map.of())));
            } else {
                pending.put(section, CompletableFuture.supplyAsync(
                    () -> contextStore.readMany(source.type(), source.ids()), fetchExecutor));
            }
        });

        Set<Section> unavailable = EnumSet.noneOf(Section.class);
        Map<Section, Map<String, EntityRecord>> loaded = new LinkedHashMap<>();
        pending.forEach((section, future) -> {
            try {
                RecordBatch batch = future.join();
                if (batch.isPartial()) {
                    log.warn("Related records denied case={} section={} denied={}",
                        snapshot.id(), section.getValue(), batch.denied());
                    unavailable.add(section);
                }
                loaded.put(section, batch.found());
            } catch (CompletionException ex) {
                Throwable cause = ex.getCause() == null ? ex : ex.getCause();
                log.warn("Related section unavailable case={} section={} cause={}",
                    snapshot.id(), section.getValue(), cause.getMessage());
                unavailable.add(section);
                loaded.put(section, Map.of());
            }
        });

        return new RelatedRecordSet(
            loaded.get(Section.ACCOUNTS),
            loaded.get(Section.CONTACT),
            loaded.get(Section.ASSET),
            loaded.get(Section.TASKS),
            loaded.get(Section.RELATED_CASES),
            loaded.get(Section.QUOTES),
            loaded.get(Section.WORK_ORDERS),
            unavailable
        );
    }

    /** Drops the cached case record and the records behind {@code section} (all when null). */
    public void invalidate(String caseId, Section section) {
        contextStore.invalidate(EntityType.CASE, caseId);
        if (section == Section.CASE || section == Section.BUSINESS_RULES) {
            return;
        }
        EntityRecord cached;
        try {
            cached = contextStore.getById(EntityType.CASE, caseId);
        } catch (RuntimeException ex) {
            log.debug("Case record unreadable during invalidation case={}, rebuild will report it", caseId);
            return;
        }
        SectionSource.relatedSources(snapshotMapper.toSnapshot(cached)).forEach((candidate, source) -> {
            if (section == null || section == candidate) {
                contextStore.invalidateAll(source.type(), source.ids());
            }
        });
    }

    private record Build(AggregationOptions options, CompletableFuture<PageData> future) {
    }
}
