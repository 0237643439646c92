package com.tracegate.core.store;

import com.tracegate.core.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * {@link EntityGraphStore} held in concurrent maps.
 * <p>
 * Suitable for development, CLI demos and tests; nothing survives a restart. Uniqueness
 * constraints are enforced with {@link ConcurrentHashMap#putIfAbsent}, so concurrent duplicate
 * writes resolve to exactly one winner.
 */
public class InMemoryEntityGraphStore implements EntityGraphStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEntityGraphStore.class);

    private record Pair(String left, String right) {}

    private record DeclarationKey(String planId, ScopeSourceType sourceType, String sourceId) {}

    private final ConcurrentHashMap<String, ProcessNode> nodes = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ProcessStep> processSteps = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Requirement> requirements = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, DevelopmentItem> developmentItems = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, TestArtifact> artifacts = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Suite> suites = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Pair, CaseSuiteLink> suiteLinks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, TestPlan> plans = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, TestCycle> cycles = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ScopeDeclaration> declarations = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<DeclarationKey, String> declarationKeys = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Pair, PlanCaseEntry> planEntries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Pair, PlanDataSet> dataSets = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Long, Execution> executions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Defect> defects = new ConcurrentHashMap<>();
    private final AtomicLong executionSequence = new AtomicLong();

    // ── Process hierarchy ───────────────────────────────────────────────

    @Override
    public Optional<ProcessNode> findNode(String id) {
        return lookup(nodes, id);
    }

    @Override
    public List<ProcessNode> findChildren(String parentId, Integer level) {
        if (parentId == null) {
            return List.of();
        }
        return select(nodes.values(),
                n -> parentId.equals(n.parentId()) && (level == null || n.level() == level),
                Comparator.comparing(ProcessNode::id));
    }

    @Override
    public Optional<ProcessStep> findProcessStep(String id) {
        return lookup(processSteps, id);
    }

    @Override
    public void saveNode(ProcessNode node) {
        nodes.put(node.id(), node);
    }

    @Override
    public void saveProcessStep(ProcessStep step) {
        processSteps.put(step.id(), step);
    }

    // ── Requirements & development items ────────────────────────────────

    @Override
    public Optional<Requirement> findRequirement(String id) {
        return lookup(requirements, id);
    }

    @Override
    public List<Requirement> findRequirementsByAnchor(String anchorId) {
        return select(requirements.values(), r -> Objects.equals(anchorId, r.anchorId()),
                Comparator.comparing(Requirement::id));
    }

    @Override
    public Optional<DevelopmentItem> findDevelopmentItem(String id) {
        return lookup(developmentItems, id);
    }

    @Override
    public List<DevelopmentItem> findDevelopmentItemsByRequirement(String requirementId) {
        return select(developmentItems.values(), d -> Objects.equals(requirementId, d.requirementId()),
                Comparator.comparing(DevelopmentItem::id));
    }

    @Override
    public void saveRequirement(Requirement requirement) {
        requirements.put(requirement.id(), requirement);
    }

    @Override
    public void saveDevelopmentItem(DevelopmentItem item) {
        developmentItems.put(item.id(), item);
    }

    // ── Test artifacts & suites ─────────────────────────────────────────

    @Override
    public Optional<TestArtifact> findTestArtifact(String id) {
        return lookup(artifacts, id);
    }

    @Override
    public List<TestArtifact> findTestArtifactsBy(ArtifactLinkField field, String id) {
        if (id == null) {
            return List.of();
        }
        Predicate<TestArtifact> matches = switch (field) {
            case ANCHOR_ID -> a -> id.equals(a.anchorId());
            case DEVELOPMENT_ITEM_ID -> a -> id.equals(a.developmentItemId());
            case REQUIREMENT_ID -> a -> id.equals(a.requirementId());
        };
        return select(artifacts.values(), matches, Comparator.comparing(TestArtifact::id));
    }

    @Override
    public TestArtifact insertTestArtifact(TestArtifact artifact) {
        if (artifacts.putIfAbsent(artifact.id(), artifact) != null) {
            throw new UniqueViolationException("Test artifact already exists: " + artifact.id());
        }
        return artifact;
    }

    @Override
    public void saveTestArtifact(TestArtifact artifact) {
        artifacts.put(artifact.id(), artifact);
    }

    @Override
    public Optional<Suite> findSuite(String id) {
        return lookup(suites, id);
    }

    @Override
    public void saveSuite(Suite suite) {
        suites.put(suite.id(), suite);
    }

    @Override
    public CaseSuiteLink insertCaseSuiteLink(CaseSuiteLink link) {
        var key = new Pair(link.testArtifactId(), link.suiteId());
        if (suiteLinks.putIfAbsent(key, link) != null) {
            throw new UniqueViolationException("Case/suite pair already exists: "
                    + link.testArtifactId() + " / " + link.suiteId());
        }
        return link;
    }

    @Override
    public boolean deleteCaseSuiteLink(String testArtifactId, String suiteId) {
        return suiteLinks.remove(new Pair(testArtifactId, suiteId)) != null;
    }

    @Override
    public List<CaseSuiteLink> findLinksForSuite(String suiteId) {
        return select(suiteLinks.values(), l -> l.suiteId().equals(suiteId),
                Comparator.comparing(CaseSuiteLink::testArtifactId));
    }

    @Override
    public List<CaseSuiteLink> findLinksForCase(String testArtifactId) {
        return select(suiteLinks.values(), l -> l.testArtifactId().equals(testArtifactId),
                Comparator.comparing(CaseSuiteLink::suiteId));
    }

    // ── Plans ───────────────────────────────────────────────────────────

    @Override
    public Optional<TestPlan> findPlan(String id) {
        return lookup(plans, id);
    }

    @Override
    public void savePlan(TestPlan plan) {
        plans.put(plan.id(), plan);
    }

    @Override
    public Optional<TestCycle> findCycle(String id) {
        return lookup(cycles, id);
    }

    @Override
    public List<TestCycle> findCycles(String planId) {
        return select(cycles.values(), c -> c.planId().equals(planId),
                Comparator.comparingInt(TestCycle::sequence).thenComparing(TestCycle::id));
    }

    @Override
    public void saveCycle(TestCycle cycle) {
        cycles.put(cycle.id(), cycle);
    }

    @Override
    public List<ScopeDeclaration> findScopeDeclarations(String planId) {
        return select(declarations.values(), d -> d.planId().equals(planId),
                Comparator.comparing(ScopeDeclaration::id));
    }

    @Override
    public Optional<ScopeDeclaration> findScopeDeclaration(String id) {
        return lookup(declarations, id);
    }

    @Override
    public ScopeDeclaration insertScopeDeclaration(ScopeDeclaration declaration) {
        var key = new DeclarationKey(declaration.planId(), declaration.sourceType(), declaration.sourceId());
        if (declarationKeys.putIfAbsent(key, declaration.id()) != null) {
            throw new UniqueViolationException("Scope already declared for plan " + declaration.planId()
                    + ": " + declaration.sourceType().code() + " " + declaration.sourceId());
        }
        declarations.put(declaration.id(), declaration);
        return declaration;
    }

    @Override
    public ScopeDeclaration updateScopeDeclaration(ScopeDeclaration declaration) {
        ScopeDeclaration merged = declarations.computeIfPresent(declaration.id(), (id, existing) ->
                existing.withPlanning(declaration.priority(), declaration.riskLevel()));
        if (merged == null) {
            throw new StoreException("Scope declaration vanished during update: " + declaration.id(), null);
        }
        return merged;
    }

    @Override
    public void writeCoverageStatus(String declarationId, CoverageStatus status) {
        declarations.computeIfPresent(declarationId, (id, existing) -> existing.withCoverageStatus(status));
    }

    @Override
    public boolean deleteScopeDeclaration(String id) {
        ScopeDeclaration removed = declarations.remove(id);
        if (removed == null) {
            return false;
        }
        declarationKeys.remove(new DeclarationKey(removed.planId(), removed.sourceType(), removed.sourceId()));
        return true;
    }

    @Override
    public List<PlanCaseEntry> findPlanCaseEntries(String planId) {
        return select(planEntries.values(), e -> e.planId().equals(planId),
                Comparator.comparing(PlanCaseEntry::testArtifactId));
    }

    @Override
    public PlanCaseEntry insertPlanCaseEntry(PlanCaseEntry entry) {
        if (planEntries.putIfAbsent(new Pair(entry.planId(), entry.testArtifactId()), entry) != null) {
            throw new UniqueViolationException("Test artifact " + entry.testArtifactId()
                    + " is already in plan " + entry.planId());
        }
        return entry;
    }

    @Override
    public boolean deletePlanCaseEntry(String planId, String testArtifactId) {
        return planEntries.remove(new Pair(planId, testArtifactId)) != null;
    }

    @Override
    public List<PlanDataSet> findPlanDataSets(String planId) {
        return select(dataSets.values(), d -> d.planId().equals(planId),
                Comparator.comparing(PlanDataSet::dataSetId));
    }

    @Override
    public void savePlanDataSet(PlanDataSet dataSet) {
        dataSets.put(new Pair(dataSet.planId(), dataSet.dataSetId()), dataSet);
    }

    // ── Executions & defects ────────────────────────────────────────────

    @Override
    public List<Execution> findExecutions(String testArtifactId) {
        return select(executions.values(), e -> e.testArtifactId().equals(testArtifactId), Execution.CHRONOLOGICAL);
    }

    @Override
    public List<Execution> findExecutionsForCycle(String cycleId) {
        return select(executions.values(), e -> e.cycleId().equals(cycleId), Comparator.comparing(Execution::id));
    }

    @Override
    public Execution insertExecution(Execution execution) {
        long id;
        if (execution.id() != null) {
            id = execution.id();
            executionSequence.accumulateAndGet(id, Math::max);
        } else {
            id = executionSequence.incrementAndGet();
        }
        Execution stored = execution.withId(id);
        executions.put(id, stored);
        log.debug("Recorded execution {} for artifact {} in cycle {}", id, execution.testArtifactId(), execution.cycleId());
        return stored;
    }

    @Override
    public Execution updateExecution(Execution execution) {
        Execution updated = execution.id() == null ? null
                : executions.computeIfPresent(execution.id(), (id, existing) -> execution);
        if (updated == null) {
            throw new StoreException("No execution with id " + execution.id(), null);
        }
        return updated;
    }

    @Override
    public List<Defect> findOpenDefects(String projectId, DefectSeverity severity) {
        return select(defects.values(),
                d -> Objects.equals(projectId, d.projectId()) && d.severity() == severity
                        && d.status() != null && d.status().isOpen(),
                Comparator.comparing(Defect::id));
    }

    @Override
    public void saveDefect(Defect defect) {
        defects.put(defect.id(), defect);
    }

    private static <T> Optional<T> lookup(Map<String, T> map, String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(map.get(id));
    }

    private static <T> List<T> select(Collection<T> values, Predicate<T> filter, Comparator<T> order) {
        return values.stream().filter(filter).sorted(order).toList();
    }
}
