package com.tracegate.core.store;

import com.tracegate.core.model.*;

import java.util.List;
import java.util.Optional;

/**
 * Read/write access to the entity graph the engine works over.
 * <p>
 * The engine never owns storage: everything it knows about process nodes, requirements,
 * development items, test artifacts, plans and executions comes through this interface.
 * Implementations must enforce the uniqueness of (testArtifactId, suiteId),
 * (planId, testArtifactId) and (planId, sourceType, sourceId) atomically and report
 * violations as {@link UniqueViolationException}.
 */
public interface EntityGraphStore {

    // ── Process hierarchy ───────────────────────────────────────────────

    Optional<ProcessNode> findNode(String id);

    /**
     * Children of a node, optionally restricted to one level.
     *
     * @param level level filter; null returns children of any level
     */
    List<ProcessNode> findChildren(String parentId, Integer level);

    Optional<ProcessStep> findProcessStep(String id);

    void saveNode(ProcessNode node);

    void saveProcessStep(ProcessStep step);

    // ── Requirements & development items ────────────────────────────────

    Optional<Requirement> findRequirement(String id);

    /** Requirements whose direct anchor is the given node. */
    List<Requirement> findRequirementsByAnchor(String anchorId);

    Optional<DevelopmentItem> findDevelopmentItem(String id);

    /** Development items back-linked to the given requirement. */
    List<DevelopmentItem> findDevelopmentItemsByRequirement(String requirementId);

    void saveRequirement(Requirement requirement);

    void saveDevelopmentItem(DevelopmentItem item);

    // ── Test artifacts & suites ─────────────────────────────────────────

    Optional<TestArtifact> findTestArtifact(String id);

    List<TestArtifact> findTestArtifactsBy(ArtifactLinkField field, String id);

    /**
     * @throws UniqueViolationException if an artifact with the same id exists, archived or not
     */
    TestArtifact insertTestArtifact(TestArtifact artifact);

    void saveTestArtifact(TestArtifact artifact);

    Optional<Suite> findSuite(String id);

    void saveSuite(Suite suite);

    /**
     * @throws UniqueViolationException if the (testArtifactId, suiteId) pair already exists
     */
    CaseSuiteLink insertCaseSuiteLink(CaseSuiteLink link);

    /** @return false when the pair did not exist */
    boolean deleteCaseSuiteLink(String testArtifactId, String suiteId);

    List<CaseSuiteLink> findLinksForSuite(String suiteId);

    List<CaseSuiteLink> findLinksForCase(String testArtifactId);

    // ── Plans ───────────────────────────────────────────────────────────

    Optional<TestPlan> findPlan(String id);

    void savePlan(TestPlan plan);

    Optional<TestCycle> findCycle(String id);

    List<TestCycle> findCycles(String planId);

    void saveCycle(TestCycle cycle);

    List<ScopeDeclaration> findScopeDeclarations(String planId);

    Optional<ScopeDeclaration> findScopeDeclaration(String id);

    /**
     * @throws UniqueViolationException if (planId, sourceType, sourceId) is already declared
     */
    ScopeDeclaration insertScopeDeclaration(ScopeDeclaration declaration);

    /**
     * Updates the user-editable planning fields. The stored coverage status is kept as-is
     * whatever the argument carries.
     */
    ScopeDeclaration updateScopeDeclaration(ScopeDeclaration declaration);

    /** Overwrites the cached coverage status of one declaration. */
    void writeCoverageStatus(String declarationId, CoverageStatus status);

    boolean deleteScopeDeclaration(String id);

    List<PlanCaseEntry> findPlanCaseEntries(String planId);

    /**
     * @throws UniqueViolationException if the artifact is already in the plan
     */
    PlanCaseEntry insertPlanCaseEntry(PlanCaseEntry entry);

    boolean deletePlanCaseEntry(String planId, String testArtifactId);

    List<PlanDataSet> findPlanDataSets(String planId);

    void savePlanDataSet(PlanDataSet dataSet);

    // ── Executions & defects ────────────────────────────────────────────

    /** Executions of one artifact across all cycles, ordered by timestamp then id. */
    List<Execution> findExecutions(String testArtifactId);

    List<Execution> findExecutionsForCycle(String cycleId);

    /** Stores a new execution and returns it with its assigned sequence id. */
    Execution insertExecution(Execution execution);

    /**
     * Replaces the result, timestamp and executor of an existing execution, keeping its id.
     *
     * @throws StoreException if no execution has the argument's id
     */
    Execution updateExecution(Execution execution);

    List<Defect> findOpenDefects(String projectId, DefectSeverity severity);

    void saveDefect(Defect defect);
}
