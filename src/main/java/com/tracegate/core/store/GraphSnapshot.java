package com.tracegate.core.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tracegate.core.model.*;

import java.util.List;

/**
 * A bulk load of entity graph content, read from the JSON seed file configured under
 * {@code tracegate.store.seed-file}. Missing sections are treated as empty.
 */
public record GraphSnapshot(
    List<ProcessNode> nodes,
    @JsonProperty("process_steps") List<ProcessStep> processSteps,
    List<Requirement> requirements,
    @JsonProperty("development_items") List<DevelopmentItem> developmentItems,
    List<TestArtifact> artifacts,
    List<Suite> suites,
    @JsonProperty("suite_links") List<CaseSuiteLink> suiteLinks,
    List<TestPlan> plans,
    List<TestCycle> cycles,
    List<ScopeDeclaration> declarations,
    @JsonProperty("plan_entries") List<PlanCaseEntry> planEntries,
    List<Execution> executions,
    List<Defect> defects,
    @JsonProperty("data_sets") List<PlanDataSet> dataSets
) {

    /**
     * Writes every entity of this snapshot into the given store, parents before children.
     */
    public void loadInto(EntityGraphStore store) {
        orEmpty(nodes).forEach(store::saveNode);
        orEmpty(processSteps).forEach(store::saveProcessStep);
        orEmpty(requirements).forEach(store::saveRequirement);
        orEmpty(developmentItems).forEach(store::saveDevelopmentItem);
        orEmpty(artifacts).forEach(store::saveTestArtifact);
        orEmpty(suites).forEach(store::saveSuite);
        orEmpty(suiteLinks).forEach(store::insertCaseSuiteLink);
        orEmpty(plans).forEach(store::savePlan);
        orEmpty(cycles).forEach(store::saveCycle);
        orEmpty(declarations).forEach(store::insertScopeDeclaration);
        orEmpty(planEntries).forEach(store::insertPlanCaseEntry);
        orEmpty(executions).forEach(store::insertExecution);
        orEmpty(defects).forEach(store::saveDefect);
        orEmpty(dataSets).forEach(store::savePlanDataSet);
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list != null ? list : List.of();
    }
}
