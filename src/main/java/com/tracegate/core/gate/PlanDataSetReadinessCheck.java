package com.tracegate.core.gate;

import com.tracegate.core.model.PlanDataSet;
import com.tracegate.core.store.EntityGraphStore;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Readiness from the plan's {@link PlanDataSet} records: a package is ready when its status is
 * {@code ready}, and the plan is ready when every mandatory package is. A plan without data
 * sets is ready.
 */
@Component
public class PlanDataSetReadinessCheck implements DataReadinessCheck {

    private final EntityGraphStore store;

    public PlanDataSetReadinessCheck(EntityGraphStore store) {
        this.store = store;
    }

    @Override
    public DataReadiness check(String planId) {
        List<DataSetStatus> statuses = store.findPlanDataSets(planId).stream()
                .map(ds -> new DataSetStatus(ds.dataSetId(), ds.name(), ds.status(), ds.environment(),
                        ds.mandatory(), ds.isReady()))
                .toList();
        boolean allReady = statuses.stream().noneMatch(s -> s.mandatory() && !s.ready());
        return new DataReadiness(planId, allReady, statuses);
    }
}
