package com.tracegate.dispatch.api;

import com.tracegate.core.model.Execution;
import com.tracegate.core.plan.CarryForwardFilter;
import com.tracegate.core.plan.CycleExecutionService;
import com.tracegate.core.plan.CyclePopulation;
import com.tracegate.core.plan.ExecutionDraft;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for cycle population and execution results.
 */
@RestController
@RequestMapping("/api/v1/cycles/{cycleId}")
public class CycleController {

    private final CycleExecutionService cycles;

    public CycleController(CycleExecutionService cycles) {
        this.cycles = cycles;
    }

    @PostMapping("/populate")
    public ResponseEntity<CyclePopulation> populate(@PathVariable String cycleId) {
        return ResponseEntity.ok(cycles.populateFromPlan(cycleId));
    }

    /**
     * POST /api/v1/cycles/{cycleId}/carry-forward/{previousCycleId}?filter=failed_blocked
     */
    @PostMapping("/carry-forward/{previousCycleId}")
    public ResponseEntity<CyclePopulation> carryForward(@PathVariable String cycleId,
                                                        @PathVariable String previousCycleId,
                                                        @RequestParam(required = false) String filter) {
        return ResponseEntity.ok(cycles.carryForward(cycleId, previousCycleId, CarryForwardFilter.fromCode(filter)));
    }

    @PostMapping("/executions")
    public ResponseEntity<Execution> record(@PathVariable String cycleId, @RequestBody ExecutionDraft draft) {
        return ResponseEntity.status(HttpStatus.CREATED).body(cycles.recordResult(cycleId, draft));
    }
}
