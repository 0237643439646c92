package com.tracegate.core.suite;

import com.tracegate.core.error.DuplicateAssociationException;
import com.tracegate.core.error.NotFoundException;
import com.tracegate.core.logging.MdcContext;
import com.tracegate.core.metrics.TracegateMetrics;
import com.tracegate.core.model.AddedMethod;
import com.tracegate.core.model.CaseSuiteLink;
import com.tracegate.core.store.EntityGraphStore;
import com.tracegate.core.store.UniqueViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Maintains the many-to-many membership of test artifacts in suites.
 * <p>
 * Duplicate detection is left to the store's (testArtifactId, suiteId) uniqueness constraint,
 * so two concurrent {@link #link} calls for the same pair produce exactly one membership and
 * one {@link DuplicateAssociationException}.
 */
@Service
public class AssociationManager {

    private static final Logger log = LoggerFactory.getLogger(AssociationManager.class);

    private final EntityGraphStore store;
    private final TracegateMetrics metrics;
    private final Clock clock;

    public AssociationManager(EntityGraphStore store, TracegateMetrics metrics) {
        this(store, metrics, Clock.systemUTC());
    }

    AssociationManager(EntityGraphStore store, TracegateMetrics metrics, Clock clock) {
        this.store = store;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Adds a test artifact to a suite.
     *
     * @throws NotFoundException             if the artifact or the suite does not exist
     * @throws DuplicateAssociationException if the artifact is already in the suite
     */
    public CaseSuiteLink link(String testArtifactId, String suiteId, AddedMethod addedMethod) {
        requireArtifact(testArtifactId);
        requireSuite(suiteId);
        MdcContext.setSuite(suiteId, testArtifactId);
        try {
            var link = new CaseSuiteLink(testArtifactId, suiteId,
                    addedMethod != null ? addedMethod : AddedMethod.MANUAL, clock.instant());
            CaseSuiteLink stored = store.insertCaseSuiteLink(link);
            log.info("Linked {} to suite {} ({})", testArtifactId, suiteId, stored.addedMethod().code());
            return stored;
        } catch (UniqueViolationException e) {
            metrics.recordDuplicateAssociation("suite_link");
            throw new DuplicateAssociationException(
                    "Test artifact " + testArtifactId + " is already in suite " + suiteId, e);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Removes exactly one membership. Other suites of the artifact are untouched.
     *
     * @throws NotFoundException if the artifact is not in the suite
     */
    public void unlink(String testArtifactId, String suiteId) {
        if (!store.deleteCaseSuiteLink(testArtifactId, suiteId)) {
            throw new NotFoundException("Test artifact " + testArtifactId + " is not in suite " + suiteId);
        }
        log.info("Unlinked {} from suite {}", testArtifactId, suiteId);
    }

    public List<CaseSuiteLink> listCasesForSuite(String suiteId) {
        requireSuite(suiteId);
        return store.findLinksForSuite(suiteId);
    }

    public List<CaseSuiteLink> listSuitesForCase(String testArtifactId) {
        requireArtifact(testArtifactId);
        return store.findLinksForCase(testArtifactId);
    }

    /**
     * Number of memberships of a suite per provenance. Every {@link AddedMethod} is present,
     * with zero when unused.
     */
    public Map<AddedMethod, Long> provenanceBreakdown(String suiteId) {
        var counts = new EnumMap<AddedMethod, Long>(AddedMethod.class);
        for (AddedMethod method : AddedMethod.values()) {
            counts.put(method, 0L);
        }
        for (CaseSuiteLink link : listCasesForSuite(suiteId)) {
            counts.merge(link.addedMethod(), 1L, Long::sum);
        }
        return counts;
    }

    private void requireArtifact(String testArtifactId) {
        if (store.findTestArtifact(testArtifactId).isEmpty()) {
            throw new NotFoundException("Test artifact", testArtifactId);
        }
    }

    private void requireSuite(String suiteId) {
        if (store.findSuite(suiteId).isEmpty()) {
            throw new NotFoundException("Suite", suiteId);
        }
    }
}
