package com.tracegate.core.resolve;

import com.tracegate.core.metrics.TracegateMetrics;
import com.tracegate.core.model.AnchorRefs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Resolves a test artifact's upstream references to its canonical level-3 process node.
 * <p>
 * The registered {@link AnchorResolutionStrategy} beans are tried in priority order
 * (explicit node, development item, requirement); the first match wins. A miss is an
 * empty result, not an error. Resolution only reads the store.
 */
@Service
public class AnchorResolver {

    private static final Logger log = LoggerFactory.getLogger(AnchorResolver.class);

    private final List<AnchorResolutionStrategy> strategies;
    private final TracegateMetrics metrics;

    public AnchorResolver(List<AnchorResolutionStrategy> strategies, TracegateMetrics metrics) {
        this.strategies = strategies.stream()
                .sorted(Comparator.comparingInt(AnchorResolutionStrategy::priority))
                .toList();
        this.metrics = metrics;
    }

    public Optional<String> resolveAnchor(AnchorRefs refs) {
        return Optional.ofNullable(resolve(refs).anchorId());
    }

    /**
     * Like {@link #resolveAnchor} but also reports which path matched.
     */
    public AnchorResolution resolve(AnchorRefs refs) {
        if (refs == null || refs.isEmpty()) {
            metrics.recordAnchorResolution(AnchorResolution.NO_PATH);
            return AnchorResolution.miss();
        }
        for (AnchorResolutionStrategy strategy : strategies) {
            Optional<String> anchor = strategy.resolve(refs);
            if (anchor.isPresent()) {
                log.debug("Resolved {} to anchor {} via {}", refs, anchor.get(), strategy.name());
                metrics.recordAnchorResolution(strategy.name());
                return new AnchorResolution(anchor.get(), strategy.name());
            }
        }
        log.debug("No anchor for {}", refs);
        metrics.recordAnchorResolution(AnchorResolution.NO_PATH);
        return AnchorResolution.miss();
    }
}
