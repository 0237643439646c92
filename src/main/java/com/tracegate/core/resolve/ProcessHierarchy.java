package com.tracegate.core.resolve;

import com.tracegate.core.model.ProcessNode;
import com.tracegate.core.store.EntityGraphStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Walks the 4-level process hierarchy held in the {@link EntityGraphStore}.
 * <p>
 * Both directions keep a visited set, so malformed data (a parent cycle, a node listed under
 * itself) ends the walk instead of looping.
 */
@Component
public class ProcessHierarchy {

    private static final Logger log = LoggerFactory.getLogger(ProcessHierarchy.class);

    public static final int ANCHOR_LEVEL = 3;

    private final EntityGraphStore store;

    public ProcessHierarchy(EntityGraphStore store) {
        this.store = store;
    }

    /**
     * Walks up from {@code nodeId} to the first level-3 node.
     *
     * @return the level-3 node id; empty when the node is unknown, sits above level 3,
     *         the parent chain breaks, or a cycle is detected
     */
    public Optional<String> ascendToAnchorLevel(String nodeId) {
        Set<String> visited = new HashSet<>();
        String currentId = nodeId;
        while (currentId != null && !currentId.isBlank()) {
            if (!visited.add(currentId)) {
                log.warn("Cycle in process hierarchy at node {} (walk started at {})", currentId, nodeId);
                return Optional.empty();
            }
            Optional<ProcessNode> node = store.findNode(currentId);
            if (node.isEmpty()) {
                log.debug("Process node {} not found while ascending from {}", currentId, nodeId);
                return Optional.empty();
            }
            int level = node.get().level();
            if (level == ANCHOR_LEVEL) {
                return Optional.of(node.get().id());
            }
            if (level < ANCHOR_LEVEL) {
                return Optional.empty();
            }
            currentId = node.get().parentId();
        }
        return Optional.empty();
    }

    /**
     * All level-3 nodes at or below {@code nodeId}, in breadth-first order.
     */
    public List<ProcessNode> anchorLevelDescendants(String nodeId) {
        List<ProcessNode> anchors = new ArrayList<>();
        Optional<ProcessNode> start = store.findNode(nodeId);
        if (start.isEmpty()) {
            return anchors;
        }
        Set<String> visited = new HashSet<>();
        Deque<ProcessNode> queue = new ArrayDeque<>();
        queue.add(start.get());
        while (!queue.isEmpty()) {
            ProcessNode node = queue.poll();
            if (!visited.add(node.id())) {
                continue;
            }
            if (node.level() == ANCHOR_LEVEL) {
                anchors.add(node);
                continue;
            }
            if (node.level() < ANCHOR_LEVEL) {
                queue.addAll(store.findChildren(node.id(), null));
            }
        }
        return anchors;
    }

    /** Level-4 children of a level-3 node. */
    public List<ProcessNode> variantsOf(String anchorId) {
        return store.findChildren(anchorId, ANCHOR_LEVEL + 1);
    }
}
