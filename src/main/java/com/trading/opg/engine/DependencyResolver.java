package com.trading.opg.engine;

import com.trading.opg.api.ConsistencyException;
import com.trading.opg.graph.GraphSnapshot;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a graph snapshot into a {@link StagedPlan}.
 *
 * <p>
 * Kahn's algorithm, emitting whole frontiers instead of single nodes:
 * <ol>
 * <li>Count the in-degree of every node.</li>
 * <li>Stage 0 is every node with in-degree 0.</li>
 * <li>Retiring a stage decrements the in-degree of each successor; those that
 * reach 0 form the next stage.</li>
 * <li>Repeat until a stage comes out empty.</li>
 * </ol>
 * Ids inside a stage are sorted ascending, so the same graph always yields
 * the same plan. Stateless and thread-safe.
 */
public final class DependencyResolver {
    private static final Logger log = LogManager.getLogger(DependencyResolver.class);

    /**
     * @throws ConsistencyException if some node could not be placed, i.e. the
     *                              snapshot contains a cycle
     */
    public StagedPlan resolve(GraphSnapshot snapshot) {
        int n = snapshot.nodeCount();
        Map<String, Integer> inDegree = new HashMap<>(n * 2);
        List<String> frontier = new ArrayList<>();
        for (String id : snapshot.nodeIds()) {
            int d = snapshot.inDegree(id);
            inDegree.put(id, d);
            if (d == 0)
                frontier.add(id);
        }
        Collections.sort(frontier);

        List<List<String>> stages = new ArrayList<>();
        int placed = 0;
        while (!frontier.isEmpty()) {
            stages.add(frontier);
            placed += frontier.size();

            List<String> next = new ArrayList<>();
            for (String id : frontier) {
                for (String child : snapshot.successors(id)) {
                    if (inDegree.merge(child, -1, Integer::sum) == 0)
                        next.add(child);
                }
            }
            Collections.sort(next);
            frontier = next;
        }

        if (placed != n) {
            List<String> stuck = new ArrayList<>();
            inDegree.forEach((id, d) -> {
                if (d > 0)
                    stuck.add(id);
            });
            Collections.sort(stuck);
            throw new ConsistencyException(
                    "Cycle detected while resolving: placed " + placed + " of " + n + " nodes, unresolved " + stuck);
        }

        log.debug("Resolved {} node(s) into {} stage(s)", n, stages.size());
        return new StagedPlan(snapshot, stages);
    }
}
