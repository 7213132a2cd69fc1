package com.herzen.entanglement.query;

import com.herzen.entanglement.config.EntanglementProperties;
import com.herzen.entanglement.domain.ConceptGraphModels.*;
import com.herzen.entanglement.query.QueryModels.ConceptStatus;
import com.herzen.entanglement.query.QueryModels.GraphHealth;
import org.springframework.stereotype.Service;

import java.util.*;

@Service
public class GraphQueryService {
    private static final Map<EntanglementState, Integer> STATE_POINTS = Map.of(
            EntanglementState.MASTERED, 100,
            EntanglementState.STABLE, 80,
            EntanglementState.UNSTABLE, 50,
            EntanglementState.STRUGGLING, 25,
            EntanglementState.COLLAPSED, 0
    );

    private final int keystoneMinDependents;

    public GraphQueryService(EntanglementProperties properties) {
        this.keystoneMinDependents = properties.query().keystoneMinDependents();
    }

    public Optional<ConceptEntanglement> getEntanglement(ConceptEntanglementGraph graph, String conceptId) {
        return graph.entanglement(conceptId);
    }

    /**
     * Collapsed concepts first, then by cascade failures, most first.
     */
    public List<ConceptStatus> getStrugglingConcepts(ConceptEntanglementGraph graph) {
        List<ConceptStatus> results = new ArrayList<>();
        for (ConceptEntanglement e : graph.entanglements().values()) {
            if (!e.state().isStruggling()) continue;
            ConceptNode concept = graph.nodes().get(e.conceptId());
            if (concept != null) {
                results.add(new ConceptStatus(concept, e));
            }
        }
        results.sort(Comparator.comparing((ConceptStatus s) -> s.entanglement().state() != EntanglementState.COLLAPSED)
                .thenComparing(s -> s.entanglement().cascadeFailures(), Comparator.reverseOrder()));
        return results;
    }

    public List<ConceptNode> getKeystoneConcepts(ConceptEntanglementGraph graph) {
        return getKeystoneConcepts(graph, keystoneMinDependents);
    }

    public List<ConceptNode> getKeystoneConcepts(ConceptEntanglementGraph graph, int minDependents) {
        return graph.nodes().values().stream()
                .filter(n -> n.dependents().size() >= minDependents)
                .sorted(Comparator.comparingInt((ConceptNode n) -> n.dependents().size()).reversed())
                .toList();
    }

    /**
     * Longest dependent chain starting at a concept without prerequisites. On a cyclic graph the result is a
     * best effort: a link back into the chain being explored is treated as a dead end.
     */
    public List<String> getCriticalPath(ConceptEntanglementGraph graph) {
        Map<String, List<String>> memo = new HashMap<>();
        Set<String> inProgress = new HashSet<>();

        List<String> critical = List.of();
        for (ConceptNode node : graph.nodes().values()) {
            if (!node.prerequisites().isEmpty()) continue;
            List<String> path = longestPath(graph, node.id(), memo, inProgress);
            if (path.size() > critical.size()) {
                critical = path;
            }
        }
        return critical;
    }

    private List<String> longestPath(ConceptEntanglementGraph graph, String conceptId,
                                     Map<String, List<String>> memo, Set<String> inProgress) {
        List<String> cached = memo.get(conceptId);
        if (cached != null) return cached;

        ConceptNode node = graph.nodes().get(conceptId);
        if (node == null || node.dependents().isEmpty()) {
            List<String> leaf = List.of(conceptId);
            memo.put(conceptId, leaf);
            return leaf;
        }

        inProgress.add(conceptId);
        List<String> longestDownstream = List.of();
        for (String dependentId : node.dependents()) {
            if (inProgress.contains(dependentId)) continue;
            List<String> downstream = longestPath(graph, dependentId, memo, inProgress);
            if (downstream.size() > longestDownstream.size()) {
                longestDownstream = downstream;
            }
        }
        inProgress.remove(conceptId);

        List<String> full = new ArrayList<>(longestDownstream.size() + 1);
        full.add(conceptId);
        full.addAll(longestDownstream);
        List<String> path = List.copyOf(full);
        memo.put(conceptId, path);
        return path;
    }

    public GraphHealth calculateGraphHealth(ConceptEntanglementGraph graph) {
        Map<EntanglementState, Integer> counts = new EnumMap<>(EntanglementState.class);
        for (EntanglementState s : EntanglementState.values()) counts.put(s, 0);
        graph.entanglements().values().forEach(e -> counts.merge(e.state(), 1, Integer::sum));

        int unknown = counts.get(EntanglementState.UNKNOWN);
        int knownTotal = graph.entanglements().size() - unknown;

        int score = 50;
        if (knownTotal > 0) {
            long points = STATE_POINTS.entrySet().stream()
                    .mapToLong(e -> (long) e.getValue() * counts.get(e.getKey()))
                    .sum();
            score = (int) Math.round((double) points / knownTotal);
        }

        int collapsed = counts.get(EntanglementState.COLLAPSED);
        int struggling = counts.get(EntanglementState.STRUGGLING);
        int unstable = counts.get(EntanglementState.UNSTABLE);

        List<String> recommendations = new ArrayList<>();
        if (collapsed > 0) {
            recommendations.add(collapsed + " concept(s) need immediate attention - review fundamentals");
        }
        if (struggling > 2) {
            recommendations.add("Multiple concepts in struggling state - consider a repair path");
        }
        long strugglingKeystones = getKeystoneConcepts(graph).stream()
                .map(k -> graph.entanglements().get(k.id()))
                .filter(e -> e != null && e.state().isStruggling())
                .count();
        if (strugglingKeystones > 0) {
            recommendations.add("Critical: " + strugglingKeystones + " keystone concept(s) need repair");
        }
        if (unstable > knownTotal * 0.3) {
            recommendations.add("Many concepts are unstable - consider more practice before advancing");
        }

        return new GraphHealth(score,
                counts.get(EntanglementState.MASTERED),
                counts.get(EntanglementState.STABLE),
                unstable,
                struggling,
                collapsed,
                unknown,
                List.copyOf(recommendations));
    }
}
