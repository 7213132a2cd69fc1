package com.herzen.entanglement.domain;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.herzen.entanglement.repair.RepairModels.RepairPath;
import com.herzen.entanglement.signal.BehaviorSignals.BehaviorSignal;

import java.time.Instant;
import java.util.*;

public class ConceptGraphModels {

    public record ConceptNode(String id,
                              String title,
                              String description,
                              String sectionId,
                              String chapterId,
                              String courseId,
                              int order,
                              int difficulty,
                              int xpReward,
                              @JsonDeserialize(as = LinkedHashSet.class) Set<String> skills,
                              @JsonDeserialize(as = LinkedHashSet.class) Set<String> prerequisites,
                              @JsonDeserialize(as = LinkedHashSet.class) Set<String> dependents,
                              @JsonDeserialize(as = LinkedHashSet.class) Set<String> related) {
        public ConceptNode {
            Objects.requireNonNull(id, "id");
            difficulty = Math.max(0, Math.min(100, difficulty));
            skills = orderedCopy(skills);
            prerequisites = orderedCopy(prerequisites);
            dependents = orderedCopy(dependents);
            related = orderedCopy(related);
        }

        /**
         * Node without any adjacency; prerequisite links are added through edges only.
         */
        public static ConceptNode of(String id, String title, String sectionId, String chapterId, String courseId,
                                     int order, int difficulty) {
            return new ConceptNode(id, title, "", sectionId, chapterId, courseId, order, difficulty, 0,
                    Set.of(), Set.of(), Set.of(), Set.of());
        }

        ConceptNode withAdjacency(Set<String> nextPrerequisites, Set<String> nextDependents) {
            return new ConceptNode(id, title, description, sectionId, chapterId, courseId, order, difficulty, xpReward,
                    skills, nextPrerequisites, nextDependents, related);
        }

        ConceptNode withPrerequisite(String conceptId) {
            Set<String> next = new LinkedHashSet<>(prerequisites);
            next.add(conceptId);
            return new ConceptNode(id, title, description, sectionId, chapterId, courseId, order, difficulty, xpReward,
                    skills, next, dependents, related);
        }

        ConceptNode withDependent(String conceptId) {
            Set<String> next = new LinkedHashSet<>(dependents);
            next.add(conceptId);
            return new ConceptNode(id, title, description, sectionId, chapterId, courseId, order, difficulty, xpReward,
                    skills, prerequisites, next, related);
        }
    }

    public enum EdgeType {
        PREREQUISITE("prerequisite"),
        REINFORCES("reinforces"),
        RELATED("related"),
        BUILDS_UPON("builds-upon");

        private final String key;

        EdgeType(String key) {
            this.key = key;
        }

        public String key() {
            return key;
        }
    }

    /**
     * Edge payload before insertion; the id is assigned by the graph.
     */
    public record EdgeSpec(String from, String to, EdgeType type, double weight, double transferCoefficient, String label) {
        public static EdgeSpec prerequisite(String from, String to, double weight, double transferCoefficient) {
            return new EdgeSpec(from, to, EdgeType.PREREQUISITE, weight, transferCoefficient, null);
        }
    }

    public record ConceptEdge(String id,
                              String from,
                              String to,
                              EdgeType type,
                              double weight,
                              double transferCoefficient,
                              long successfulTraversals,
                              long difficultTraversals,
                              String label) {
        public ConceptEdge {
            weight = clampUnit(weight);
            transferCoefficient = clampUnit(transferCoefficient);
        }

        public static String edgeId(String from, String to, EdgeType type) {
            return "edge_" + from + "_" + to + "_" + type.key();
        }

        public static ConceptEdge from(EdgeSpec spec) {
            return new ConceptEdge(edgeId(spec.from(), spec.to(), spec.type()), spec.from(), spec.to(), spec.type(),
                    spec.weight(), spec.transferCoefficient(), 0, 0, spec.label());
        }

        public long totalTraversals() {
            return successfulTraversals + difficultTraversals;
        }

        public boolean connects(String fromId, String toId) {
            return from.equals(fromId) && to.equals(toId);
        }
    }

    public enum EntanglementState {
        MASTERED, STABLE, UNSTABLE, STRUGGLING, COLLAPSED, UNKNOWN;

        /**
         * Decision table evaluated top to bottom: low confidence, cascade override, then score bands.
         */
        public static EntanglementState fromScore(double score, double confidence, long cascadeFailures) {
            if (confidence < 0.2) return UNKNOWN;
            if (cascadeFailures >= 3) return COLLAPSED;
            if (score >= 85) return MASTERED;
            if (score >= 70) return STABLE;
            if (score >= 50) return UNSTABLE;
            if (score >= 30) return STRUGGLING;
            return COLLAPSED;
        }

        public boolean isProblematic() {
            return this == COLLAPSED || this == STRUGGLING || this == UNSTABLE;
        }

        public boolean isStruggling() {
            return this == COLLAPSED || this == STRUGGLING;
        }
    }

    /**
     * Per-learner state of one concept. {@code state} is always derived from the other fields.
     */
    public record ConceptEntanglement(String conceptId,
                                      EntanglementState state,
                                      double comprehensionScore,
                                      double confidence,
                                      long attempts,
                                      long timeSpentMs,
                                      List<BehaviorSignal> signals,
                                      Instant lastInteraction,
                                      long cascadeFailures,
                                      long cascadeSuccesses) {
        public ConceptEntanglement {
            Objects.requireNonNull(conceptId, "conceptId");
            comprehensionScore = clampScore(comprehensionScore);
            confidence = clampUnit(confidence);
            signals = signals == null ? List.of() : List.copyOf(signals);
            lastInteraction = lastInteraction == null ? Instant.EPOCH : lastInteraction;
            state = EntanglementState.fromScore(comprehensionScore, confidence, cascadeFailures);
        }

        public static ConceptEntanglement initial(String conceptId) {
            return new ConceptEntanglement(conceptId, EntanglementState.UNKNOWN, 50, 0, 0, 0, List.of(), Instant.EPOCH, 0, 0);
        }

        public ConceptEntanglement withSignals(List<BehaviorSignal> window, double score, double conf,
                                               long addedTimeMs, Instant at) {
            return new ConceptEntanglement(conceptId, null, score, conf, attempts + 1, timeSpentMs + addedTimeMs,
                    window, at, cascadeFailures, cascadeSuccesses);
        }

        public ConceptEntanglement withCascadeOutcome(boolean success) {
            return new ConceptEntanglement(conceptId, null, comprehensionScore, confidence, attempts, timeSpentMs,
                    signals, lastInteraction, cascadeFailures + (success ? 0 : 1), cascadeSuccesses + (success ? 1 : 0));
        }
    }

    public record ScoreMoments(double sumFrom, double sumTo, double sumFromSq, double sumToSq, double sumProduct) {
        public static final ScoreMoments EMPTY = new ScoreMoments(0, 0, 0, 0, 0);

        public ScoreMoments add(double fromScore, double toScore) {
            return new ScoreMoments(sumFrom + fromScore, sumTo + toScore, sumFromSq + fromScore * fromScore,
                    sumToSq + toScore * toScore, sumProduct + fromScore * toScore);
        }

        /**
         * Pearson correlation over {@code n} samples; 0 while either series has no variance.
         */
        public double correlation(long n) {
            if (n < 2) return 0.0;
            double cov = n * sumProduct - sumFrom * sumTo;
            double varFrom = n * sumFromSq - sumFrom * sumFrom;
            double varTo = n * sumToSq - sumTo * sumTo;
            if (varFrom <= 0 || varTo <= 0) return 0.0;
            double r = cov / Math.sqrt(varFrom * varTo);
            return Double.isNaN(r) ? 0.0 : Math.max(-1.0, Math.min(1.0, r));
        }
    }

    public record LearningTransferPattern(String id,
                                          String fromConcept,
                                          String toConcept,
                                          double transferRate,
                                          long sampleSize,
                                          double correlation,
                                          ScoreMoments moments,
                                          Instant lastUpdated) {
        public static String patternId(String from, String to) {
            return "pattern_" + from + "_" + to;
        }
    }

    public record GraphMetadata(String courseId, String userId, Instant lastUpdated, int version) {
        public GraphMetadata touched(Instant at) {
            return new GraphMetadata(courseId, userId, at, version);
        }
    }

    /**
     * Aggregate root threaded through every engine operation. Instances are immutable; every change
     * produces a new value sharing untouched collections.
     */
    public record ConceptEntanglementGraph(Map<String, ConceptNode> nodes,
                                           Map<String, ConceptEntanglement> entanglements,
                                           List<ConceptEdge> edges,
                                           List<LearningTransferPattern> transferPatterns,
                                           List<RepairPath> activeRepairPaths,
                                           GraphMetadata metadata) {
        public ConceptEntanglementGraph {
            nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
            entanglements = Collections.unmodifiableMap(new LinkedHashMap<>(entanglements));
            edges = List.copyOf(edges);
            transferPatterns = List.copyOf(transferPatterns);
            activeRepairPaths = List.copyOf(activeRepairPaths);
            Objects.requireNonNull(metadata, "metadata");
        }

        public Optional<ConceptEntanglement> entanglement(String conceptId) {
            return Optional.ofNullable(entanglements.get(conceptId));
        }

        /**
         * Prefers the prerequisite edge when several typed edges join the same pair.
         */
        public Optional<ConceptEdge> edge(String from, String to) {
            ConceptEdge any = null;
            for (ConceptEdge e : edges) {
                if (!e.connects(from, to)) continue;
                if (e.type() == EdgeType.PREREQUISITE) return Optional.of(e);
                if (any == null) any = e;
            }
            return Optional.ofNullable(any);
        }

        /**
         * Inserts or overwrites a node and makes sure it has an entanglement entry. The node's
         * {@code prerequisites}/{@code dependents} are rebuilt from the prerequisite edges already present,
         * whatever the caller passed in.
         */
        public ConceptEntanglementGraph withNode(ConceptNode node, Instant at) {
            Set<String> prereqs = new LinkedHashSet<>();
            Set<String> deps = new LinkedHashSet<>();
            for (ConceptEdge e : edges) {
                if (e.type() != EdgeType.PREREQUISITE) continue;
                if (e.to().equals(node.id())) prereqs.add(e.from());
                if (e.from().equals(node.id())) deps.add(e.to());
            }
            Map<String, ConceptNode> nextNodes = new LinkedHashMap<>(nodes);
            nextNodes.put(node.id(), node.withAdjacency(prereqs, deps));

            Map<String, ConceptEntanglement> nextEntanglements = entanglements;
            if (!entanglements.containsKey(node.id())) {
                nextEntanglements = new LinkedHashMap<>(entanglements);
                nextEntanglements.put(node.id(), ConceptEntanglement.initial(node.id()));
            }
            return new ConceptEntanglementGraph(nextNodes, nextEntanglements, edges, transferPatterns, activeRepairPaths, metadata.touched(at));
        }

        public ConceptEntanglementGraph withEntanglements(Map<String, ConceptEntanglement> next, Instant at) {
            return new ConceptEntanglementGraph(nodes, next, edges, transferPatterns, activeRepairPaths, metadata.touched(at));
        }

        public ConceptEntanglementGraph withEntanglement(ConceptEntanglement entanglement, Instant at) {
            Map<String, ConceptEntanglement> next = new LinkedHashMap<>(entanglements);
            next.put(entanglement.conceptId(), entanglement);
            return withEntanglements(next, at);
        }

        /**
         * Appends an edge. This is the only writer of the node-local {@code prerequisites}/{@code dependents}
         * sets: a prerequisite edge from A to B adds A to B's prerequisites and B to A's dependents.
         * Endpoints missing from {@code nodes} are left alone.
         */
        public ConceptEntanglementGraph withEdge(ConceptEdge edge, Instant at) {
            Map<String, ConceptNode> nextNodes = nodes;
            if (edge.type() == EdgeType.PREREQUISITE) {
                nextNodes = new LinkedHashMap<>(nodes);
                ConceptNode fromNode = nextNodes.get(edge.from());
                if (fromNode != null) {
                    nextNodes.put(edge.from(), fromNode.withDependent(edge.to()));
                }
                ConceptNode toNode = nextNodes.get(edge.to());
                if (toNode != null) {
                    nextNodes.put(edge.to(), toNode.withPrerequisite(edge.from()));
                }
            }
            List<ConceptEdge> nextEdges = new ArrayList<>(edges);
            nextEdges.add(edge);
            return new ConceptEntanglementGraph(nextNodes, entanglements, nextEdges, transferPatterns, activeRepairPaths, metadata.touched(at));
        }

        public ConceptEntanglementGraph withEdgesAndEntanglements(List<ConceptEdge> nextEdges,
                                                                  Map<String, ConceptEntanglement> nextEntanglements,
                                                                  Instant at) {
            return new ConceptEntanglementGraph(nodes, nextEntanglements, nextEdges, transferPatterns, activeRepairPaths, metadata.touched(at));
        }

        public ConceptEntanglementGraph withTransferPatterns(List<LearningTransferPattern> next, Instant at) {
            return new ConceptEntanglementGraph(nodes, entanglements, edges, next, activeRepairPaths, metadata.touched(at));
        }

        public ConceptEntanglementGraph withRepairPaths(List<RepairPath> next, Instant at) {
            return new ConceptEntanglementGraph(nodes, entanglements, edges, transferPatterns, next, metadata.touched(at));
        }
    }

    static Set<String> orderedCopy(Set<String> source) {
        return source == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(source));
    }

    public static double clampUnit(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }

    public static double clampScore(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(100.0, value));
    }
}
