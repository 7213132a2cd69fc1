package com.herzen.entanglement.session;

import com.herzen.entanglement.adaptation.EdgeAdaptationService;
import com.herzen.entanglement.config.EntanglementProperties;
import com.herzen.entanglement.domain.ConceptGraphModels.ConceptEntanglementGraph;
import com.herzen.entanglement.domain.ConceptGraphModels.ConceptNode;
import com.herzen.entanglement.domain.ConceptGraphModels.EdgeSpec;
import com.herzen.entanglement.graph.ConceptGraphService;
import com.herzen.entanglement.query.GraphQueryService;
import com.herzen.entanglement.query.QueryModels.GraphHealth;
import com.herzen.entanglement.repair.RepairModels.RepairPath;
import com.herzen.entanglement.repair.RepairPathService;
import com.herzen.entanglement.repository.GraphSnapshotJdbcRepository;
import com.herzen.entanglement.repository.GraphSnapshotJdbcRepository.SnapshotRow;
import com.herzen.entanglement.scoring.ComprehensionScoringService;
import com.herzen.entanglement.signal.BehaviorSignals.BehaviorSignal;
import com.herzen.entanglement.snapshot.GraphSnapshotCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Holds the current graph value per (course, learner) and applies engine operations to it one at a time.
 * Changed graphs are written back by the scheduled flush.
 */
@Service
public class EntanglementSessionService {
    private static final Logger log = LoggerFactory.getLogger(EntanglementSessionService.class);

    private final ConceptGraphService graphService;
    private final ComprehensionScoringService scoringService;
    private final EdgeAdaptationService adaptationService;
    private final RepairPathService repairPathService;
    private final GraphQueryService queryService;
    private final GraphSnapshotCodec codec;
    private final GraphSnapshotJdbcRepository repository;
    private final Clock clock;

    private final Map<GraphKey, GraphSlot> slots = new ConcurrentHashMap<>();
    private final Set<GraphKey> dirty = ConcurrentHashMap.newKeySet();

    public EntanglementSessionService(ConceptGraphService graphService,
                                      ComprehensionScoringService scoringService,
                                      EdgeAdaptationService adaptationService,
                                      RepairPathService repairPathService,
                                      GraphQueryService queryService,
                                      GraphSnapshotCodec codec,
                                      GraphSnapshotJdbcRepository repository,
                                      EntanglementProperties properties,
                                      Clock clock) {
        this.graphService = graphService;
        this.scoringService = scoringService;
        this.adaptationService = adaptationService;
        this.repairPathService = repairPathService;
        this.queryService = queryService;
        this.codec = codec;
        this.repository = repository;
        this.clock = clock;
        log.info("Concept graph snapshots flushed every {} ms", properties.persistence().flushDelayMs());
    }

    public ConceptEntanglementGraph graph(String courseId, String userId) {
        return slot(courseId, userId).current();
    }

    public ConceptEntanglementGraph addConcepts(String courseId, String userId, List<ConceptNode> nodes, List<EdgeSpec> edges) {
        return update(courseId, userId, g -> graphService.addAll(g, nodes, edges));
    }

    public ConceptEntanglementGraph recordSignal(String courseId, String userId, String conceptId, BehaviorSignal signal) {
        return update(courseId, userId, g -> scoringService.updateConceptEntanglement(g, conceptId, signal));
    }

    /**
     * Applies one signal to every concept taught in the section.
     */
    public ConceptEntanglementGraph recordSectionSignal(String courseId, String userId, String sectionId, BehaviorSignal signal) {
        return update(courseId, userId, g -> {
            List<String> conceptIds = g.nodes().values().stream()
                    .filter(n -> Objects.equals(n.sectionId(), sectionId))
                    .map(ConceptNode::id)
                    .toList();
            ConceptEntanglementGraph updated = g;
            for (String conceptId : conceptIds) {
                updated = scoringService.updateConceptEntanglement(updated, conceptId, signal);
            }
            return updated;
        });
    }

    public ConceptEntanglementGraph recordTransfer(String courseId, String userId, String fromConceptId, String toConceptId,
                                                   double fromScore, double toScore, boolean success) {
        return update(courseId, userId,
                g -> adaptationService.recordTransfer(g, fromConceptId, toConceptId, fromScore, toScore, success));
    }

    public RepairPath startRepairPath(String courseId, String userId, String targetConceptId) {
        GraphSlot slot = slot(courseId, userId);
        synchronized (slot) {
            RepairPathService.StartedRepair started = repairPathService.startRepairPath(slot.current(), targetConceptId);
            slot.replace(started.graph());
            dirty.add(slot.key());
            return started.path();
        }
    }

    public ConceptEntanglementGraph completeRepairStep(String courseId, String userId, String repairPathId, String conceptId) {
        return update(courseId, userId, g -> repairPathService.completeRepairStep(g, repairPathId, conceptId));
    }

    public ConceptEntanglementGraph dismissRepairPath(String courseId, String userId, String repairPathId) {
        return update(courseId, userId, g -> repairPathService.dismissRepairPath(g, repairPathId));
    }

    public GraphHealth health(String courseId, String userId) {
        return queryService.calculateGraphHealth(graph(courseId, userId));
    }

    /**
     * Drops all learner state for the course and stores the empty graph right away.
     */
    public ConceptEntanglementGraph reset(String courseId, String userId) {
        GraphSlot slot = slot(courseId, userId);
        synchronized (slot) {
            slot.replace(graphService.createEmptyGraph(courseId, userId));
            persist(slot);
            dirty.remove(slot.key());
            log.info("Reset concept graph for course {} user {}", courseId, userId);
            return slot.current();
        }
    }

    @Scheduled(fixedDelayString = "${entanglement.persistence.flush-delay-ms:1000}")
    public void scheduledFlush() {
        flush();
    }

    public int flush() {
        int written = 0;
        for (GraphKey key : List.copyOf(dirty)) {
            GraphSlot slot = slots.get(key);
            if (slot == null) continue;
            synchronized (slot) {
                if (!dirty.remove(key)) continue;
                persist(slot);
                written++;
            }
        }
        if (written > 0) {
            log.info("Flushed {} concept graph snapshot(s)", written);
        }
        return written;
    }

    private ConceptEntanglementGraph update(String courseId, String userId, UnaryOperator<ConceptEntanglementGraph> operation) {
        GraphSlot slot = slot(courseId, userId);
        synchronized (slot) {
            ConceptEntanglementGraph before = slot.current();
            ConceptEntanglementGraph after = operation.apply(before);
            if (after != before) {
                slot.replace(after);
                dirty.add(slot.key());
            }
            return after;
        }
    }

    private GraphSlot slot(String courseId, String userId) {
        Objects.requireNonNull(courseId, "courseId");
        GraphKey key = new GraphKey(courseId, userId);
        return slots.computeIfAbsent(key, k -> new GraphSlot(k, load(k)));
    }

    private ConceptEntanglementGraph load(GraphKey key) {
        return repository.load(key.courseId(), key.userId())
                .flatMap(row -> codec.decode(row.payload()))
                .orElseGet(() -> graphService.createEmptyGraph(key.courseId(), key.userId()));
    }

    private void persist(GraphSlot slot) {
        GraphKey key = slot.key();
        repository.save(new SnapshotRow(key.courseId(), key.userId(), GraphSnapshotCodec.SNAPSHOT_VERSION,
                codec.encode(slot.current()), clock.instant()));
    }

    private record GraphKey(String courseId, String userId) {}

    private static final class GraphSlot {
        private final GraphKey key;
        private volatile ConceptEntanglementGraph current;

        private GraphSlot(GraphKey key, ConceptEntanglementGraph current) {
            this.key = key;
            this.current = current;
        }

        GraphKey key() {
            return key;
        }

        ConceptEntanglementGraph current() {
            return current;
        }

        void replace(ConceptEntanglementGraph next) {
            this.current = next;
        }
    }
}
