package com.herzen.entanglement.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.entanglement.domain.ConceptGraphModels.ConceptEntanglement;
import com.herzen.entanglement.domain.ConceptGraphModels.ConceptEntanglementGraph;
import com.herzen.entanglement.domain.ConceptGraphModels.ConceptNode;
import com.herzen.entanglement.snapshot.SnapshotModels.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class GraphSnapshotCodec {
    public static final int SNAPSHOT_VERSION = 1;

    private static final Logger log = LoggerFactory.getLogger(GraphSnapshotCodec.class);

    private final ObjectMapper mapper;

    public GraphSnapshotCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encode(ConceptEntanglementGraph graph) {
        List<NodeEntry> nodes = graph.nodes().entrySet().stream()
                .map(e -> new NodeEntry(e.getKey(), e.getValue()))
                .toList();
        List<EntanglementEntry> entanglements = graph.entanglements().entrySet().stream()
                .map(e -> new EntanglementEntry(e.getKey(), e.getValue()))
                .toList();
        StoredGraph stored = new StoredGraph(nodes, graph.edges(), entanglements, graph.transferPatterns(),
                graph.activeRepairPaths(), graph.metadata());
        try {
            return mapper.writeValueAsString(new GraphSnapshot(SNAPSHOT_VERSION, stored));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode graph for course " + graph.metadata().courseId(), e);
        }
    }

    /**
     * Empty when the payload is unreadable or written by another snapshot version; callers start over
     * with a fresh graph in that case.
     */
    public Optional<ConceptEntanglementGraph> decode(String payload) {
        if (payload == null || payload.isBlank()) return Optional.empty();

        GraphSnapshot snapshot;
        try {
            snapshot = mapper.readValue(payload, GraphSnapshot.class);
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable graph snapshot: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        if (snapshot.version() != SNAPSHOT_VERSION || snapshot.graph() == null) {
            // no migrations exist yet
            log.warn("Discarding graph snapshot with version {} (expected {})", snapshot.version(), SNAPSHOT_VERSION);
            return Optional.empty();
        }

        StoredGraph g = snapshot.graph();
        Map<String, ConceptNode> nodes = new LinkedHashMap<>();
        orEmpty(g.nodes()).forEach(e -> nodes.put(e.id(), e.value()));
        Map<String, ConceptEntanglement> entanglements = new LinkedHashMap<>();
        orEmpty(g.entanglements()).forEach(e -> entanglements.put(e.id(), e.value()));

        return Optional.of(new ConceptEntanglementGraph(nodes, entanglements, orEmpty(g.edges()),
                orEmpty(g.transferPatterns()), orEmpty(g.activeRepairPaths()), g.metadata()));
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }
}
