package com.herzen.entanglement.snapshot;

import com.herzen.entanglement.domain.ConceptGraphModels.*;
import com.herzen.entanglement.repair.RepairModels.RepairPath;

import java.util.List;

/**
 * Stored form of a graph: id-keyed maps become lists of id/value pairs so the payload does not depend on
 * map iteration order.
 */
public class SnapshotModels {
    public record GraphSnapshot(int version, StoredGraph graph) {}

    public record StoredGraph(List<NodeEntry> nodes,
                              List<ConceptEdge> edges,
                              List<EntanglementEntry> entanglements,
                              List<LearningTransferPattern> transferPatterns,
                              List<RepairPath> activeRepairPaths,
                              GraphMetadata metadata) {}

    public record NodeEntry(String id, ConceptNode value) {}

    public record EntanglementEntry(String id, ConceptEntanglement value) {}
}
