package com.herzen.entanglement;

import com.herzen.entanglement.adaptation.EdgeAdaptationService;
import com.herzen.entanglement.domain.ConceptGraphModels.ConceptEntanglementGraph;
import com.herzen.entanglement.domain.ConceptGraphModels.ConceptNode;
import com.herzen.entanglement.domain.ConceptGraphModels.EdgeSpec;
import com.herzen.entanglement.graph.ConceptGraphService;
import com.herzen.entanglement.query.GraphQueryService;
import com.herzen.entanglement.query.QueryModels.ConceptStatus;
import com.herzen.entanglement.query.QueryModels.GraphHealth;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Import(FixedClockConfig.class)
class GraphQueryServiceTest {
    @Autowired
    private ConceptGraphService graphs;
    @Autowired
    private EdgeAdaptationService adaptation;
    @Autowired
    private GraphQueryService queries;

    @Test
    void listsCollapsedFirstThenByCascadeFailures() {
        ConceptEntanglementGraph graph = graphs.addAll(graphs.createEmptyGraph("gq-1", null),
                List.of(TestGraphs.concept("x"), TestGraphs.concept("y"), TestGraphs.concept("z"), TestGraphs.concept("w")),
                List.of(EdgeSpec.prerequisite("z", "w", 0.8, 0.7)));
        graph = graphs.assessConcept(graph, "x", 40, 1.0, 1);
        graph = graphs.assessConcept(graph, "y", 10, 1.0, 1);
        graph = graphs.assessConcept(graph, "z", 40, 1.0, 1);
        graph = graphs.assessConcept(graph, "w", 90, 1.0, 1);
        graph = adaptation.updateEdgeWeights(graph, "z", "w", false);

        List<String> order = queries.getStrugglingConcepts(graph).stream()
                .map(s -> s.concept().id())
                .toList();

        assertEquals(List.of("y", "z", "x"), order);
    }

    @Test
    void strugglingStatusCarriesNodeAndEntanglement() {
        ConceptEntanglementGraph graph = TestGraphs.asyncScenario(graphs, "gq-2");
        ConceptStatus first = queries.getStrugglingConcepts(graph).get(0);
        assertEquals("closures", first.concept().id());
        assertEquals(20, first.entanglement().comprehensionScore(), 1e-9);
        assertTrue(queries.getEntanglement(graph, "callbacks").isPresent());
        assertTrue(queries.getEntanglement(graph, "ghost").isEmpty());
    }

    @Test
    void keystonesRespectMinimumDependents() {
        ConceptEntanglementGraph graph = hubGraph("gq-3");

        assertEquals(List.of("hub"), queries.getKeystoneConcepts(graph).stream().map(ConceptNode::id).toList());
        assertEquals(List.of("hub", "mid"), queries.getKeystoneConcepts(graph, 2).stream().map(ConceptNode::id).toList());
    }

    @Test
    void criticalPathIsLongestChainFromARoot() {
        ConceptEntanglementGraph graph = TestGraphs.chain(graphs, "gq-4", "a", "b", "c", "d");
        graph = graphs.addConceptNode(graph, TestGraphs.concept("e"));
        graph = graphs.addConceptEdge(graph, EdgeSpec.prerequisite("e", "c", 0.8, 0.7));

        assertEquals(List.of("a", "b", "c", "d"), queries.getCriticalPath(graph));
    }

    @Test
    void criticalPathTerminatesOnCycles() {
        ConceptEntanglementGraph graph = TestGraphs.chain(graphs, "gq-5", "a", "b", "c");
        graph = graphs.addConceptEdge(graph, EdgeSpec.prerequisite("c", "b", 0.8, 0.7));

        assertEquals(List.of("a", "b", "c"), queries.getCriticalPath(graph));
        assertTrue(queries.getCriticalPath(graphs.createEmptyGraph("gq-5b", null)).isEmpty());
    }

    @Test
    void healthOfFreshGraphIsNeutral() {
        GraphHealth health = queries.calculateGraphHealth(TestGraphs.chain(graphs, "gq-6", "a", "b"));
        assertEquals(50, health.score());
        assertEquals(2, health.unknownCount());
        assertTrue(health.recommendations().isEmpty());
    }

    @Test
    void healthAveragesKnownStatesAndFlagsCollapse() {
        GraphHealth health = queries.calculateGraphHealth(TestGraphs.asyncScenario(graphs, "gq-7"));

        assertEquals(13, health.score());
        assertEquals(1, health.collapsedCount());
        assertEquals(1, health.strugglingCount());
        assertEquals(1, health.unknownCount());
        assertEquals(List.of("1 concept(s) need immediate attention - review fundamentals"), health.recommendations());
    }

    @Test
    void healthFlagsStrugglingKeystoneAndUnstableShare() {
        ConceptEntanglementGraph graph = hubGraph("gq-8");
        graph = graphs.assessConcept(graph, "hub", 40, 1.0, 1);
        graph = graphs.assessConcept(graph, "mid", 55, 1.0, 1);
        graph = graphs.assessConcept(graph, "x", 60, 1.0, 1);

        GraphHealth health = queries.calculateGraphHealth(graph);

        assertEquals(1, health.strugglingCount());
        assertEquals(2, health.unstableCount());
        assertTrue(health.recommendations().contains("Critical: 1 keystone concept(s) need repair"));
        assertTrue(health.recommendations().contains("Many concepts are unstable - consider more practice before advancing"));
    }

    private ConceptEntanglementGraph hubGraph(String courseId) {
        return graphs.addAll(graphs.createEmptyGraph(courseId, null),
                List.of(TestGraphs.concept("hub"), TestGraphs.concept("mid"),
                        TestGraphs.concept("x"), TestGraphs.concept("y"), TestGraphs.concept("z")),
                List.of(EdgeSpec.prerequisite("hub", "x", 0.8, 0.7),
                        EdgeSpec.prerequisite("hub", "y", 0.8, 0.7),
                        EdgeSpec.prerequisite("hub", "z", 0.8, 0.7),
                        EdgeSpec.prerequisite("mid", "x", 0.8, 0.7),
                        EdgeSpec.prerequisite("mid", "y", 0.8, 0.7)));
    }
}
