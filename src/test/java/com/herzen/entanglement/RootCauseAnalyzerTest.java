package com.herzen.entanglement;

import com.herzen.entanglement.analysis.AnalysisModels.RootCause;
import com.herzen.entanglement.analysis.AnalysisModels.RootCauseResult;
import com.herzen.entanglement.analysis.AnalysisModels.Severity;
import com.herzen.entanglement.analysis.RootCauseAnalyzer;
import com.herzen.entanglement.domain.ConceptGraphModels.ConceptEntanglementGraph;
import com.herzen.entanglement.domain.ConceptGraphModels.EdgeSpec;
import com.herzen.entanglement.graph.ConceptGraphService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Import(FixedClockConfig.class)
class RootCauseAnalyzerTest {
    @Autowired
    private ConceptGraphService graphs;
    @Autowired
    private RootCauseAnalyzer analyzer;

    @Test
    void findsCollapsedClosuresBehindAsyncAwait() {
        ConceptEntanglementGraph graph = TestGraphs.asyncScenario(graphs, "rc-1");

        RootCauseResult result = analyzer.findRootCause(graph, "async-await");

        RootCause top = result.rootCauses().get(0);
        assertEquals("closures", top.conceptId());
        assertEquals(Severity.CRITICAL, top.severity());
        RootCause callbacks = result.rootCauses().stream()
                .filter(c -> c.conceptId().equals("callbacks")).findFirst().orElseThrow();
        assertEquals(Severity.MAJOR, callbacks.severity());
        assertTrue(callbacks.confidence() < top.confidence());
        assertEquals(List.of("closures", "callbacks", "async-await"), result.causationChain());
        assertTrue(top.evidence().contains("This concept has collapsed - needs complete review"));
        assertTrue(top.evidence().contains("Low comprehension score: 20%"));
    }

    @Test
    void collapsedDirectPrerequisiteIsAlwaysReportedAsCritical() {
        ConceptEntanglementGraph graph = TestGraphs.chain(graphs, "rc-2", "arrays", "sorting");
        graph = graphs.assessConcept(graph, "arrays", 10, 1.0, 8);
        graph = graphs.assessConcept(graph, "sorting", 40, 0.6, 3);

        RootCauseResult result = analyzer.findRootCause(graph, "sorting");

        assertEquals(1, result.rootCauses().size());
        RootCause arrays = result.rootCauses().get(0);
        assertEquals("arrays", arrays.conceptId());
        assertEquals(Severity.CRITICAL, arrays.severity());
        assertTrue(arrays.evidence().contains("Multiple attempts (8) with limited progress"));
    }

    @Test
    void healthyPrerequisitesGiveEmptyDiagnosis() {
        ConceptEntanglementGraph graph = TestGraphs.chain(graphs, "rc-3", "arrays", "sorting");
        graph = graphs.assessConcept(graph, "arrays", 92, 1.0, 4);

        RootCauseResult result = analyzer.findRootCause(graph, "sorting");

        assertTrue(result.rootCauses().isEmpty());
        assertEquals(List.of("sorting"), result.causationChain());
    }

    @Test
    void unknownTriggerGivesEmptyDiagnosis() {
        ConceptEntanglementGraph graph = TestGraphs.asyncScenario(graphs, "rc-4");
        RootCauseResult result = analyzer.findRootCause(graph, "generators");
        assertTrue(result.rootCauses().isEmpty());
        assertEquals(List.of("generators"), result.causationChain());
    }

    @Test
    void diamondPrerequisiteIsReportedOnce() {
        ConceptEntanglementGraph graph = graphs.addAll(graphs.createEmptyGraph("rc-5", null),
                List.of(TestGraphs.concept("base"), TestGraphs.concept("left"), TestGraphs.concept("right"), TestGraphs.concept("top")),
                List.of(EdgeSpec.prerequisite("base", "left", 0.8, 0.7),
                        EdgeSpec.prerequisite("base", "right", 0.8, 0.7),
                        EdgeSpec.prerequisite("left", "top", 0.8, 0.7),
                        EdgeSpec.prerequisite("right", "top", 0.8, 0.7)));
        graph = graphs.assessConcept(graph, "base", 15, 1.0, 2);

        RootCauseResult result = analyzer.findRootCause(graph, "top");

        assertEquals(1, result.rootCauses().size());
        assertEquals("base", result.rootCauses().get(0).conceptId());
    }

    @Test
    void terminatesOnPrerequisiteCycles() {
        ConceptEntanglementGraph graph = TestGraphs.chain(graphs, "rc-6", "a", "b", "c");
        graph = graphs.addConceptEdge(graph, EdgeSpec.prerequisite("c", "a", 0.8, 0.7));
        graph = graphs.assessConcept(graph, "a", 35, 1.0, 1);
        graph = graphs.assessConcept(graph, "b", 35, 1.0, 1);

        RootCauseResult result = analyzer.findRootCause(graph, "c");

        assertEquals(2, result.rootCauses().size());
    }

    @Test
    void depthLimitStopsTheBackwardWalk() {
        ConceptEntanglementGraph graph = TestGraphs.chain(graphs, "rc-7", "a", "b", "c", "d");
        graph = graphs.assessConcept(graph, "a", 10, 1.0, 1);

        assertTrue(analyzer.findRootCause(graph, "d", 1).rootCauses().isEmpty());
        assertEquals("a", analyzer.findRootCause(graph, "d", 2).rootCauses().get(0).conceptId());
    }

    @Test
    void closerPrerequisitesGetMoreConfidence() {
        ConceptEntanglementGraph graph = TestGraphs.chain(graphs, "rc-8", "a", "b", "c");
        graph = graphs.assessConcept(graph, "a", 55, 1.0, 1);
        graph = graphs.assessConcept(graph, "b", 55, 1.0, 1);

        RootCauseResult result = analyzer.findRootCause(graph, "c");

        assertEquals("b", result.rootCauses().get(0).conceptId());
        assertEquals(Severity.MINOR, result.rootCauses().get(0).severity());
        assertEquals(List.of("b", "c"), result.causationChain());
        result.rootCauses().forEach(c -> assertTrue(c.confidence() >= 0 && c.confidence() <= 1));
    }
}
