package com.herzen.entanglement;

import com.herzen.entanglement.analysis.AnalysisModels.AffectedConcept;
import com.herzen.entanglement.analysis.AnalysisModels.ForwardImpactResult;
import com.herzen.entanglement.analysis.AnalysisModels.ImpactLevel;
import com.herzen.entanglement.analysis.ForwardImpactAnalyzer;
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
class ForwardImpactAnalyzerTest {
    @Autowired
    private ConceptGraphService graphs;
    @Autowired
    private ForwardImpactAnalyzer analyzer;

    @Test
    void projectsClosuresGapOntoCallbacksAndAsyncAwait() {
        ConceptEntanglementGraph graph = TestGraphs.asyncScenario(graphs, "fi-1");

        ForwardImpactResult result = analyzer.analyzeForwardImpact(graph, "closures");

        assertEquals(2, result.totalAtRisk());
        AffectedConcept callbacks = result.affectedConcepts().get(0);
        AffectedConcept asyncAwait = result.affectedConcepts().get(1);
        assertEquals("callbacks", callbacks.conceptId());
        assertEquals(1, callbacks.pathLength());
        assertEquals(80 * 0.7 * 0.8, callbacks.estimatedScoreReduction(), 1e-9);
        assertEquals(ImpactLevel.HIGH, callbacks.impactLevel());
        assertEquals("async-await", asyncAwait.conceptId());
        assertEquals(2, asyncAwait.pathLength());
        assertTrue(asyncAwait.estimatedScoreReduction() < callbacks.estimatedScoreReduction());
    }

    @Test
    void reductionStrictlyDecreasesWithDistance() {
        ConceptEntanglementGraph graph = TestGraphs.chain(graphs, "fi-2", "a", "b", "c", "d", "e", "f");
        graph = graphs.assessConcept(graph, "a", 10, 1.0, 1);

        List<AffectedConcept> affected = analyzer.analyzeForwardImpact(graph, "a").affectedConcepts().stream()
                .sorted((x, y) -> Integer.compare(x.pathLength(), y.pathLength()))
                .toList();

        assertEquals(5, affected.size());
        for (int i = 1; i < affected.size(); i++) {
            assertTrue(affected.get(i).estimatedScoreReduction() < affected.get(i - 1).estimatedScoreReduction());
        }
    }

    @Test
    void unassessedSourceStartsFromHalfGap() {
        ConceptEntanglementGraph graph = graphs.addAll(graphs.createEmptyGraph("fi-3", null),
                List.of(TestGraphs.concept("a"), TestGraphs.concept("b")),
                List.of(EdgeSpec.prerequisite("a", "b", 0.5, 0.7)));

        ForwardImpactResult result = analyzer.analyzeForwardImpact(graph, "a");

        assertEquals(50 * 0.7 * 0.5, result.affectedConcepts().get(0).estimatedScoreReduction(), 1e-9);
        assertEquals(ImpactLevel.MEDIUM, result.affectedConcepts().get(0).impactLevel());
    }

    @Test
    void sortsByImpactThenDistance() {
        ConceptEntanglementGraph graph = graphs.addAll(graphs.createEmptyGraph("fi-4", null),
                List.of(TestGraphs.concept("root"), TestGraphs.concept("weak"), TestGraphs.concept("strong"), TestGraphs.concept("next")),
                List.of(EdgeSpec.prerequisite("root", "weak", 0.1, 0.2),
                        EdgeSpec.prerequisite("root", "strong", 1.0, 1.0),
                        EdgeSpec.prerequisite("strong", "next", 1.0, 1.0)));
        graph = graphs.assessConcept(graph, "root", 0, 1.0, 1);

        List<String> order = analyzer.analyzeForwardImpact(graph, "root").affectedConcepts().stream()
                .map(AffectedConcept::conceptId)
                .toList();

        assertEquals(List.of("strong", "next", "weak"), order);
    }

    @Test
    void flagsHighImpactKeystoneDependents() {
        ConceptEntanglementGraph graph = graphs.addAll(graphs.createEmptyGraph("fi-5", null),
                List.of(TestGraphs.concept("root"), TestGraphs.concept("hub"),
                        TestGraphs.concept("x"), TestGraphs.concept("y"), TestGraphs.concept("z")),
                List.of(EdgeSpec.prerequisite("root", "hub", 1.0, 1.0),
                        EdgeSpec.prerequisite("hub", "x", 0.8, 0.7),
                        EdgeSpec.prerequisite("hub", "y", 0.8, 0.7),
                        EdgeSpec.prerequisite("hub", "z", 0.8, 0.7)));
        graph = graphs.assessConcept(graph, "root", 20, 1.0, 1);

        ForwardImpactResult result = analyzer.analyzeForwardImpact(graph, "root");

        assertEquals(List.of("hub"), result.criticalPathAffected());
        assertEquals(4, result.totalAtRisk());
    }

    @Test
    void visitsEachDependentOnceAndStopsOnCycles() {
        ConceptEntanglementGraph graph = TestGraphs.chain(graphs, "fi-6", "a", "b", "c");
        graph = graphs.addConceptEdge(graph, EdgeSpec.prerequisite("c", "a", 0.8, 0.7));
        graph = graphs.addConceptEdge(graph, EdgeSpec.prerequisite("a", "c", 0.8, 0.7));

        ForwardImpactResult result = analyzer.analyzeForwardImpact(graph, "a", 10);

        assertEquals(List.of("b", "c"), result.affectedConcepts().stream().map(AffectedConcept::conceptId).sorted().toList());
    }

    @Test
    void respectsDepthLimit() {
        ConceptEntanglementGraph graph = TestGraphs.chain(graphs, "fi-7", "a", "b", "c", "d");
        ForwardImpactResult result = analyzer.analyzeForwardImpact(graph, "a", 2);
        assertEquals(2, result.totalAtRisk());
        assertTrue(result.affectedConcepts().stream().allMatch(c -> c.pathLength() <= 2));
    }
}
