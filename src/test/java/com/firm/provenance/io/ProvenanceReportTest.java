package com.firm.provenance.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.firm.provenance.api.DerivationNode;
import com.firm.provenance.engine.ProvenanceTree;
import com.firm.provenance.registry.DerivationRegistry;
import com.firm.provenance.testing.SampleDerivations;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.Assert.*;

public class ProvenanceReportTest {
    private final ObjectMapper mapper = new ObjectMapper();

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private static ProvenanceTree fineStructure() {
        return new DerivationRegistry().register("fine structure constant", SampleDerivations.fineStructure());
    }

    @Test
    public void testMetrics() {
        ProvenanceTree tree = fineStructure();
        ProvenanceReport report = ProvenanceReport.of(tree);

        assertEquals("fine structure constant", report.getTargetResult());
        assertEquals("alpha_inv", report.getTargetId());
        assertEquals(6, report.getNodeCount());
        assertEquals(List.of("AG1", "AG2"), report.getAxiomRoots());
        assertEquals(Map.of("axiom", 2, "fixed_point", 1, "recursion", 1, "lemma", 1, "target", 1),
                report.getKindCounts());
        assertEquals(4, report.getMaxDepth());
        assertEquals(1.0, report.getAverageBranchingFactor(), 1e-12);
        assertTrue(report.isTargetPure());
        assertEquals(Set.of(), report.getTargetContaminationSources());
        assertEquals(List.of(), report.getContaminatedNodes());
        assertEquals(tree.seal(), report.getSeal());
        assertEquals(tree.topologicalOrder().size(), report.getSteps().size());
        assertEquals("AG1", report.getSteps().get(0).getId());
        assertEquals("alpha_inv", report.getSteps().get(5).getId());
    }

    @Test
    public void testContaminatedReport() {
        ProvenanceTree tree = new DerivationRegistry().register("z_eq",
                SampleDerivations.chain(SampleDerivations.contaminatedChain()));
        ProvenanceReport report = ProvenanceReport.of(tree);

        assertFalse(report.isTargetPure());
        assertEquals(Set.of("measured_Om"), report.getTargetContaminationSources());
        assertEquals(List.of("C"), report.getContaminatedNodes());
        assertEquals(4, report.getMaxDepth());
        assertEquals(0.75, report.getAverageBranchingFactor(), 1e-12);
    }

    @Test
    public void testJsonLayout() throws Exception {
        ProvenanceTree tree = new DerivationRegistry().register("z_eq",
                SampleDerivations.chain(SampleDerivations.contaminatedChain()));
        String json = new ProvenanceReportWriter(false).toJson(ProvenanceReport.of(tree));
        JsonNode root = mapper.readTree(json);

        assertTrue(json.startsWith("{\"targetResult\":\"z_eq\",\"targetId\":\"D\""));
        assertEquals(4, root.get("nodeCount").asInt());
        assertFalse(root.get("targetPure").asBoolean());
        assertEquals("measured_Om", root.get("targetContaminationSources").get(0).asText());
        assertEquals(64, root.get("seal").asText().length());

        JsonNode steps = root.get("steps");
        assertEquals(4, steps.size());
        JsonNode axiom = steps.get(0);
        assertEquals("A", axiom.get("id").asText());
        assertEquals("axiom", axiom.get("kind").asText());
        assertFalse("empty lists are omitted", axiom.has("dependencies"));
        assertFalse(axiom.has("numericValue"));
        assertEquals(16, axiom.get("fingerprint").asText().length());

        JsonNode b = steps.get(1);
        assertEquals(1.618033988749895, b.get("numericValue").asDouble(), 0.0);
        assertEquals("A", b.get("dependencies").get(0).asText());
        assertEquals("measured_Om", steps.get(2).get("empiricalInputs").get(0).asText());
    }

    @Test
    public void testWriteToCreatesDirectories() throws Exception {
        Path file = tmp.getRoot().toPath().resolve("reports/nested/alpha.json");
        new ProvenanceReportWriter().writeTo(ProvenanceReport.of(fineStructure()), file);

        assertTrue(Files.exists(file));
        JsonNode root = mapper.readTree(file.toFile());
        assertEquals("alpha_inv", root.get("targetId").asText());
        assertEquals(6, root.get("steps").size());
    }

    @Test
    public void testAxiomFoundationAndErrors() throws Exception {
        ProvenanceTree tree = fineStructure();
        ProvenanceReport report = ProvenanceReport.of(tree);

        assertEquals(Map.of("AG1", "Totality axiom", "AG2", "Grace operator axiom"), report.getAxiomStatements());
        assertTrue(report.isCompleteProvenance());
        assertEquals(tree.errorPropagation(), report.getErrorPropagation());

        JsonNode root = mapper.readTree(new ProvenanceReportWriter(false).toJson(report));
        assertEquals("Totality axiom", root.get("axiomStatements").get("AG1").asText());
        assertTrue(root.get("completeProvenance").asBoolean());
        JsonNode alpha = root.get("errorPropagation").get("alpha_inv");
        assertTrue(alpha.has("relativeError"));
        assertTrue(alpha.has("absoluteError"));
    }

    @Test
    public void testRecordedFingerprintsDetectEdits() {
        ProvenanceReport stored = ProvenanceReport.of(fineStructure());
        assertEquals(6, stored.recordedFingerprints().size());
        assertEquals(List.of(), fineStructure().tamperedNodes(stored.recordedFingerprints()));

        List<DerivationNode> nodes = new ArrayList<>(fineStructure().nodes().values());
        nodes.replaceAll(n -> n.id().equals("phi") ? n.toBuilder().expression("φ ≈ 1.618").build() : n);
        ProvenanceTree edited = new DerivationRegistry().register("edited", SampleDerivations.chain(nodes));
        assertEquals(List.of("phi"), edited.tamperedNodes(stored.recordedFingerprints()));
    }
}
