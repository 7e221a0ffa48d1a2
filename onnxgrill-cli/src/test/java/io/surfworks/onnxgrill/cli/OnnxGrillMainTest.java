package io.surfworks.onnxgrill.cli;

import io.surfworks.onnxgrill.onnx.Argument;
import io.surfworks.onnxgrill.onnx.ElementType;
import io.surfworks.onnxgrill.onnx.GraphJson;
import io.surfworks.onnxgrill.onnx.Node;
import io.surfworks.onnxgrill.onnx.NodeType;
import io.surfworks.onnxgrill.onnx.OnnxGraph;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OnnxGrillMainTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();

    private int run(String... args) {
        return OnnxGrillMain.run(args,
            new PrintStream(stdout, true, StandardCharsets.UTF_8),
            new PrintStream(stderr, true, StandardCharsets.UTF_8));
    }

    private Path writeGraph(String fileName, NodeType type) throws IOException {
        Argument x = Argument.tensor("x", 2, ElementType.FLOAT32);
        Argument y = Argument.tensor("y", 2, ElementType.FLOAT32);
        OnnxGraph graph = new OnnxGraph(
            List.of(new Node("act1", type, List.of(x), List.of(y), Map.of(), List.of())),
            List.of(x), List.of(y));
        Path file = tempDir.resolve(fileName);
        Files.writeString(file, GraphJson.write(graph));
        return file;
    }

    @Test
    void testNoArgumentsPrintsUsage() {
        assertEquals(0, run());
        assertTrue(stdout.toString(StandardCharsets.UTF_8).contains("Usage: onnxgrill"));
    }

    @Test
    void testHelp() {
        assertEquals(0, run("--help"));
        assertTrue(stdout.toString(StandardCharsets.UTF_8).contains("--out-dir DIR"));
    }

    @Test
    void testGeneratesIntoOutDir() throws Exception {
        Path input = writeGraph("act.json", NodeType.RELU);
        Path out = tempDir.resolve("out");

        assertEquals(0, run("--out-dir", out.toString(), "--package", "demo", input.toString()));

        assertTrue(stdout.toString(StandardCharsets.UTF_8).contains("Generated " + out.resolve("act.java")));
        assertTrue(Files.readString(out.resolve("act.java")).contains("package demo;"));
        assertTrue(Files.exists(out.resolve("act.safetensors")));
    }

    @Test
    void testDevelopmentMode() throws Exception {
        Path input = writeGraph("act.json", NodeType.SIGMOID);
        Path out = tempDir.resolve("out");

        assertEquals(0, run("--dev", "--out-dir", out.toString(), input.toString()));

        assertTrue(Files.exists(out.resolve("act.graph.txt")));
        assertTrue(Files.exists(out.resolve("act.json")));
    }

    @Test
    void testUnsupportedOperatorReportsError() throws Exception {
        Path input = writeGraph("act.json", NodeType.TANH);

        assertEquals(1, run("--out-dir", tempDir.resolve("out").toString(), input.toString()));

        String error = stderr.toString(StandardCharsets.UTF_8);
        assertTrue(error.startsWith("Error: Unsupported node conversion"), error);
    }

    @Test
    void testLayerNamedLikeGeneratedMemberReportsError() throws Exception {
        Argument x = Argument.tensor("x", 2, ElementType.FLOAT32);
        Argument y = Argument.tensor("y", 2, ElementType.FLOAT32);
        OnnxGraph graph = new OnnxGraph(
            List.of(new Node("backend", NodeType.DROPOUT, List.of(x), List.of(y), Map.of(), List.of())),
            List.of(x), List.of(y));
        Path input = tempDir.resolve("drop.json");
        Files.writeString(input, GraphJson.write(graph));

        assertEquals(1, run("--out-dir", tempDir.resolve("out").toString(), input.toString()));

        String error = stderr.toString(StandardCharsets.UTF_8);
        assertTrue(error.startsWith("Error: Field name 'backend'"), error);
    }

    @Test
    void testMissingOptionValue() {
        assertEquals(1, run("model.json", "--out-dir"));
        assertTrue(stderr.toString(StandardCharsets.UTF_8).contains("--out-dir requires a value"));
    }

    @Test
    void testUnknownOption() {
        assertEquals(1, run("--verbose", "model.json"));
        assertTrue(stderr.toString(StandardCharsets.UTF_8).contains("Unknown option: --verbose"));
    }

    @Test
    void testNoInputs() {
        assertEquals(1, run("--dev"));
        assertTrue(stderr.toString(StandardCharsets.UTF_8).contains("no input files"));
    }

    @Test
    void testInvalidPackage() throws Exception {
        Path input = writeGraph("act.json", NodeType.RELU);

        assertEquals(1, run("--package", "1bad", input.toString()));
        assertTrue(stderr.toString(StandardCharsets.UTF_8).contains("Invalid package name"));
    }
}
