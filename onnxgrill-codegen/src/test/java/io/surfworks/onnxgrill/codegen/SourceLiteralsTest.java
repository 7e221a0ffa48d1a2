package io.surfworks.onnxgrill.codegen;

import io.surfworks.onnxgrill.api.ModelMetadata;
import io.surfworks.onnxgrill.api.TensorKind;
import io.surfworks.onnxgrill.api.config.Conv2dConfig;
import io.surfworks.onnxgrill.api.config.MaxPool2dConfig;
import io.surfworks.onnxgrill.api.config.PaddingConfig2d;
import io.surfworks.onnxgrill.graph.GraphNode.ConstantValue;
import io.surfworks.onnxgrill.graph.ScalarKind;
import io.surfworks.onnxgrill.graph.ScalarType;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SourceLiteralsTest {

    @Nested
    class RenderingTests {

        @Test
        void testPrimitives() {
            assertEquals("3", SourceLiterals.toSource(3));
            assertEquals("3L", SourceLiterals.toSource(3L));
            assertEquals("3.14", SourceLiterals.toSource(3.14));
            assertEquals("3.14f", SourceLiterals.toSource(3.14f));
            assertEquals("true", SourceLiterals.toSource(true));
            assertEquals("null", SourceLiterals.toSource(null));
        }

        @Test
        void testSpecialFloatingPoint() {
            assertEquals("Double.NaN", SourceLiterals.toSource(Double.NaN));
            assertEquals("Double.NEGATIVE_INFINITY", SourceLiterals.toSource(Double.NEGATIVE_INFINITY));
            assertEquals("Float.POSITIVE_INFINITY", SourceLiterals.toSource(Float.POSITIVE_INFINITY));
        }

        @Test
        void testNestedArray() {
            assertEquals("new int[][] {new int[] {1, 2}, new int[] {}}",
                SourceLiterals.toSource(new int[][]{{1, 2}, {}}));
        }

        @Test
        void testPaddingVariants() {
            assertEquals("new PaddingConfig2d.Same()", SourceLiterals.toSource(new PaddingConfig2d.Same()));
            assertEquals("new PaddingConfig2d.Explicit(1, 2)", SourceLiterals.toSource(new PaddingConfig2d.Explicit(1, 2)));
        }

        @Test
        void testEnumIsQualified() {
            assertEquals("TensorKind.FLOAT", SourceLiterals.toSource(TensorKind.FLOAT));
        }

        @Test
        void testStringEscapes() {
            assertEquals("\"a\\\"b\\\\c\\n\"", SourceLiterals.toSource("a\"b\\c\n"));
        }

        @Test
        void testUnsupportedValue() {
            assertThrows(IllegalArgumentException.class, () -> SourceLiterals.toSource(new Object()));
        }
    }

    @Nested
    class RoundTripTests {

        private void assertRoundTrip(Object value) {
            Object compiled = InMemoryCompiler.evaluate(SourceLiterals.toSource(value));
            assertEquals(value, compiled, SourceLiterals.toSource(value));
        }

        @Test
        void testScalars() {
            assertRoundTrip(42);
            assertRoundTrip(Integer.MIN_VALUE);
            assertRoundTrip(Long.MIN_VALUE);
            assertRoundTrip(-0.0);
            assertRoundTrip(1e-300);
            assertRoundTrip(0.1f);
            assertRoundTrip(Float.MIN_VALUE);
            assertRoundTrip(Double.NaN);
            assertRoundTrip("tab\there é \\u0041");
        }

        @Test
        void testDeepArrays() {
            long[][][] value = {{{1L, -2L}, {}}, {{Long.MAX_VALUE}}};

            Object compiled = InMemoryCompiler.evaluate(SourceLiterals.toSource(value));

            assertTrue(compiled instanceof long[][][]);
            assertArrayEquals(value, (long[][][]) compiled);
        }

        @Test
        void testDoubleArray() {
            double[] value = {1.5, Double.POSITIVE_INFINITY, -3.25e10};

            assertArrayEquals(value, (double[]) InMemoryCompiler.evaluate(SourceLiterals.toSource(value)));
        }

        @Test
        void testLists() {
            assertRoundTrip(List.of(1, 2, 3));
            assertRoundTrip(List.of(List.of("a"), List.of()));
        }

        @Test
        void testConfigurationRecords() {
            assertRoundTrip(new PaddingConfig2d.Valid());
            assertRoundTrip(new PaddingConfig2d.Explicit(3, 0));
            assertRoundTrip(new Conv2dConfig(new int[]{3, 8}, new int[]{3, 3}, new int[]{1, 1}, new int[]{2, 2},
                1, new PaddingConfig2d.Explicit(1, 1), true));
            assertRoundTrip(new MaxPool2dConfig(new int[]{2, 2}, new int[]{2, 2}, new PaddingConfig2d.Same()));
            assertRoundTrip(new ModelMetadata("mnist", "models/mnist.json", "ab12", "0.1.0"));
        }

        @Test
        void testNestedRecordsAndEnums() {
            assertRoundTrip(new ConstantValue.Float32(1.5f));
            assertRoundTrip(new ScalarType("x", ScalarKind.INT64));
            assertRoundTrip(List.of(ScalarKind.BOOL, ScalarKind.FLOAT64));
        }
    }
}
