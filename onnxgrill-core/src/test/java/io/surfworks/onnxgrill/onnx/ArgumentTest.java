package io.surfworks.onnxgrill.onnx;

import io.surfworks.onnxgrill.api.TensorKind;
import io.surfworks.onnxgrill.graph.GraphNode.ConstantValue;
import io.surfworks.onnxgrill.graph.ScalarKind;
import io.surfworks.onnxgrill.graph.ScalarType;
import io.surfworks.onnxgrill.graph.TensorType;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArgumentTest {

    @Nested
    class ToTensorTypeTests {

        @Test
        void testTensorArgumentBecomesFloatTensor() {
            Argument arg = Argument.tensor("x", 3, ElementType.INT64);

            assertEquals(TensorType.ofFloat("x", 3), arg.toTensorType());
        }

        @Test
        void testScalarArgumentIsRejected() {
            Argument arg = Argument.scalar("s", ElementType.FLOAT32);

            OnnxImportException e = assertThrows(OnnxImportException.class, arg::toTensorType);
            assertTrue(e.getMessage().contains("Can't transform scalar argument 's'"), e.getMessage());
        }

        @Test
        void testShapeArgumentIsRejected() {
            Argument arg = new Argument("shape", new ArgType.ShapeArg(4));

            assertThrows(OnnxImportException.class, arg::toTensorType);
        }
    }

    @Nested
    class ToTypeTests {

        @Test
        void testRankZeroKeepsDeclaredKind() {
            assertEquals(new ScalarType("n", ScalarKind.INT64), Argument.tensor("n", 0, ElementType.INT64).toType());
            assertEquals(new ScalarType("f", ScalarKind.FLOAT32), Argument.tensor("f", 0, ElementType.FLOAT32).toType());
        }

        @Test
        void testScalarMapsKind() {
            assertEquals(new ScalarType("b", ScalarKind.BOOL), Argument.scalar("b", ElementType.BOOL).toType());
        }

        @Test
        void testTensorRankOneOrMore() {
            assertEquals(TensorType.ofFloat("t", 1), Argument.tensor("t", 1, ElementType.FLOAT64).toType());
        }

        @Test
        void testShapeIsFatal() {
            assertThrows(OnnxImportException.class, () -> new Argument("s", new ArgType.ShapeArg(1)).toType());
        }

        @Test
        void testStringScalarIsFatal() {
            OnnxImportException e = assertThrows(OnnxImportException.class,
                () -> Argument.scalar("s", ElementType.STRING).toType());
            assertEquals("String scalar unsupported", e.getMessage());
        }
    }

    @Test
    void testElementKindMappings() {
        assertEquals(TensorKind.FLOAT, ElementType.FLOAT64.toTensorKind());
        assertEquals(TensorKind.INT, ElementType.INT32.toTensorKind());
        assertEquals(TensorKind.BOOL, ElementType.BOOL.toTensorKind());
        assertThrows(OnnxImportException.class, ElementType.FLOAT16::toTensorKind);
        assertThrows(OnnxImportException.class, ElementType.FLOAT16::toScalarKind);
        assertThrows(OnnxImportException.class, ElementType.STRING::toTensorKind);
    }

    @Test
    void testZeroRankConstants() {
        Tensor bool = new Tensor(0, ElementType.BOOL, new long[0], new TensorData.BoolData(new boolean[]{true}));
        Tensor int32 = new Tensor(0, ElementType.INT32, new long[0], new TensorData.Int32Data(new int[]{7}));
        Tensor string = new Tensor(0, ElementType.STRING, new long[0], new TensorData.StringData(new String[]{"x"}));
        Tensor empty = new Tensor(0, ElementType.FLOAT32, new long[0], null);

        assertEquals(new ConstantValue.Bool(true), ZeroRankScalars.scalarConstant(bool));
        assertEquals(new ConstantValue.Int32(7), ZeroRankScalars.scalarConstant(int32));
        OnnxImportException e = assertThrows(OnnxImportException.class, () -> ZeroRankScalars.scalarConstant(string));
        assertEquals("Unsupported zero dim constant tensor type: STRING", e.getMessage());
        assertThrows(OnnxImportException.class, () -> ZeroRankScalars.scalarConstant(empty));
    }
}
