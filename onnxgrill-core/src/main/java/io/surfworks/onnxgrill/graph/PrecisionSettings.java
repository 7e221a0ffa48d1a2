package io.surfworks.onnxgrill.graph;

/**
 * Run-wide choice of concrete element kinds for serialized float and
 * integer payloads.
 */
public enum PrecisionSettings {
    FULL(ScalarKind.FLOAT32, ScalarKind.INT32),
    DOUBLE(ScalarKind.FLOAT64, ScalarKind.INT64);

    private final ScalarKind floatKind;
    private final ScalarKind intKind;

    PrecisionSettings(ScalarKind floatKind, ScalarKind intKind) {
        this.floatKind = floatKind;
        this.intKind = intKind;
    }

    public ScalarKind floatKind() {
        return floatKind;
    }

    public ScalarKind intKind() {
        return intKind;
    }
}
