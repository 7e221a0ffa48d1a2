package io.surfworks.onnxgrill.api.config;

import java.util.Arrays;
import java.util.Objects;

/**
 * 2-D max pooling configuration.
 *
 * @param kernelSize {@code [height, width]}
 * @param strides    {@code [height, width]}
 * @param padding    padding mode
 */
public record MaxPool2dConfig(int[] kernelSize, int[] strides, PaddingConfig2d padding) {

    public MaxPool2dConfig {
        Conv2dConfig.requirePair(kernelSize, "kernelSize");
        Conv2dConfig.requirePair(strides, "strides");
        Objects.requireNonNull(padding, "padding");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MaxPool2dConfig that)) return false;
        return Arrays.equals(kernelSize, that.kernelSize)
            && Arrays.equals(strides, that.strides)
            && padding.equals(that.padding);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Arrays.hashCode(kernelSize) + Arrays.hashCode(strides)) + padding.hashCode();
    }

    @Override
    public String toString() {
        return "MaxPool2dConfig[kernelSize=" + Arrays.toString(kernelSize)
            + ", strides=" + Arrays.toString(strides)
            + ", padding=" + padding + "]";
    }
}
