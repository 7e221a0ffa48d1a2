package io.surfworks.onnxgrill.api.config;

import java.util.Arrays;
import java.util.Objects;

/**
 * 2-D convolution configuration.
 *
 * @param channels   {@code [in, out]} channel counts
 * @param kernelSize {@code [height, width]}
 * @param stride     {@code [height, width]}
 * @param dilation   {@code [height, width]}
 * @param groups     number of channel groups
 * @param padding    padding mode
 * @param bias       whether the layer adds a bias
 */
public record Conv2dConfig(
    int[] channels,
    int[] kernelSize,
    int[] stride,
    int[] dilation,
    int groups,
    PaddingConfig2d padding,
    boolean bias
) {

    public Conv2dConfig {
        requirePair(channels, "channels");
        requirePair(kernelSize, "kernelSize");
        requirePair(stride, "stride");
        requirePair(dilation, "dilation");
        Objects.requireNonNull(padding, "padding");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Conv2dConfig that)) return false;
        return Arrays.equals(channels, that.channels)
            && Arrays.equals(kernelSize, that.kernelSize)
            && Arrays.equals(stride, that.stride)
            && Arrays.equals(dilation, that.dilation)
            && groups == that.groups
            && padding.equals(that.padding)
            && bias == that.bias;
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(groups, padding, bias);
        result = 31 * result + Arrays.hashCode(channels);
        result = 31 * result + Arrays.hashCode(kernelSize);
        result = 31 * result + Arrays.hashCode(stride);
        result = 31 * result + Arrays.hashCode(dilation);
        return result;
    }

    @Override
    public String toString() {
        return "Conv2dConfig[channels=" + Arrays.toString(channels)
            + ", kernelSize=" + Arrays.toString(kernelSize)
            + ", stride=" + Arrays.toString(stride)
            + ", dilation=" + Arrays.toString(dilation)
            + ", groups=" + groups
            + ", padding=" + padding
            + ", bias=" + bias + "]";
    }

    static void requirePair(int[] values, String what) {
        if (values == null || values.length != 2) {
            throw new IllegalArgumentException(what + " must have exactly 2 entries");
        }
    }
}
