package io.surfworks.onnxgrill.api.config;

/**
 * Padding applied by 2-D convolution and pooling layers.
 */
public sealed interface PaddingConfig2d permits PaddingConfig2d.Same, PaddingConfig2d.Valid, PaddingConfig2d.Explicit {

    /**
     * Pad so the output keeps the input's spatial size.
     */
    record Same() implements PaddingConfig2d {}

    /**
     * No padding.
     */
    record Valid() implements PaddingConfig2d {}

    /**
     * Symmetric explicit padding along height and width.
     */
    record Explicit(int height, int width) implements PaddingConfig2d {
        public Explicit {
            if (height < 0 || width < 0) {
                throw new IllegalArgumentException("Padding must be non-negative: " + height + ", " + width);
            }
        }
    }
}
