package io.surfworks.onnxgrill.api;

/**
 * Provenance of a generated model.
 *
 * <p>No timestamp is recorded: generating the same input twice must produce
 * byte-identical sources.
 *
 * @param name             The model name (the input file's base name)
 * @param source           The input path the model was generated from
 * @param sourceHash       SHA-256 of the input file, hex encoded
 * @param generatorVersion Version of the code generator that produced this model
 */
public record ModelMetadata(
    String name,
    String source,
    String sourceHash,
    String generatorVersion
) {}
