package com.titanic.inference.features;

public record FeatureSchema(FeatureManifest manifest, PreprocessingStats stats, LabelEncodings encodings) {
}
