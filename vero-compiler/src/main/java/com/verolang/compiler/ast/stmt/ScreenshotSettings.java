package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.VisualPreset;

/**
 * 视觉断言的比较参数；未书写的数值为 null
 */
public final class ScreenshotSettings {
    public static final ScreenshotSettings NONE = new ScreenshotSettings(null, null, null, null);

    private final VisualPreset preset;
    private final Double threshold;
    private final Integer maxDiffPixels;
    private final Double maxDiffPixelRatio;

    public ScreenshotSettings(VisualPreset preset, Double threshold, Integer maxDiffPixels, Double maxDiffPixelRatio) {
        this.preset = preset;
        this.threshold = threshold;
        this.maxDiffPixels = maxDiffPixels;
        this.maxDiffPixelRatio = maxDiffPixelRatio;
    }

    public VisualPreset getPreset() { return preset; }
    public Double getThreshold() { return threshold; }
    public Integer getMaxDiffPixels() { return maxDiffPixels; }
    public Double getMaxDiffPixelRatio() { return maxDiffPixelRatio; }

    public boolean isEmpty() {
        return preset == null && threshold == null && maxDiffPixels == null && maxDiffPixelRatio == null;
    }
}
