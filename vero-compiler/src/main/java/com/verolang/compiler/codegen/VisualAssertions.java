package com.verolang.compiler.codegen;

import com.verolang.compiler.ast.VisualPreset;
import com.verolang.compiler.ast.stmt.ScreenshotSettings;

/**
 * 视觉断言参数：预设提供默认值，显式数值覆盖预设
 */
final class VisualAssertions {

    private VisualAssertions() {
    }

    static double presetThreshold(VisualPreset preset) {
        switch (preset) {
            case STRICT: return 0.1;
            case RELAXED: return 0.3;
            default: return 0.2;
        }
    }

    static int presetMaxDiffPixels(VisualPreset preset) {
        switch (preset) {
            case STRICT: return 0;
            case RELAXED: return 200;
            default: return 50;
        }
    }

    static double presetMaxDiffPixelRatio(VisualPreset preset) {
        switch (preset) {
            case STRICT: return 0;
            case RELAXED: return 0.05;
            default: return 0.01;
        }
    }

    /**
     * 基线截图文件名，统一为 .png 后缀
     */
    static String fileName(String name) {
        return name.toLowerCase().endsWith(".png") ? name : name + ".png";
    }

    /**
     * toHaveScreenshot 的参数列表（不含括号），无参数时返回空串
     */
    static String arguments(String name, ScreenshotSettings settings) {
        StringBuilder sb = new StringBuilder();
        if (name != null) {
            sb.append(TsSyntax.quote(fileName(name)));
        }
        String options = options(settings);
        if (options != null) {
            if (sb.length() > 0) sb.append(", ");
            sb.append(options);
        }
        return sb.toString();
    }

    static String options(ScreenshotSettings settings) {
        if (settings == null || settings.isEmpty()) {
            return null;
        }
        VisualPreset preset = settings.getPreset();
        Double threshold = settings.getThreshold();
        Integer maxDiffPixels = settings.getMaxDiffPixels();
        Double maxDiffRatio = settings.getMaxDiffPixelRatio();
        if (preset != null) {
            if (threshold == null) threshold = presetThreshold(preset);
            if (maxDiffPixels == null) maxDiffPixels = presetMaxDiffPixels(preset);
            if (maxDiffRatio == null) maxDiffRatio = presetMaxDiffPixelRatio(preset);
        }
        StringBuilder sb = new StringBuilder("{ ");
        boolean first = true;
        if (threshold != null) {
            sb.append("threshold: ").append(TsSyntax.number(threshold));
            first = false;
        }
        if (maxDiffPixels != null) {
            if (!first) sb.append(", ");
            sb.append("maxDiffPixels: ").append(maxDiffPixels);
            first = false;
        }
        if (maxDiffRatio != null) {
            if (!first) sb.append(", ");
            sb.append("maxDiffPixelRatio: ").append(TsSyntax.number(maxDiffRatio));
        }
        return sb.append(" }").toString();
    }
}
