package com.example.skygate_backend.engine.forensics;

import com.example.skygate_backend.util.ImageRasters;
import com.example.skygate_backend.util.MethodNames;
import com.example.skygate_backend.util.SignalMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Texture smoothness uniformity over a tiling of the luminance plane. Generated images tend toward
 * large regions of unnaturally even smoothness; the score only rises once the share of smooth
 * tiles passes {@link #SMOOTH_FRACTION_THRESHOLD}.
 */
public class TextureSignal extends ForensicSignal {
    private static final Logger LOGGER = LoggerFactory.getLogger(TextureSignal.class);

    static final int TILE = 32;
    /** Tile variance (grey levels squared) below which a tile counts as smooth. */
    static final double SMOOTH_VARIANCE = 25.0;
    static final double SMOOTH_FRACTION_THRESHOLD = 0.35;
    static final double UNIFORMITY_CV_CEILING = 1.5;
    static final double SMOOTHNESS_WEIGHT = 0.7;
    static final double UNIFORMITY_WEIGHT = 0.3;

    @Override
    public String methodName() {
        return MethodNames.TEXTURE;
    }

    @Override
    protected Measurement measure(ImageRasters.DecodedImage decoded) {
        int tilesX = decoded.width() / TILE;
        int tilesY = decoded.height() / TILE;
        if (tilesX * tilesY == 0) {
            return Measurement.notApplicable(String.format(Locale.ROOT,
                    "no applicable texture region: image %dx%d has no full %dx%d tile",
                    decoded.width(), decoded.height(), TILE, TILE));
        }

        ImageRasters.LumaPlane luma = ImageRasters.luminance(decoded.image());
        double[] tileStd = new double[tilesX * tilesY];
        int smooth = 0;
        for (int ty = 0; ty < tilesY; ty++) {
            for (int tx = 0; tx < tilesX; tx++) {
                double variance = tileVariance(luma, tx * TILE, ty * TILE);
                if (variance < SMOOTH_VARIANCE) smooth++;
                tileStd[ty * tilesX + tx] = Math.sqrt(variance);
            }
        }

        double smoothFraction = smooth / (double) tileStd.length;
        double excess = SignalMath.clamp01((smoothFraction - SMOOTH_FRACTION_THRESHOLD) / (1.0 - SMOOTH_FRACTION_THRESHOLD));
        double uniformity = SignalMath.clamp01(1.0 - SignalMath.coefficientOfVariation(tileStd) / UNIFORMITY_CV_CEILING);
        double score = SMOOTHNESS_WEIGHT * excess + UNIFORMITY_WEIGHT * uniformity;
        double gradient = meanGradient(luma);
        LOGGER.debug("TEXTURE smoothFraction={} uniformity={} gradient={}", smoothFraction, uniformity, gradient);

        String analysis = String.format(Locale.ROOT, "%.0f%% of %d tiles smooth, mean gradient %.2f",
                smoothFraction * 100.0, tileStd.length, gradient);
        if (excess > 0.0) {
            analysis += "; unnaturally uniform smoothness";
        }

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("analysis", analysis);
        detail.put("smoothnessScore", SignalMath.round(smoothFraction, 4));
        detail.put("textureUniformity", SignalMath.round(uniformity, 4));
        detail.put("meanTileStdDev", SignalMath.round(SignalMath.mean(tileStd), 4));
        detail.put("gradientMean", SignalMath.round(gradient, 4));
        detail.put("tiles", tileStd.length);
        return Measurement.scored(score, detail);
    }

    private static double tileVariance(ImageRasters.LumaPlane luma, int x0, int y0) {
        double sum = 0, sum2 = 0;
        for (int y = y0; y < y0 + TILE; y++) {
            for (int x = x0; x < x0 + TILE; x++) {
                double v = luma.at(x, y);
                sum += v;
                sum2 += v * v;
            }
        }
        double n = TILE * TILE;
        double mean = sum / n;
        return Math.max(0.0, sum2 / n - mean * mean);
    }

    /** Mean Sobel gradient magnitude over the interior. */
    private static double meanGradient(ImageRasters.LumaPlane luma) {
        double acc = 0;
        long n = 0;
        for (int y = 1; y < luma.height() - 1; y++) {
            for (int x = 1; x < luma.width() - 1; x++) {
                double gx = luma.at(x + 1, y - 1) + 2 * luma.at(x + 1, y) + luma.at(x + 1, y + 1)
                        - luma.at(x - 1, y - 1) - 2 * luma.at(x - 1, y) - luma.at(x - 1, y + 1);
                double gy = luma.at(x - 1, y + 1) + 2 * luma.at(x, y + 1) + luma.at(x + 1, y + 1)
                        - luma.at(x - 1, y - 1) - 2 * luma.at(x, y - 1) - luma.at(x + 1, y - 1);
                acc += Math.sqrt(gx * gx + gy * gy);
                n++;
            }
        }
        return n == 0 ? 0.0 : acc / n;
    }
}
