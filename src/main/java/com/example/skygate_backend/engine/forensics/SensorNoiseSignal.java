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
 * Sensor-pattern-noise (PRNU) consistency. The noise residual is the luminance minus its 3x3 box
 * blur; camera captures carry a residual of stable strength in every region, generated images tend
 * to lack it or carry it unevenly.
 */
public class SensorNoiseSignal extends ForensicSignal {
    private static final Logger LOGGER = LoggerFactory.getLogger(SensorNoiseSignal.class);

    static final int BLOCK = 64;
    /** Mean absolute residual (grey levels) at which the sensor pattern counts as fully present. */
    static final double STRONG_RESIDUAL = 2.0;
    static final double CV_CEILING = 1.0;
    static final double ABSENCE_WEIGHT = 0.6;
    static final double INCONSISTENCY_WEIGHT = 0.4;

    @Override
    public String methodName() {
        return MethodNames.PRNU;
    }

    @Override
    protected Measurement measure(ImageRasters.DecodedImage decoded) {
        int blocksX = decoded.width() / BLOCK;
        int blocksY = decoded.height() / BLOCK;
        if (blocksX < 2 || blocksY < 2) {
            return Measurement.notApplicable(String.format(Locale.ROOT,
                    "image %dx%d is smaller than %dx%d px, too small for sensor-noise estimation",
                    decoded.width(), decoded.height(), 2 * BLOCK, 2 * BLOCK));
        }

        ImageRasters.LumaPlane luma = ImageRasters.luminance(decoded.image());
        double[] energy = new double[blocksX * blocksY];
        for (int by = 0; by < blocksY; by++) {
            for (int bx = 0; bx < blocksX; bx++) {
                energy[by * blocksX + bx] = blockResidual(luma, bx * BLOCK, by * BLOCK);
            }
        }

        double strength = SignalMath.mean(energy);
        double variation = SignalMath.coefficientOfVariation(energy);
        double absence = SignalMath.clamp01(1.0 - strength / STRONG_RESIDUAL);
        double inconsistency = SignalMath.clamp01(variation / CV_CEILING);
        double score = ABSENCE_WEIGHT * absence + INCONSISTENCY_WEIGHT * inconsistency;
        LOGGER.debug("PRNU strength={} variation={} blocks={}", strength, variation, energy.length);

        String analysis = String.format(Locale.ROOT, "noise residual %.2f grey levels across %d blocks, block variation %.2f",
                strength, energy.length, variation);
        if (absence >= 0.5) {
            analysis += "; sensor noise pattern weak or absent";
        } else if (inconsistency >= 0.5) {
            analysis += "; sensor noise pattern inconsistent between regions";
        }

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("analysis", analysis);
        detail.put("residualStrength", SignalMath.round(strength, 4));
        detail.put("blockVariation", SignalMath.round(variation, 4));
        detail.put("blocks", energy.length);
        detail.put("patternScore", SignalMath.round(1.0 - absence, 4));
        return Measurement.scored(score, detail);
    }

    /** Mean absolute 3x3 box-filter residual over one block, skipping the image border. */
    private static double blockResidual(ImageRasters.LumaPlane luma, int x0, int y0) {
        double acc = 0;
        int n = 0;
        for (int y = Math.max(1, y0); y < Math.min(luma.height() - 1, y0 + BLOCK); y++) {
            for (int x = Math.max(1, x0); x < Math.min(luma.width() - 1, x0 + BLOCK); x++) {
                double box = 0;
                for (int j = -1; j <= 1; j++)
                    for (int i = -1; i <= 1; i++)
                        box += luma.at(x + i, y + j);
                acc += Math.abs(luma.at(x, y) - box / 9.0);
                n++;
            }
        }
        return n == 0 ? 0.0 : acc / n;
    }
}
