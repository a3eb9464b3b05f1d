package com.example.skygate_backend.engine.forensics;

import com.example.skygate_backend.engine.AnalyzerException;
import com.example.skygate_backend.util.ImageRasters;
import com.example.skygate_backend.util.MethodNames;
import com.example.skygate_backend.util.SignalMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Error Level Analysis. Re-encodes the image as JPEG at a fixed quality and measures how the
 * re-compression error is distributed over blocks; genuine photos show uneven error, generated
 * content tends toward uniform or near-zero error. Only applies to JPEG sources.
 */
public class ErrorLevelSignal extends ForensicSignal {
    private static final Logger LOGGER = LoggerFactory.getLogger(ErrorLevelSignal.class);

    static final float QUALITY = 0.90f;
    static final int BLOCK = 16;
    static final int MIN_BLOCKS = 4;
    /** Mean block error (grey levels) above which error is considered clearly present. */
    static final double ERROR_CEILING = 3.0;
    static final double UNIFORMITY_CV_CEILING = 0.8;

    @Override
    public String methodName() {
        return MethodNames.ELA;
    }

    @Override
    protected Measurement measure(ImageRasters.DecodedImage decoded) throws AnalyzerException {
        if (!"jpeg".equals(decoded.formatName())) {
            return Measurement.notApplicable("source is " + decoded.formatName()
                    + ", no lossy compression history to compare against");
        }
        int blocksX = decoded.width() / BLOCK;
        int blocksY = decoded.height() / BLOCK;
        if (blocksX * blocksY < MIN_BLOCKS) {
            return Measurement.notApplicable("image too small for error-level blocks");
        }

        BufferedImage original = ImageRasters.toRgb(decoded.image());
        BufferedImage recompressed = recompress(original);

        double[] blockError = new double[blocksX * blocksY];
        for (int by = 0; by < blocksY; by++) {
            for (int bx = 0; bx < blocksX; bx++) {
                double acc = 0;
                for (int y = by * BLOCK; y < (by + 1) * BLOCK; y++) {
                    for (int x = bx * BLOCK; x < (bx + 1) * BLOCK; x++) {
                        acc += pixelError(original.getRGB(x, y), recompressed.getRGB(x, y));
                    }
                }
                blockError[by * blocksX + bx] = acc / (BLOCK * BLOCK);
            }
        }

        double meanError = SignalMath.mean(blockError);
        double variation = SignalMath.coefficientOfVariation(blockError);
        double uniformity = SignalMath.clamp01(1.0 - variation / UNIFORMITY_CV_CEILING);
        double absence = SignalMath.clamp01(1.0 - meanError / ERROR_CEILING);
        double score = 0.5 * uniformity + 0.5 * absence;
        LOGGER.debug("ELA meanError={} variation={} blocks={}", meanError, variation, blockError.length);

        String analysis = String.format(Locale.ROOT, "re-compression error %.2f grey levels, block variation %.2f", meanError, variation);
        if (absence >= 0.5) {
            analysis += "; error structure nearly absent";
        } else if (uniformity >= 0.5) {
            analysis += "; error unnaturally uniform across regions";
        }

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("analysis", analysis);
        detail.put("quality", (double) QUALITY);
        detail.put("errorLevelScore", SignalMath.round(meanError, 4));
        detail.put("maxBlockError", SignalMath.round(SignalMath.max(blockError), 4));
        detail.put("blockVariation", SignalMath.round(variation, 4));
        detail.put("blocks", blockError.length);
        return Measurement.scored(score, detail);
    }

    private static double pixelError(int a, int b) {
        int dr = Math.abs(((a >> 16) & 0xFF) - ((b >> 16) & 0xFF));
        int dg = Math.abs(((a >> 8) & 0xFF) - ((b >> 8) & 0xFF));
        int db = Math.abs((a & 0xFF) - (b & 0xFF));
        return Math.max(dr, Math.max(dg, db));
    }

    static BufferedImage recompress(BufferedImage rgb) throws AnalyzerException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new AnalyzerException("no JPEG encoder available");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(QUALITY);
            writer.setOutput(ios);
            writer.write(null, new IIOImage(rgb, null, null), param);
        } catch (IOException e) {
            throw new AnalyzerException("JPEG re-encoding failed: " + e.getMessage(), e);
        } finally {
            writer.dispose();
        }
        try {
            BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(out.toByteArray()));
            if (decoded == null) {
                throw new AnalyzerException("re-encoded JPEG could not be decoded");
            }
            return decoded;
        } catch (IOException e) {
            throw new AnalyzerException("re-encoded JPEG could not be decoded: " + e.getMessage(), e);
        }
    }
}
