package com.example.skygate_backend.util;

import com.example.skygate_backend.dto.AnalysisInput;
import com.example.skygate_backend.engine.AnalyzerException;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.Graphics;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.Locale;

/**
 * Decoding and luminance helpers shared by the pixel signals and the model preprocessors.
 */
public final class ImageRasters {

    private ImageRasters() {
    }

    /** Decoded raster plus the container format the reader recognised (lower case, e.g. "jpeg", "png"). */
    public record DecodedImage(BufferedImage image, String formatName) {
        public int width() {
            return image.getWidth();
        }

        public int height() {
            return image.getHeight();
        }
    }

    /** Row-major luminance plane in grey levels [0,255]. */
    public record LumaPlane(int width, int height, float[] values) {
        public float at(int x, int y) {
            return values[y * width + x];
        }
    }

    public static DecodedImage decode(AnalysisInput.ContentSource source) throws AnalyzerException {
        try (InputStream in = source.open();
             ImageInputStream iis = ImageIO.createImageInputStream(in)) {
            if (iis == null) {
                throw new AnalyzerException("no image stream available");
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(iis);
            if (!readers.hasNext()) {
                throw new AnalyzerException("unsupported or corrupt image container");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(iis, true, true);
                BufferedImage image = reader.read(0);
                String format = reader.getFormatName().toLowerCase(Locale.ROOT);
                return new DecodedImage(image, "jpg".equals(format) ? "jpeg" : format);
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            throw new AnalyzerException("unreadable image: " + e.getMessage(), e);
        }
    }

    public static LumaPlane luminance(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        int[] rgb = image.getRGB(0, 0, w, h, null, 0, w);
        float[] values = new float[w * h];
        for (int i = 0; i < rgb.length; i++) {
            values[i] = (float) luminance(rgb[i]);
        }
        return new LumaPlane(w, h, values);
    }

    /** Rec. 709 luminance of a packed ARGB pixel, in grey levels. */
    public static double luminance(int argb) {
        int r = (argb >> 16) & 0xFF, g = (argb >> 8) & 0xFF, b = argb & 0xFF;
        return 0.2126 * r + 0.7152 * g + 0.0722 * b;
    }

    /** Copy without alpha, as required by the JPEG writer. */
    public static BufferedImage toRgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics g = rgb.getGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }
}
