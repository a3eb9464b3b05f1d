package com.example.skygate_backend.engine.model;

import com.example.skygate_backend.engine.Interfaces.ImagePreprocessor;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.util.Arrays;
import java.util.Locale;

/**
 * Shorter-side resize, square center crop, scale to [0,1] and per-channel normalisation into an
 * NCHW tensor of shape {@code [1,3,crop,crop]}. Images smaller than the crop are upscaled first.
 */
public class ResizeNormalizePreprocessor implements ImagePreprocessor {
    private final int resize;
    private final int crop;
    private final float[] mean;
    private final float[] std;

    public ResizeNormalizePreprocessor(int resize, int crop, float[] mean, float[] std) {
        this.resize = resize;
        this.crop = crop;
        this.mean = mean.clone();
        this.std = std.clone();
    }

    @Override
    public ImageTensor apply(BufferedImage image) {
        int target = resize > 0 ? Math.max(resize, crop) : (shorterSide(image) < crop ? crop : 0);
        BufferedImage scaled = scaleShorterSide(image, target);
        int x0 = (scaled.getWidth() - crop) / 2;
        int y0 = (scaled.getHeight() - crop) / 2;

        int plane = crop * crop;
        float[] data = new float[3 * plane];
        int[] rgb = scaled.getRGB(x0, y0, crop, crop, null, 0, crop);
        for (int i = 0; i < plane; i++) {
            int p = rgb[i];
            data[i] = (((p >> 16) & 0xFF) / 255f - mean[0]) / std[0];
            data[plane + i] = (((p >> 8) & 0xFF) / 255f - mean[1]) / std[1];
            data[2 * plane + i] = ((p & 0xFF) / 255f - mean[2]) / std[2];
        }
        return new ImageTensor(data, new long[]{1, 3, crop, crop});
    }

    @Override
    public String describe() {
        return String.format(Locale.ROOT, "resize=%d crop=%d mean=%s std=%s",
                resize, crop, Arrays.toString(mean), Arrays.toString(std));
    }

    private static int shorterSide(BufferedImage image) {
        return Math.min(image.getWidth(), image.getHeight());
    }

    private static BufferedImage scaleShorterSide(BufferedImage image, int target) {
        int shorter = shorterSide(image);
        if (target <= 0 || target == shorter) {
            return image;
        }
        double factor = target / (double) shorter;
        int w = Math.max(target, (int) Math.round(image.getWidth() * factor));
        int h = Math.max(target, (int) Math.round(image.getHeight() * factor));
        BufferedImage out = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = out.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(image, 0, 0, w, h, null);
        } finally {
            g.dispose();
        }
        return out;
    }
}
