package dev.enricher.util;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * 64-bit average hash. Images that look alike have hashes a small Hamming distance apart.
 */
public final class PerceptualHash {

    private static final int SIZE = 8;

    private PerceptualHash() {
    }

    public static long averageHash(BufferedImage image) {
        BufferedImage small = new BufferedImage(SIZE, SIZE, BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D g = small.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(image, 0, 0, SIZE, SIZE, null);
        } finally {
            g.dispose();
        }

        int[] pixels = new int[SIZE * SIZE];
        small.getRaster().getPixels(0, 0, SIZE, SIZE, pixels);

        long sum = 0;
        for (int p : pixels) {
            sum += p;
        }
        double mean = (double) sum / pixels.length;

        long hash = 0L;
        for (int i = 0; i < pixels.length; i++) {
            if (pixels[i] >= mean) {
                hash |= 1L << i;
            }
        }
        return hash;
    }

    public static int distance(long a, long b) {
        return Long.bitCount(a ^ b);
    }
}
