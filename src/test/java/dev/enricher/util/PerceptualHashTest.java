package dev.enricher.util;

import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;

class PerceptualHashTest {

    private static BufferedImage halves(int width, int height, Color left, Color right) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        g.setColor(left);
        g.fillRect(0, 0, width / 2, height);
        g.setColor(right);
        g.fillRect(width / 2, 0, width - width / 2, height);
        g.dispose();
        return image;
    }

    @Test
    void shouldHashScaledCopiesAlike() {
        long original = PerceptualHash.averageHash(halves(400, 600, Color.BLACK, Color.WHITE));
        long scaled = PerceptualHash.averageHash(halves(200, 300, Color.BLACK, Color.WHITE));

        assertThat(PerceptualHash.distance(original, scaled)).isLessThanOrEqualTo(5);
    }

    @Test
    void shouldHashDifferentImagesApart() {
        long a = PerceptualHash.averageHash(halves(400, 600, Color.BLACK, Color.WHITE));
        long b = PerceptualHash.averageHash(halves(400, 600, Color.WHITE, Color.BLACK));

        assertThat(PerceptualHash.distance(a, b)).isGreaterThan(20);
    }

    @Test
    void shouldCountDifferingBits() {
        assertThat(PerceptualHash.distance(0L, 0L)).isZero();
        assertThat(PerceptualHash.distance(0L, 0b1011L)).isEqualTo(3);
        assertThat(PerceptualHash.distance(0L, -1L)).isEqualTo(64);
    }
}
