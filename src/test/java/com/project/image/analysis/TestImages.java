package com.project.image.analysis;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/** Synthetic test images drawn with java.awt. */
public final class TestImages {

    private TestImages() {
    }

    public static BufferedImage solid(int width, int height, Color color) {
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        g.setColor(color);
        g.fillRect(0, 0, width, height);
        g.dispose();
        return img;
    }

    /** 100x100, red in the left 40 columns and blue in the remaining 60. */
    public static BufferedImage redBlueSplit() {
        BufferedImage img = solid(100, 100, Color.BLUE);
        Graphics2D g = img.createGraphics();
        g.setColor(Color.RED);
        g.fillRect(0, 0, 40, 100);
        g.dispose();
        return img;
    }

    public static BufferedImage checkerboard(int size, int square) {
        BufferedImage img = new BufferedImage(size, size, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                boolean white = ((x / square) + (y / square)) % 2 == 0;
                img.setRGB(x, y, white ? 0xFFFFFF : 0x000000);
            }
        }
        return img;
    }

    /** Black filled circle on a white 512x512 canvas. */
    public static BufferedImage circle(int radius) {
        BufferedImage img = solid(512, 512, Color.WHITE);
        Graphics2D g = img.createGraphics();
        g.setColor(Color.BLACK);
        g.fillOval(256 - radius, 256 - radius, 2 * radius, 2 * radius);
        g.dispose();
        return img;
    }

    /** Black filled rectangles on a white 512x512 canvas, each given as {x, y, w, h}. */
    public static BufferedImage rectangles(int[]... rects) {
        BufferedImage img = solid(512, 512, Color.WHITE);
        Graphics2D g = img.createGraphics();
        g.setColor(Color.BLACK);
        for (int[] r : rects) {
            g.fillRect(r[0], r[1], r[2], r[3]);
        }
        g.dispose();
        return img;
    }

    public static byte[] png(BufferedImage img) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            ImageIO.write(img, "png", baos);
            return baos.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Path writePng(Path dir, String filename, BufferedImage img) {
        Path target = dir.resolve(filename);
        try {
            ImageIO.write(img, "png", target.toFile());
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
