package com.aiv.organizer.core.image;

import com.aiv.organizer.core.transfer.TransferResult;

import java.awt.Color;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Places two images of the same sample and FOV side by side on a white canvas and captions each
 * half with its file name and FOV number.
 */
public final class FovImageAttacher {
    private static final int CAPTION_MARGIN = 10;

    private final Logger logger;

    public FovImageAttacher(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    /** Joins images sharing a sample key (last characters of the folder name) and a FOV number. */
    public record AttachKey(String sampleKey, String fovNumber) {
        public AttachKey {
            Objects.requireNonNull(sampleKey, "sampleKey");
            Objects.requireNonNull(fovNumber, "fovNumber");
        }
    }

    /**
     * Output name for the {@code index}-th pair of a key: the first pair is
     * {@code attached_<sample>_<fov>.jpg}, later ones get {@code _2}, {@code _3} and so on.
     */
    public static String outputName(AttachKey key, int index) {
        String base = "attached_" + key.sampleKey() + "_" + key.fovNumber();
        return index == 0 ? base + ".jpg" : base + "_" + (index + 1) + ".jpg";
    }

    public TransferResult attach(Path left, Path right, AttachKey key, Path destination) {
        String item = left.toString();
        try {
            BufferedImage first = ImageFiles.read(left);
            BufferedImage second = ImageFiles.read(right);
            int width = first.getWidth() + second.getWidth();
            int height = Math.max(first.getHeight(), second.getHeight());

            BufferedImage canvas = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
            Graphics2D g = canvas.createGraphics();
            try {
                g.setColor(Color.WHITE);
                g.fillRect(0, 0, width, height);
                g.drawImage(first, 0, 0, null);
                g.drawImage(second, first.getWidth(), 0, null);
                drawCaptions(g, left, right, first.getWidth(), key);
            } finally {
                g.dispose();
            }
            ImageFiles.write(canvas, destination);
            return TransferResult.success(item, "Attached: " + left + " + " + right + " => " + destination);
        } catch (IOException | RuntimeException e) {
            logger.log(Level.WARNING, "Attach failed: " + left + " + " + right, e);
            return TransferResult.error(item, "attach " + left + " + " + right + " failed: " + e.getMessage());
        }
    }

    private void drawCaptions(Graphics2D g, Path left, Path right, int rightOffset, AttachKey key) {
        try {
            g.setColor(Color.BLACK);
            caption(g, left.getFileName().toString(), key.fovNumber(), CAPTION_MARGIN);
            caption(g, right.getFileName().toString(), key.fovNumber(), rightOffset + CAPTION_MARGIN);
        } catch (RuntimeException | InternalError | UnsatisfiedLinkError e) {
            // fonts may be missing on headless hosts; the image is saved without captions
            logger.log(Level.WARNING, "Caption rendering unavailable for " + left.getFileName(), e);
        }
    }

    private static void caption(Graphics2D g, String fileName, String fovNumber, int x) {
        FontMetrics metrics = g.getFontMetrics();
        int baseline = CAPTION_MARGIN + metrics.getAscent();
        g.drawString(fileName, x, baseline);
        g.drawString("fov:" + fovNumber, x, baseline + metrics.getHeight());
    }
}
