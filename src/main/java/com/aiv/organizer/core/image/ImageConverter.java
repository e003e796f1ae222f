package com.aiv.organizer.core.image;

import com.aiv.organizer.core.transfer.TransferResult;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Opens an image, applies one {@link ImageTransform} and saves it under the destination's format.
 */
public final class ImageConverter {
    private final Logger logger;

    public ImageConverter(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public TransferResult convertFormat(Path src, Path dst, ImageTransform transform) {
        String item = src.toString();
        try {
            BufferedImage image = ImageFiles.read(src);
            ImageFiles.write(apply(image, transform), dst);
            return TransferResult.success(item, describe(transform) + " " + src + " to " + dst);
        } catch (IOException | RuntimeException e) {
            logger.log(Level.WARNING, transform.label() + " failed: " + src, e);
            return TransferResult.error(item, transform.label() + " " + src + " failed: " + e.getMessage());
        }
    }

    public TransferResult bmpToJpg(Path src, Path dst) {
        return convertFormat(src, dst, new ImageTransform.ToJpeg());
    }

    static BufferedImage apply(BufferedImage image, ImageTransform transform) {
        if (transform instanceof ImageTransform.Resize resize) {
            return resize(image, resize.width(), resize.height());
        }
        if (transform instanceof ImageTransform.Rotate rotate) {
            return rotate(image, rotate.degrees());
        }
        if (transform instanceof ImageTransform.Flip flip) {
            return flip(image, flip.direction());
        }
        return ImageFiles.flattenToRgb(image, Color.WHITE);
    }

    static BufferedImage resize(BufferedImage image, int width, int height) {
        BufferedImage out = new BufferedImage(width, height, canvasType(image));
        Graphics2D g = out.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(image, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    /**
     * Rotates counter-clockwise by {@code degrees}; the canvas is enlarged to the rotated bounds
     * and uncovered corners stay black (transparent for images with alpha).
     */
    static BufferedImage rotate(BufferedImage image, double degrees) {
        double radians = Math.toRadians(degrees);
        double sin = Math.abs(Math.sin(radians));
        double cos = Math.abs(Math.cos(radians));
        int w = image.getWidth();
        int h = image.getHeight();
        int newW = Math.max(1, (int) Math.round(w * cos + h * sin));
        int newH = Math.max(1, (int) Math.round(w * sin + h * cos));

        BufferedImage out = new BufferedImage(newW, newH, canvasType(image));
        Graphics2D g = out.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            AffineTransform at = new AffineTransform();
            at.translate(newW / 2.0, newH / 2.0);
            // screen y points down, so a negative angle turns counter-clockwise
            at.rotate(-radians);
            at.translate(-w / 2.0, -h / 2.0);
            g.drawImage(image, at, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    static BufferedImage flip(BufferedImage image, ImageTransform.Flip.Direction direction) {
        int w = image.getWidth();
        int h = image.getHeight();
        BufferedImage out = new BufferedImage(w, h, canvasType(image));
        Graphics2D g = out.createGraphics();
        try {
            if (direction == ImageTransform.Flip.Direction.HORIZONTAL) {
                g.drawImage(image, 0, 0, w, h, w, 0, 0, h, null);
            } else {
                g.drawImage(image, 0, 0, w, h, 0, h, w, 0, null);
            }
        } finally {
            g.dispose();
        }
        return out;
    }

    private static int canvasType(BufferedImage image) {
        return image.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
    }

    private static String describe(ImageTransform transform) {
        if (transform instanceof ImageTransform.Resize) {
            return "Resized";
        }
        if (transform instanceof ImageTransform.Rotate rotate) {
            return "Rotated (" + rotate.degrees() + " degrees)";
        }
        if (transform instanceof ImageTransform.Flip) {
            return "Flipped";
        }
        return "Converted";
    }
}
