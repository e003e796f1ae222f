package com.aiv.organizer.core.image;

import com.aiv.organizer.core.transfer.TransferResult;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Crops one image file to a {@link CropBox}.
 */
public final class ImageCropper {
    private final OrientationNormalizer orientation;
    private final Logger logger;

    public ImageCropper(Logger logger) {
        this(new OrientationNormalizer(logger), logger);
    }

    ImageCropper(OrientationNormalizer orientation, Logger logger) {
        this.orientation = Objects.requireNonNull(orientation, "orientation");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    /**
     * Crops {@code src} into {@code dst}. A box that has no area once clamped to the image is
     * skipped and nothing is written.
     */
    public TransferResult cropImage(Path src, Path dst, CropBox box) {
        try {
            return crop(src, dst, box).result();
        } catch (IOException | RuntimeException e) {
            logger.log(Level.WARNING, "Crop failed: " + src, e);
            return TransferResult.error(src.toString(), "crop " + src + " failed: " + e.getMessage());
        }
    }

    Cropped crop(Path src, Path dst, CropBox box) throws IOException {
        String item = src.toString();
        BufferedImage image = orientation.normalize(src, ImageFiles.read(src));
        CropBox applied = box.clampTo(image.getWidth(), image.getHeight());
        if (!applied.hasArea()) {
            return new Cropped(TransferResult.skipped(item,
                "crop area " + box + " is empty inside " + image.getWidth() + "x" + image.getHeight()
                    + " image " + src.getFileName()), applied, null);
        }
        BufferedImage cropped = ImageFiles.copyRegion(image, applied.x1(), applied.y1(), applied.width(), applied.height());
        ImageFiles.write(cropped, dst);
        return new Cropped(TransferResult.success(item, "Cropped " + src + " to " + dst + " " + applied), applied, cropped);
    }

    /** Crop outcome; {@code image} is null when the crop was skipped. */
    record Cropped(TransferResult result, CropBox appliedBox, BufferedImage image) {
    }
}
