package com.aiv.organizer.core.image;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Metadata;
import com.drew.metadata.MetadataException;
import com.drew.metadata.exif.ExifIFD0Directory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Applies the EXIF orientation tag so that crop coordinates refer to the image as displayed.
 * Files without readable EXIF data are treated as upright.
 */
public final class OrientationNormalizer {
    static final int UPRIGHT = 1;

    private final Logger logger;

    public OrientationNormalizer(Logger logger) {
        this.logger = logger;
    }

    public BufferedImage normalize(Path source, BufferedImage image) {
        return apply(image, readOrientation(source));
    }

    int readOrientation(Path source) {
        try {
            Metadata metadata = ImageMetadataReader.readMetadata(source.toFile());
            ExifIFD0Directory directory = metadata.getFirstDirectoryOfType(ExifIFD0Directory.class);
            if (directory == null || !directory.containsTag(ExifIFD0Directory.TAG_ORIENTATION)) {
                return UPRIGHT;
            }
            return directory.getInt(ExifIFD0Directory.TAG_ORIENTATION);
        } catch (ImageProcessingException | IOException | MetadataException e) {
            logger.fine("No EXIF orientation for " + source.getFileName() + ": " + e.getMessage());
            return UPRIGHT;
        }
    }

    /**
     * Returns {@code image} redrawn for EXIF orientation 2-8; 1 and unknown values return it as is.
     */
    static BufferedImage apply(BufferedImage image, int orientation) {
        if (orientation < 2 || orientation > 8) {
            return image;
        }
        int w = image.getWidth();
        int h = image.getHeight();
        boolean swap = orientation >= 5;
        int type = image.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        BufferedImage out = new BufferedImage(swap ? h : w, swap ? w : h, type);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int argb = image.getRGB(x, y);
                switch (orientation) {
                    case 2 -> out.setRGB(w - 1 - x, y, argb);
                    case 3 -> out.setRGB(w - 1 - x, h - 1 - y, argb);
                    case 4 -> out.setRGB(x, h - 1 - y, argb);
                    case 5 -> out.setRGB(y, x, argb);
                    case 6 -> out.setRGB(h - 1 - y, x, argb);
                    case 7 -> out.setRGB(h - 1 - y, w - 1 - x, argb);
                    default -> out.setRGB(y, w - 1 - x, argb);
                }
            }
        }
        return out;
    }
}
