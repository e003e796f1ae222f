package com.aiv.organizer.core.image;

import java.util.Locale;

/**
 * A single-image transformation applied by {@link ImageConverter}.
 */
public sealed interface ImageTransform
    permits ImageTransform.Resize, ImageTransform.Rotate, ImageTransform.Flip, ImageTransform.ToJpeg {

    /** Short label used in log lines. */
    String label();

    record Resize(int width, int height) implements ImageTransform {
        public Resize {
            if (width <= 0 || height <= 0) {
                throw new IllegalArgumentException("Resize dimensions must be positive: " + width + "x" + height);
            }
        }

        /** Parses {@code "WIDTHxHEIGHT"}. */
        public static Resize parse(String text) {
            if (text == null) {
                throw new IllegalArgumentException("Resize dimensions are missing");
            }
            String[] parts = text.trim().toLowerCase(Locale.ROOT).split("x");
            if (parts.length != 2) {
                throw new IllegalArgumentException("Resize dimensions must look like 800x600: " + text);
            }
            try {
                return new Resize(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Resize dimensions must look like 800x600: " + text, e);
            }
        }

        @Override
        public String label() {
            return "resize " + width + "x" + height;
        }
    }

    /** Counter-clockwise rotation in degrees; the canvas grows to hold the rotated image. */
    record Rotate(double degrees) implements ImageTransform {
        @Override
        public String label() {
            return "rotate " + degrees;
        }
    }

    record Flip(Direction direction) implements ImageTransform {
        public enum Direction {
            HORIZONTAL,
            VERTICAL
        }

        public Flip {
            if (direction == null) {
                throw new IllegalArgumentException("Flip direction is required");
            }
        }

        @Override
        public String label() {
            return "flip " + direction.name().toLowerCase(Locale.ROOT);
        }
    }

    /** Re-encodes as JPEG, compositing transparency over white. */
    record ToJpeg() implements ImageTransform {
        @Override
        public String label() {
            return "bmp to jpg";
        }
    }
}
