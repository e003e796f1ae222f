package com.aiv.organizer.core.image;

/**
 * Crop rectangle given as two corners, {@code (x1, y1)} inclusive and {@code (x2, y2)} exclusive.
 */
public record CropBox(int x1, int y1, int x2, int y2) {

    /**
     * Parses {@code "x1,y1,x2,y2"}.
     *
     * @throws IllegalArgumentException when the text does not hold exactly four integers
     */
    public static CropBox parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Crop area is empty");
        }
        String[] parts = text.split(",");
        if (parts.length != 4) {
            throw new IllegalArgumentException("Crop area must have four integers separated by commas: " + text);
        }
        int[] values = new int[4];
        for (int i = 0; i < 4; i++) {
            try {
                values[i] = Integer.parseInt(parts[i].trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Crop area value is not an integer: " + parts[i].trim(), e);
            }
        }
        return new CropBox(values[0], values[1], values[2], values[3]);
    }

    /** Same box with {@code x1 <= x2} and {@code y1 <= y2}. */
    public CropBox normalized() {
        return new CropBox(Math.min(x1, x2), Math.min(y1, y2), Math.max(x1, x2), Math.max(y1, y2));
    }

    /** Normalized box with every coordinate clamped to {@code [0, width] x [0, height]}. */
    public CropBox clampTo(int width, int height) {
        CropBox n = normalized();
        return new CropBox(
            clamp(n.x1, width),
            clamp(n.y1, height),
            clamp(n.x2, width),
            clamp(n.y2, height)
        );
    }

    public int width() {
        return x2 - x1;
    }

    public int height() {
        return y2 - y1;
    }

    public boolean hasArea() {
        return width() > 0 && height() > 0;
    }

    @Override
    public String toString() {
        return "(" + x1 + ", " + y1 + ", " + x2 + ", " + y2 + ")";
    }

    private static int clamp(int value, int max) {
        return Math.max(0, Math.min(value, max));
    }
}
