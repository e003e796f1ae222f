package com.aiv.organizer.core.image;

import com.aiv.organizer.core.transfer.TransferResult;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Crops an image together with its annotation sidecar. The sidecar geometry is moved by the
 * crop offset and clamped so that it always matches the dimensions of the written image.
 */
public final class AnnotationCropper {
    static final String SHAPES = "shapes";
    static final String POINTS = "points";
    static final String BBOX = "bbox";
    static final String ROIS = "rois";
    static final String SHAPE_TYPE = "shape_type";
    static final String POINT_SHAPE = "point";
    static final String IMAGE_PATH = "imagePath";
    static final String IMAGE_WIDTH = "imageWidth";
    static final String IMAGE_HEIGHT = "imageHeight";

    private final ImageCropper cropper;
    private final Logger logger;

    public AnnotationCropper(ImageCropper cropper, Logger logger) {
        this.cropper = Objects.requireNonNull(cropper, "cropper");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    /**
     * Crops {@code srcImg} into {@code dstImg} and writes the corrected sidecar to {@code dstJson}.
     * When {@code debugPath} is not null a PNG with the corrected geometry drawn over the cropped
     * image is written there as well.
     */
    public TransferResult cropImageAndJsonPair(Path srcImg, Path dstImg, Path srcJson, Path dstJson,
                                               CropBox box, Path debugPath) {
        String item = srcImg.toString();
        ImageCropper.Cropped cropped;
        try {
            cropped = cropper.crop(srcImg, dstImg, box);
        } catch (IOException | RuntimeException e) {
            logger.log(Level.WARNING, "Crop failed: " + srcImg, e);
            return TransferResult.error(item, "crop " + srcImg + " failed: " + e.getMessage());
        }
        if (!cropped.result().isSuccess()) {
            return cropped.result();
        }

        BufferedImage image = cropped.image();
        JSONObject annotation;
        try {
            annotation = new JSONObject(Files.readString(srcJson, StandardCharsets.UTF_8));
            shiftAnnotation(annotation, cropped.appliedBox(), image.getWidth(), image.getHeight(),
                dstImg.getFileName().toString());
            Files.writeString(dstJson, annotation.toString(2), StandardCharsets.UTF_8);
        } catch (IOException | JSONException e) {
            logger.log(Level.WARNING, "Annotation update failed: " + srcJson, e);
            // an image without its sidecar is not left behind
            deleteQuietly(dstImg);
            return TransferResult.error(item, "annotation " + srcJson + " failed: " + e.getMessage());
        }

        if (debugPath != null) {
            try {
                ImageFiles.write(drawOverlay(image, annotation), debugPath);
            } catch (IOException | RuntimeException e) {
                logger.log(Level.WARNING, "Debug overlay failed: " + debugPath, e);
            }
        }
        return TransferResult.success(item, "Cropped " + srcImg + " with annotation to " + dstImg + " "
            + cropped.appliedBox());
    }

    /**
     * Rewrites {@code annotation} in place for an image cropped to {@code applied}, whose size is
     * now {@code width x height}.
     */
    static void shiftAnnotation(JSONObject annotation, CropBox applied, int width, int height, String imageName) {
        int dx = applied.x1();
        int dy = applied.y1();
        JSONArray shapes = annotation.optJSONArray(SHAPES);
        if (shapes != null) {
            for (int i = 0; i < shapes.length(); i++) {
                JSONObject shape = shapes.optJSONObject(i);
                if (shape != null) {
                    shiftShape(shape, dx, dy, width, height);
                }
            }
        }
        JSONArray rois = annotation.optJSONArray(ROIS);
        if (rois != null) {
            for (int i = 0; i < rois.length(); i++) {
                JSONArray roi = rois.optJSONArray(i);
                if (roi == null || roi.length() < 4) {
                    continue;
                }
                roi.put(0, coordinate(clamp(roi.getDouble(0) - dx, width)));
                roi.put(1, coordinate(clamp(roi.getDouble(1) - dy, height)));
                roi.put(2, coordinate(clamp(roi.getDouble(2) - dx, width)));
                roi.put(3, coordinate(clamp(roi.getDouble(3) - dy, height)));
            }
        }
        annotation.put(IMAGE_PATH, imageName);
        annotation.put(IMAGE_WIDTH, width);
        annotation.put(IMAGE_HEIGHT, height);
    }

    private static void shiftShape(JSONObject shape, int dx, int dy, int width, int height) {
        JSONArray points = shape.optJSONArray(POINTS);
        double minX = Double.MAX_VALUE;
        double minY = Double.MAX_VALUE;
        double maxX = -Double.MAX_VALUE;
        double maxY = -Double.MAX_VALUE;
        int shifted = 0;
        if (points != null) {
            for (int i = 0; i < points.length(); i++) {
                JSONArray point = points.optJSONArray(i);
                if (point == null || point.length() < 2) {
                    continue;
                }
                double x = clamp(point.getDouble(0) - dx, width);
                double y = clamp(point.getDouble(1) - dy, height);
                point.put(0, coordinate(x));
                point.put(1, coordinate(y));
                minX = Math.min(minX, x);
                minY = Math.min(minY, y);
                maxX = Math.max(maxX, x);
                maxY = Math.max(maxY, y);
                shifted++;
            }
        }

        JSONObject bbox = shape.optJSONObject(BBOX);
        boolean pointShape = POINT_SHAPE.equals(shape.optString(SHAPE_TYPE));
        if (!pointShape && shifted > 0) {
            JSONObject rebuilt = new JSONObject();
            rebuilt.put("x", coordinate(minX));
            rebuilt.put("y", coordinate(minY));
            rebuilt.put("width", coordinate(maxX - minX));
            rebuilt.put("height", coordinate(maxY - minY));
            shape.put(BBOX, rebuilt);
        } else if (bbox != null) {
            double x = clamp(bbox.optDouble("x", 0) - dx, width);
            double y = clamp(bbox.optDouble("y", 0) - dy, height);
            double w = Math.max(0, Math.min(bbox.optDouble("width", 0), width - x));
            double h = Math.max(0, Math.min(bbox.optDouble("height", 0), height - y));
            bbox.put("x", coordinate(x));
            bbox.put("y", coordinate(y));
            bbox.put("width", coordinate(w));
            bbox.put("height", coordinate(h));
        }
    }

    private BufferedImage drawOverlay(BufferedImage image, JSONObject annotation) {
        BufferedImage canvas = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = canvas.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
            g.setStroke(new BasicStroke(2f));
            JSONArray shapes = annotation.optJSONArray(SHAPES);
            for (int i = 0; shapes != null && i < shapes.length(); i++) {
                JSONObject shape = shapes.optJSONObject(i);
                if (shape == null) {
                    continue;
                }
                JSONArray points = shape.optJSONArray(POINTS);
                if (points != null && points.length() > 0) {
                    g.setColor(Color.RED);
                    int[] xs = new int[points.length()];
                    int[] ys = new int[points.length()];
                    int n = 0;
                    for (int p = 0; p < points.length(); p++) {
                        JSONArray point = points.optJSONArray(p);
                        if (point != null && point.length() >= 2) {
                            xs[n] = (int) Math.round(point.getDouble(0));
                            ys[n] = (int) Math.round(point.getDouble(1));
                            n++;
                        }
                    }
                    g.drawPolygon(xs, ys, n);
                }
                JSONObject bbox = shape.optJSONObject(BBOX);
                if (bbox != null) {
                    g.setColor(Color.GREEN);
                    g.drawRect((int) bbox.optDouble("x", 0), (int) bbox.optDouble("y", 0),
                        (int) bbox.optDouble("width", 0), (int) bbox.optDouble("height", 0));
                }
            }
            JSONArray rois = annotation.optJSONArray(ROIS);
            g.setColor(Color.BLUE);
            for (int i = 0; rois != null && i < rois.length(); i++) {
                JSONArray roi = rois.optJSONArray(i);
                if (roi != null && roi.length() >= 4) {
                    int x1 = (int) roi.getDouble(0);
                    int y1 = (int) roi.getDouble(1);
                    g.drawRect(x1, y1, (int) roi.getDouble(2) - x1, (int) roi.getDouble(3) - y1);
                }
            }
        } finally {
            g.dispose();
        }
        return canvas;
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warning("Could not remove " + path + ": " + e.getMessage());
        }
    }

    private static double clamp(double value, int max) {
        return Math.max(0, Math.min(value, max));
    }

    /** Whole numbers are written as integers, fractional ones unchanged. */
    private static Object coordinate(double value) {
        if (value == Math.rint(value) && Math.abs(value) <= Integer.MAX_VALUE) {
            return (int) value;
        }
        return value;
    }
}
