package com.aiv.organizer.core.image;

import com.aiv.organizer.core.transfer.TransferResult;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AnnotationCropperTest {

    private static final Logger LOGGER = Logger.getLogger(AnnotationCropperTest.class.getName());

    @TempDir
    Path tempDir;

    @Test
    void polygonPointsAreShiftedClampedAndBoxedAgain() {
        JSONObject annotation = new JSONObject("""
            {"shapes": [{"shape_type": "polygon", "points": [[4, 5], [10, 6], [3, 20]]}]}
            """);

        AnnotationCropper.shiftAnnotation(annotation, new CropBox(2, 3, 7, 7), 5, 4, "crop.bmp");

        JSONObject shape = annotation.getJSONArray("shapes").getJSONObject(0);
        JSONArray points = shape.getJSONArray("points");
        assertEquals(2, points.getJSONArray(0).getInt(0));
        assertEquals(2, points.getJSONArray(0).getInt(1));
        assertEquals(5, points.getJSONArray(1).getInt(0));
        assertEquals(4, points.getJSONArray(2).getInt(1));
        JSONObject bbox = shape.getJSONObject("bbox");
        assertEquals(1, bbox.getInt("x"));
        assertEquals(2, bbox.getInt("y"));
        assertEquals(4, bbox.getInt("width"));
        assertEquals(2, bbox.getInt("height"));
        assertEquals("crop.bmp", annotation.getString("imagePath"));
        assertEquals(5, annotation.getInt("imageWidth"));
        assertEquals(4, annotation.getInt("imageHeight"));
    }

    @Test
    void pointShapeKeepsItsBoxButFitsItInside() {
        JSONObject annotation = new JSONObject("""
            {"shapes": [{"shape_type": "point", "points": [[3, 4]],
                         "bbox": {"x": 3, "y": 4, "width": 10, "height": 10}}],
             "rois": [[2, 3, 100, 100]]}
            """);

        AnnotationCropper.shiftAnnotation(annotation, new CropBox(2, 3, 7, 7), 5, 4, "crop.bmp");

        JSONObject bbox = annotation.getJSONArray("shapes").getJSONObject(0).getJSONObject("bbox");
        assertEquals(1, bbox.getInt("x"));
        assertEquals(1, bbox.getInt("y"));
        assertEquals(4, bbox.getInt("width"));
        assertEquals(3, bbox.getInt("height"));
        JSONArray roi = annotation.getJSONArray("rois").getJSONArray(0);
        assertEquals(0, roi.getInt(0));
        assertEquals(0, roi.getInt(1));
        assertEquals(5, roi.getInt(2));
        assertEquals(4, roi.getInt(3));
    }

    @Test
    void writtenSidecarMatchesTheCroppedImage() throws IOException {
        Path srcImg = tempDir.resolve("fov2_a.png");
        ImageIO.write(new BufferedImage(20, 10, BufferedImage.TYPE_INT_RGB), "png", srcImg.toFile());
        Path srcJson = tempDir.resolve("fov2_a.json");
        Files.writeString(srcJson, """
            {"shapes": [{"shape_type": "rectangle", "points": [[5, 5], [15, 9]]}], "imageWidth": 20, "imageHeight": 10}
            """, StandardCharsets.UTF_8);
        Path out = Files.createDirectories(tempDir.resolve("out"));
        Path dstImg = out.resolve("fov2_a.png");
        Path dstJson = out.resolve("fov2_a.json");
        Path debug = out.resolve("fov2_a_debug.png");

        TransferResult result = new AnnotationCropper(new ImageCropper(LOGGER), LOGGER)
            .cropImageAndJsonPair(srcImg, dstImg, srcJson, dstJson, new CropBox(4, 2, 100, 100), debug);

        assertTrue(result.isSuccess());
        BufferedImage cropped = ImageIO.read(dstImg.toFile());
        JSONObject annotation = new JSONObject(Files.readString(dstJson, StandardCharsets.UTF_8));
        assertEquals(cropped.getWidth(), annotation.getInt("imageWidth"));
        assertEquals(cropped.getHeight(), annotation.getInt("imageHeight"));
        assertEquals("fov2_a.png", annotation.getString("imagePath"));
        JSONObject shape = annotation.getJSONArray("shapes").getJSONObject(0);
        JSONArray points = shape.getJSONArray("points");
        for (int i = 0; i < points.length(); i++) {
            double x = points.getJSONArray(i).getDouble(0);
            double y = points.getJSONArray(i).getDouble(1);
            assertTrue(x >= 0 && x <= cropped.getWidth(), "x " + x);
            assertTrue(y >= 0 && y <= cropped.getHeight(), "y " + y);
        }
        JSONObject bbox = shape.getJSONObject("bbox");
        assertTrue(bbox.getDouble("x") + bbox.getDouble("width") <= cropped.getWidth());
        assertTrue(bbox.getDouble("y") + bbox.getDouble("height") <= cropped.getHeight());
        assertTrue(Files.exists(debug));
    }

    @Test
    void brokenSidecarLeavesNoImageBehind() throws IOException {
        Path srcImg = tempDir.resolve("a.png");
        ImageIO.write(new BufferedImage(8, 8, BufferedImage.TYPE_INT_RGB), "png", srcImg.toFile());
        Path srcJson = tempDir.resolve("a.json");
        Files.writeString(srcJson, "{ not json", StandardCharsets.UTF_8);
        Path dstImg = tempDir.resolve("out.png");

        TransferResult result = new AnnotationCropper(new ImageCropper(LOGGER), LOGGER)
            .cropImageAndJsonPair(srcImg, dstImg, srcJson, tempDir.resolve("out.json"), new CropBox(0, 0, 4, 4), null);

        assertTrue(result.isError());
        assertFalse(Files.exists(dstImg));
        assertFalse(Files.exists(tempDir.resolve("out.json")));
    }
}
