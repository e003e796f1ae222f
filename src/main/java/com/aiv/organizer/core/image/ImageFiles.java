package com.aiv.organizer.core.image;

import com.aiv.organizer.config.ConfigService;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.WritableRaster;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;

/**
 * Image read/write helpers on top of {@link ImageIO}. The writer is chosen from the destination
 * extension; images the writer cannot encode (alpha for JPEG/BMP, palettes for JPEG) are
 * flattened onto white RGB first.
 */
public final class ImageFiles {
    private ImageFiles() {
    }

    public static BufferedImage read(Path path) throws IOException {
        BufferedImage image = ImageIO.read(path.toFile());
        if (image == null) {
            throw new IOException("Unsupported image format: " + path.getFileName());
        }
        return image;
    }

    public static void write(BufferedImage image, Path destination) throws IOException {
        String format = formatName(destination);
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format);
        if (!writers.hasNext()) {
            throw new IOException("No image writer for format '" + format + "': " + destination.getFileName());
        }
        ImageWriter writer = writers.next();
        BufferedImage output = image;
        boolean jpeg = "jpeg".equals(format);
        if ((jpeg && image.getColorModel().hasAlpha())
                || !writer.getOriginatingProvider().canEncodeImage(output)) {
            output = flattenToRgb(image, Color.WHITE);
        }
        ImageWriteParam param = writer.getDefaultWriteParam();
        if (jpeg && param.canWriteCompressed()) {
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(ConfigService.getInstance().getJpegQuality());
        }

        Files.deleteIfExists(destination);
        boolean written = false;
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(destination.toFile())) {
            if (ios == null) {
                throw new IOException("Cannot open image output stream: " + destination);
            }
            writer.setOutput(ios);
            writer.write(null, new IIOImage(output, null, null), param);
            written = true;
        } finally {
            writer.dispose();
            if (!written) {
                Files.deleteIfExists(destination);
            }
        }
    }

    /**
     * Draws {@code image} over an opaque background, dropping alpha and palettes.
     */
    public static BufferedImage flattenToRgb(BufferedImage image, Color background) {
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.setColor(background);
            g.fillRect(0, 0, rgb.getWidth(), rgb.getHeight());
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    /**
     * Deep copy of a region that keeps the source color model, palettes and grayscale included.
     */
    public static BufferedImage copyRegion(BufferedImage source, int x, int y, int width, int height) {
        BufferedImage region = source.getSubimage(x, y, width, height);
        ColorModel colorModel = source.getColorModel();
        WritableRaster raster = colorModel.createCompatibleWritableRaster(width, height);
        region.copyData(raster);
        return new BufferedImage(colorModel, raster, colorModel.isAlphaPremultiplied(), null);
    }

    static String formatName(Path destination) {
        String name = destination.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        String ext = dot < 0 ? "" : name.substring(dot + 1);
        return switch (ext) {
            case "jpg", "jpeg" -> "jpeg";
            case "tif", "tiff" -> "tiff";
            default -> ext;
        };
    }
}
