package com.example.cameratrap.util;

import com.example.cameratrap.model.BoundingBox;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Cuts a detection out of its source image for species classification. The box is grown by the
 * padding fraction on every side, clamped to the image and re-encoded as JPEG.
 */
public final class RegionCropper {

    private RegionCropper() {
    }

    public static byte[] crop(BufferedImage source, BoundingBox box, double padding) {
        if (source == null) {
            throw new IllegalArgumentException("Source image cannot be null");
        }
        int imageWidth = source.getWidth();
        int imageHeight = source.getHeight();

        int x = (int) (box.x() * imageWidth);
        int y = (int) (box.y() * imageHeight);
        int width = (int) (box.width() * imageWidth);
        int height = (int) (box.height() * imageHeight);
        int padX = (int) (width * padding);
        int padY = (int) (height * padding);

        int left = clamp(x - padX, 0, imageWidth - 1);
        int top = clamp(y - padY, 0, imageHeight - 1);
        int right = clamp(x + width + padX, left + 1, imageWidth);
        int bottom = clamp(y + height + padY, top + 1, imageHeight);

        BufferedImage region = toRgb(source.getSubimage(left, top, right - left, bottom - top));
        return encodeJpeg(region);
    }

    private static BufferedImage toRgb(BufferedImage input) {
        BufferedImage converted = new BufferedImage(input.getWidth(), input.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = converted.createGraphics();
        try {
            graphics.drawImage(input, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        return converted;
    }

    private static byte[] encodeJpeg(BufferedImage image) {
        try (ByteArrayOutputStream output = new ByteArrayOutputStream()) {
            if (!ImageIO.write(image, "jpg", output)) {
                throw new IllegalStateException("JPEG ImageWriter not available");
            }
            return output.toByteArray();
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to encode cropped region", ex);
        }
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
