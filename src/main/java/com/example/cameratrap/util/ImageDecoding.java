package com.example.cameratrap.util;

import com.example.cameratrap.exception.ImageDecodeException;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Locale;

public final class ImageDecoding {

    private ImageDecoding() {
    }

    public static DecodedImage decode(byte[] data) {
        if (data == null || data.length == 0) {
            throw new ImageDecodeException("Image payload is empty");
        }
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(data))) {
            if (input == null) {
                throw new ImageDecodeException("Unable to open image stream");
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                throw new ImageDecodeException("Unsupported image format");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                BufferedImage image = reader.read(0);
                if (image == null || image.getWidth() <= 0 || image.getHeight() <= 0) {
                    throw new ImageDecodeException("Image has no decodable pixels");
                }
                return new DecodedImage(image, reader.getFormatName().toUpperCase(Locale.ROOT));
            } finally {
                reader.dispose();
            }
        } catch (ImageDecodeException ex) {
            throw ex;
        } catch (IOException | RuntimeException ex) {
            throw new ImageDecodeException("Corrupt image data: " + ex.getMessage(), ex);
        }
    }

    public record DecodedImage(BufferedImage image, String format) {

        public int width() {
            return image.getWidth();
        }

        public int height() {
            return image.getHeight();
        }
    }
}
