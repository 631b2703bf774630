package com.example.cameratrap.service.metadata;

import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Brightness, sharpness and an overall quality score for a decoded image. All scores lie in
 * [0, 1] and are rounded to four decimal places.
 */
@Component
public class ImageQualityAnalyzer {

    static final double SHARPNESS_NORMALISER = 500.0;

    public QualityScores analyze(BufferedImage image) {
        if (image == null) {
            throw new IllegalArgumentException("Image cannot be null");
        }
        double[][] gray = toGray(image);
        double brightness = mean(gray) / 255.0;
        double sharpness = Math.min(laplacianVariance(gray) / SHARPNESS_NORMALISER, 1.0);
        double quality = 0.3 * (1.0 - Math.abs(brightness - 0.5) * 2.0) + 0.7 * sharpness;
        return new QualityScores(round(brightness), round(sharpness), round(quality));
    }

    private double[][] toGray(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        double[][] gray = new double[height][width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int rgb = image.getRGB(x, y);
                int r = (rgb >> 16) & 0xFF;
                int g = (rgb >> 8) & 0xFF;
                int b = rgb & 0xFF;
                gray[y][x] = 0.299 * r + 0.587 * g + 0.114 * b;
            }
        }
        return gray;
    }

    private double mean(double[][] gray) {
        double sum = 0.0;
        long count = 0;
        for (double[] row : gray) {
            for (double value : row) {
                sum += value;
                count++;
            }
        }
        return count == 0 ? 0.0 : sum / count;
    }

    /**
     * Variance of the 4-neighbour Laplacian. Borders are reflected without repeating the edge pixel.
     */
    private double laplacianVariance(double[][] gray) {
        int height = gray.length;
        int width = gray[0].length;
        double sum = 0.0;
        double sumSquares = 0.0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double response = gray[reflect(y - 1, height)][x]
                        + gray[reflect(y + 1, height)][x]
                        + gray[y][reflect(x - 1, width)]
                        + gray[y][reflect(x + 1, width)]
                        - 4.0 * gray[y][x];
                sum += response;
                sumSquares += response * response;
            }
        }
        long count = (long) width * height;
        double mean = sum / count;
        return Math.max(0.0, sumSquares / count - mean * mean);
    }

    private static int reflect(int index, int size) {
        if (size == 1) {
            return 0;
        }
        if (index < 0) {
            return -index;
        }
        if (index >= size) {
            return 2 * size - index - 2;
        }
        return index;
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP).doubleValue();
    }

    public record QualityScores(double brightness, double sharpness, double quality) {
    }
}
