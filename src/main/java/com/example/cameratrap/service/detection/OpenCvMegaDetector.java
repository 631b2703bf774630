package com.example.cameratrap.service.detection;

import com.example.cameratrap.config.PipelineProperties.DetectionProperties;
import com.example.cameratrap.exception.ImageDecodeException;
import com.example.cameratrap.exception.InferenceRejectedException;
import com.example.cameratrap.model.BoundingBox;
import com.example.cameratrap.model.DetectionCandidate;
import com.example.cameratrap.model.DetectionType;
import nu.pattern.OpenCV;
import org.opencv.core.CvException;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.dnn.Dnn;
import org.opencv.dnn.Net;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs a YOLOv5 MegaDetector export through the OpenCV DNN module. Raw rows are
 * {@code [cx, cy, w, h, objectness, animal, person, vehicle]} in input-pixel units; boxes are
 * converted to normalised coordinates and suppressed per class by {@code applyNms} before they
 * leave this class. The input is resized to a square without letterboxing.
 *
 * <p>An OpenCV {@code Net} is not safe for concurrent use, so forward passes are serialised.
 */
public class OpenCvMegaDetector implements AnimalDetector {

    private static final Logger log = LoggerFactory.getLogger(OpenCvMegaDetector.class);

    // Rows below this score are dropped before suppression; the configured threshold applies later.
    private static final double MIN_SCORE = 0.05;

    static {
        OpenCV.loadLocally();
        log.info("Loaded OpenCV native libraries");
    }

    private final DetectionProperties properties;
    private volatile Net network;
    private final Object networkLock = new Object();
    private final Object inferenceLock = new Object();

    public OpenCvMegaDetector(DetectionProperties properties) {
        this.properties = properties;
    }

    OpenCvMegaDetector(DetectionProperties properties, Net network) {
        this.properties = properties;
        this.network = network;
    }

    @Override
    public List<DetectionCandidate> detect(byte[] image) {
        Mat source = Imgcodecs.imdecode(new MatOfByte(image), Imgcodecs.IMREAD_COLOR);
        if (source.empty()) {
            source.release();
            throw new ImageDecodeException("OpenCV could not decode the image");
        }
        Net net = ensureNetwork();
        int inputSize = properties.inputSize();
        Mat blob = Dnn.blobFromImage(source, 1.0 / 255.0, new Size(inputSize, inputSize), new Scalar(0, 0, 0), true, false);
        Mat rawResult = null;
        Mat reshaped = null;
        try {
            synchronized (inferenceLock) {
                net.setInput(blob);
                rawResult = net.forward();
            }
            reshaped = rawResult.reshape(1, (int) rawResult.size(1));
            float[] data = new float[(int) (reshaped.total() * reshaped.channels())];
            reshaped.get(0, 0, data);
            List<Row> rows = decodeRows(data, reshaped.rows(), reshaped.cols(), inputSize);
            List<Row> kept = applyNms(rows, properties.nmsThreshold());
            log.debug("MegaDetector produced {} raw rows, {} after suppression", rows.size(), kept.size());
            List<DetectionCandidate> candidates = new ArrayList<>(kept.size());
            for (Row row : kept) {
                candidates.add(new DetectionCandidate(row.type(), row.box(), row.confidence()));
            }
            return candidates;
        } catch (CvException ex) {
            throw new InferenceRejectedException("MegaDetector inference failed: " + ex.getMessage(), ex);
        } finally {
            blob.release();
            if (reshaped != null) {
                reshaped.release();
            }
            if (rawResult != null) {
                rawResult.release();
            }
            source.release();
        }
    }

    private List<Row> decodeRows(float[] data, int rowCount, int channels, int inputSize) {
        List<Row> rows = new ArrayList<>();
        int classCount = channels - 5;
        for (int i = 0; i < rowCount; i++) {
            int offset = i * channels;
            float objectness = data[offset + 4];
            int bestClass = 0;
            float bestScore = 0f;
            for (int c = 0; c < classCount; c++) {
                float score = data[offset + 5 + c];
                if (score > bestScore) {
                    bestScore = score;
                    bestClass = c;
                }
            }
            double confidence = objectness * bestScore;
            if (confidence < MIN_SCORE) {
                continue;
            }
            DetectionType type;
            try {
                type = DetectionType.fromCategoryId(bestClass + 1);
            } catch (IllegalArgumentException ex) {
                continue;
            }
            double cx = data[offset] / inputSize;
            double cy = data[offset + 1] / inputSize;
            double w = data[offset + 2] / inputSize;
            double h = data[offset + 3] / inputSize;
            double left = clamp(cx - w / 2.0);
            double top = clamp(cy - h / 2.0);
            double width = clamp(cx + w / 2.0) - left;
            double height = clamp(cy + h / 2.0) - top;
            if (width <= 0.0 || height <= 0.0) {
                continue;
            }
            rows.add(new Row(type, new BoundingBox(left, top, width, height), Math.min(confidence, 1.0)));
        }
        return rows;
    }

    private Net ensureNetwork() {
        Net current = network;
        if (current != null) {
            return current;
        }
        synchronized (networkLock) {
            if (network == null) {
                String modelPath = properties.modelPath();
                if (modelPath == null || modelPath.isBlank()) {
                    throw new IllegalStateException("camera-trap.detection.model-path must be configured");
                }
                Path path = Path.of(modelPath);
                if (!Files.exists(path)) {
                    log.warn("MegaDetector model file {} not found. Detection requests will fail until the model is available.", modelPath);
                } else {
                    log.info("Loading MegaDetector model from {}", path.toAbsolutePath());
                }
                network = Dnn.readNetFromONNX(modelPath);
            }
            return network;
        }
    }

    private List<Row> applyNms(List<Row> rows, double threshold) {
        List<Row> ordered = new ArrayList<>(rows);
        ordered.sort(Comparator.comparingDouble(Row::confidence).reversed());
        List<Row> kept = new ArrayList<>();
        for (Row candidate : ordered) {
            boolean keep = true;
            for (Row selected : kept) {
                if (selected.type() == candidate.type() && intersectionOverUnion(selected.box(), candidate.box()) > threshold) {
                    keep = false;
                    break;
                }
            }
            if (keep) {
                kept.add(candidate);
            }
        }
        return kept;
    }

    private double intersectionOverUnion(BoundingBox a, BoundingBox b) {
        double x1 = Math.max(a.x(), b.x());
        double y1 = Math.max(a.y(), b.y());
        double x2 = Math.min(a.x() + a.width(), b.x() + b.width());
        double y2 = Math.min(a.y() + a.height(), b.y() + b.height());
        double intersection = Math.max(0.0, x2 - x1) * Math.max(0.0, y2 - y1);
        double union = a.area() + b.area() - intersection;
        if (union <= 0.0) {
            return 0.0;
        }
        return intersection / union;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private record Row(DetectionType type, BoundingBox box, double confidence) {
    }
}
