package com.example.cameratrap.service.classification;

import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import com.example.cameratrap.config.PipelineProperties.ClassificationProperties;
import com.example.cameratrap.exception.InferenceRejectedException;
import com.example.cameratrap.model.SpeciesCandidate;
import com.example.cameratrap.util.ImageDecoding;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.FloatBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Species classifier backed by an ONNX image model. Crops are resized so the short side is
 * 256/224 of the input size, centre cropped, normalised with ImageNet statistics and scored with a
 * softmax over the model logits. Class indices are mapped through a JSON label file of the form
 * {@code {"0": {"scientific_name": "...", "common_name": "..."}}}.
 */
public class OnnxSpeciesClassifier implements SpeciesClassifier, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OnnxSpeciesClassifier.class);

    private static final float[] MEAN = {0.485f, 0.456f, 0.406f};
    private static final float[] STD = {0.229f, 0.224f, 0.225f};

    private final ClassificationProperties properties;
    private final OrtEnvironment environment;
    private final Object sessionLock = new Object();
    private volatile OrtSession session;
    private volatile Map<String, LabelEntry> labels;

    public OnnxSpeciesClassifier(ClassificationProperties properties) {
        this.properties = properties;
        this.environment = OrtEnvironment.getEnvironment();
    }

    @Override
    public List<SpeciesCandidate> classify(byte[] crop, int topK) {
        BufferedImage image = ImageDecoding.decode(crop).image();
        int inputSize = properties.inputSize();
        FloatBuffer buffer = toTensorData(image, inputSize);
        long[] shape = {1, 3, inputSize, inputSize};
        OrtSession current = ensureSession();
        float[] logits;
        try (OnnxTensor input = OnnxTensor.createTensor(environment, buffer, shape);
             OrtSession.Result output = current.run(Map.of(current.getInputNames().iterator().next(), input))) {
            FloatBuffer raw = ((OnnxTensor) output.get(0)).getFloatBuffer();
            logits = new float[raw.remaining()];
            raw.get(logits);
        } catch (OrtException ex) {
            throw new InferenceRejectedException("Species model inference failed: " + ex.getMessage(), ex);
        }
        double[] probabilities = softmax(logits);
        return topCandidates(probabilities, topK);
    }

    private List<SpeciesCandidate> topCandidates(double[] probabilities, int topK) {
        List<Integer> order = new ArrayList<>(probabilities.length);
        for (int i = 0; i < probabilities.length; i++) {
            order.add(i);
        }
        order.sort(Comparator.comparingDouble((Integer idx) -> probabilities[idx]).reversed());
        Map<String, LabelEntry> mapping = ensureLabels();
        List<SpeciesCandidate> candidates = new ArrayList<>(topK);
        for (int idx : order.subList(0, Math.min(topK, order.size()))) {
            LabelEntry label = mapping.get(String.valueOf(idx));
            String scientificName = label != null && label.scientificName() != null ? label.scientificName() : "Unknown_" + idx;
            String commonName = label != null && label.commonName() != null ? label.commonName() : "Unknown";
            candidates.add(new SpeciesCandidate(scientificName, commonName, Math.min(probabilities[idx], 1.0)));
        }
        return candidates;
    }

    private FloatBuffer toTensorData(BufferedImage image, int inputSize) {
        int resizeShort = Math.round(inputSize * 256f / 224f);
        double scale = resizeShort / (double) Math.min(image.getWidth(), image.getHeight());
        int scaledWidth = Math.max(inputSize, (int) Math.round(image.getWidth() * scale));
        int scaledHeight = Math.max(inputSize, (int) Math.round(image.getHeight() * scale));
        int offsetX = (scaledWidth - inputSize) / 2;
        int offsetY = (scaledHeight - inputSize) / 2;

        BufferedImage resized = new BufferedImage(inputSize, inputSize, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = resized.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            graphics.drawImage(image, -offsetX, -offsetY, scaledWidth, scaledHeight, null);
        } finally {
            graphics.dispose();
        }

        int plane = inputSize * inputSize;
        FloatBuffer buffer = FloatBuffer.allocate(3 * plane);
        for (int y = 0; y < inputSize; y++) {
            for (int x = 0; x < inputSize; x++) {
                int rgb = resized.getRGB(x, y);
                int index = y * inputSize + x;
                buffer.put(index, (((rgb >> 16) & 0xFF) / 255f - MEAN[0]) / STD[0]);
                buffer.put(plane + index, (((rgb >> 8) & 0xFF) / 255f - MEAN[1]) / STD[1]);
                buffer.put(2 * plane + index, ((rgb & 0xFF) / 255f - MEAN[2]) / STD[2]);
            }
        }
        buffer.rewind();
        return buffer;
    }

    static double[] softmax(float[] logits) {
        double max = Double.NEGATIVE_INFINITY;
        for (float logit : logits) {
            max = Math.max(max, logit);
        }
        double sum = 0.0;
        double[] result = new double[logits.length];
        for (int i = 0; i < logits.length; i++) {
            result[i] = Math.exp(logits[i] - max);
            sum += result[i];
        }
        for (int i = 0; i < result.length; i++) {
            result[i] /= sum;
        }
        return result;
    }

    private OrtSession ensureSession() {
        OrtSession current = session;
        if (current != null) {
            return current;
        }
        synchronized (sessionLock) {
            if (session == null) {
                String modelPath = properties.modelPath();
                if (modelPath == null || modelPath.isBlank()) {
                    throw new IllegalStateException("camera-trap.classification.model-path must be configured");
                }
                Path path = Path.of(modelPath).toAbsolutePath();
                log.info("Loading species model from {}", path);
                try {
                    OrtSession.SessionOptions options = new OrtSession.SessionOptions();
                    options.setOptimizationLevel(OrtSession.SessionOptions.OptLevel.ALL_OPT);
                    session = environment.createSession(path.toString(), options);
                } catch (OrtException ex) {
                    throw new IllegalStateException("Unable to load species model " + path, ex);
                }
            }
            return session;
        }
    }

    private Map<String, LabelEntry> ensureLabels() {
        Map<String, LabelEntry> current = labels;
        if (current != null) {
            return current;
        }
        synchronized (sessionLock) {
            if (labels == null) {
                labels = loadLabels(properties.labelsPath());
            }
            return labels;
        }
    }

    private Map<String, LabelEntry> loadLabels(String labelsPath) {
        if (labelsPath == null || labelsPath.isBlank()) {
            log.warn("No species label file configured; predictions will use placeholder names");
            return Map.of();
        }
        try (InputStream input = Files.newInputStream(Path.of(labelsPath))) {
            Map<String, LabelEntry> loaded = new ObjectMapper().readValue(input, new TypeReference<Map<String, LabelEntry>>() {
            });
            log.info("Loaded {} species labels from {}", loaded.size(), labelsPath);
            return Map.copyOf(loaded);
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to read species labels from " + labelsPath, ex);
        }
    }

    @Override
    public void close() {
        OrtSession current = session;
        if (current != null) {
            try {
                current.close();
            } catch (OrtException ex) {
                log.warn("Failed to close species model session", ex);
            }
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record LabelEntry(
            @JsonProperty("scientific_name") String scientificName,
            @JsonProperty("common_name") String commonName) {
    }
}
