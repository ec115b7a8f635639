package pl.marcinmilkowski.word_space.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.word_space.cooccurrence.CooccurrenceBuilder;
import pl.marcinmilkowski.word_space.reduce.DimensionReducer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads and provides access to the embedding pipeline configuration from JSON.
 *
 * Expected JSON structure:
 * {
 *   "version": "1.0",
 *   "window_size": 4,
 *   "dimensions": 2,
 *   "seed": 4355,
 *   "iterations": 10,
 *   "threads": 1,
 *   "lowercase": false,
 *   "boundary_markers": { "start": "START", "end": "END" }
 * }
 *
 * Only "version" is required; the other fields fall back to the pipeline defaults.
 */
public class EmbeddingConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(EmbeddingConfigLoader.class);

    public static final String DEFAULT_VERSION = "1.0";
    public static final int DEFAULT_DIMENSIONS = 2;

    private final String version;
    private final Path configPath;
    private final int windowSize;
    private final int dimensions;
    private final long seed;
    private final int iterations;
    private final int threads;
    private final boolean lowercase;
    private final BoundaryMarkers boundaryMarkers;

    /**
     * Load configuration from the specified path.
     *
     * @param configPath Path to the JSON file
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file is invalid
     */
    public EmbeddingConfigLoader(Path configPath) throws IOException {
        this(configPath, parse(configPath));
        logger.info("Loaded embedding config version {} from {}", version, configPath);
    }

    private EmbeddingConfigLoader(Path configPath, JSONObject root) {
        this.configPath = configPath;

        String parsedVersion = root.getString("version");
        if (parsedVersion == null || parsedVersion.isBlank()) {
            throw new IllegalArgumentException("Missing 'version' field in embedding config");
        }
        this.version = parsedVersion;

        this.windowSize = root.getIntValue("window_size", CooccurrenceBuilder.DEFAULT_WINDOW_SIZE);
        if (windowSize <= 0) {
            throw new IllegalArgumentException("'window_size' must be positive, got " + windowSize);
        }

        this.dimensions = root.getIntValue("dimensions", DEFAULT_DIMENSIONS);
        if (dimensions <= 0) {
            throw new IllegalArgumentException("'dimensions' must be positive, got " + dimensions);
        }

        this.seed = root.getLongValue("seed", DimensionReducer.DEFAULT_SEED);

        this.iterations = root.getIntValue("iterations", DimensionReducer.DEFAULT_ITERATIONS);
        if (iterations < 0) {
            throw new IllegalArgumentException("'iterations' must be >= 0, got " + iterations);
        }

        this.threads = root.getIntValue("threads", 1);
        if (threads <= 0) {
            throw new IllegalArgumentException("'threads' must be positive, got " + threads);
        }

        this.lowercase = root.getBooleanValue("lowercase", false);

        JSONObject markers = root.getJSONObject("boundary_markers");
        if (markers == null) {
            this.boundaryMarkers = null;
        } else {
            String start = markers.getString("start");
            String end = markers.getString("end");
            if (start == null || start.isBlank() || end == null || end.isBlank()) {
                throw new IllegalArgumentException("'boundary_markers' needs non-blank 'start' and 'end'");
            }
            this.boundaryMarkers = new BoundaryMarkers(start, end);
        }
    }

    private static JSONObject parse(Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            throw new IOException("Embedding config file not found: " + configPath);
        }
        String content = Files.readString(configPath);
        JSONObject root = JSON.parseObject(content);
        if (root == null) {
            throw new IllegalArgumentException("Embedding config is empty: " + configPath);
        }
        return root;
    }

    /**
     * Create the default configuration: window 4, 2 dimensions, seed 4355,
     * 10 iterations, no lowercasing, no boundary markers.
     */
    public static EmbeddingConfigLoader createDefault() {
        JSONObject root = new JSONObject();
        root.put("version", DEFAULT_VERSION);
        return new EmbeddingConfigLoader(null, root);
    }

    public String getVersion() { return version; }

    /**
     * Get the config file path, or null for the built-in default.
     */
    public Path getConfigPath() { return configPath; }

    public int getWindowSize() { return windowSize; }
    public int getDimensions() { return dimensions; }
    public long getSeed() { return seed; }
    public int getIterations() { return iterations; }
    public int getThreads() { return threads; }
    public boolean isLowercase() { return lowercase; }

    /**
     * Get the boundary markers, or null when documents are not wrapped.
     */
    public BoundaryMarkers getBoundaryMarkers() { return boundaryMarkers; }

    /**
     * Export the loaded config as a JSONObject.
     */
    public JSONObject toJson() {
        JSONObject root = new JSONObject();
        root.put("version", version);
        if (configPath != null) root.put("config_path", configPath.toString());
        root.put("window_size", windowSize);
        root.put("dimensions", dimensions);
        root.put("seed", seed);
        root.put("iterations", iterations);
        root.put("threads", threads);
        root.put("lowercase", lowercase);
        if (boundaryMarkers != null) root.put("boundary_markers", boundaryMarkers.toJson());
        return root;
    }

    /**
     * Tokens wrapped around every document.
     */
    public record BoundaryMarkers(String start, String end) {
        public JSONObject toJson() {
            JSONObject obj = new JSONObject();
            obj.put("start", start);
            obj.put("end", end);
            return obj;
        }
    }
}
