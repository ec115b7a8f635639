package pl.marcinmilkowski.word_space.embedding;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.word_space.vocab.Vocabulary;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes embeddings as JSON.
 *
 * Format:
 * {
 *   "dimensions": 2,
 *   "words": ["All", "END", ...],
 *   "vectors": [[0.41, -0.12], [1.02, 0.33], ...]
 * }
 *
 * Words must be in vocabulary (sorted) order; vectors[i] belongs to words[i].
 */
public final class EmbeddingJson {

    private static final Logger logger = LoggerFactory.getLogger(EmbeddingJson.class);

    private EmbeddingJson() {
    }

    public static JSONObject toJson(EmbeddingMatrix embedding) {
        JSONObject root = new JSONObject();
        root.put("dimensions", embedding.dimensions());
        root.put("words", new JSONArray(embedding.vocabulary().tokens()));

        JSONArray vectors = new JSONArray();
        for (int i = 0; i < embedding.size(); i++) {
            JSONArray row = new JSONArray();
            for (double v : embedding.row(i)) {
                row.add(v);
            }
            vectors.add(row);
        }
        root.put("vectors", vectors);
        return root;
    }

    /**
     * @throws IllegalArgumentException if the JSON does not describe a valid embedding
     */
    public static EmbeddingMatrix fromJson(JSONObject root) {
        if (root == null) {
            throw new IllegalArgumentException("Embedding JSON is empty");
        }
        JSONArray words = root.getJSONArray("words");
        JSONArray vectors = root.getJSONArray("vectors");
        if (words == null || vectors == null) {
            throw new IllegalArgumentException("Embedding JSON needs 'words' and 'vectors' arrays");
        }
        if (words.size() != vectors.size()) {
            throw new IllegalArgumentException("Got " + words.size() + " words but " + vectors.size() + " vectors");
        }
        int dimensions = root.getIntValue("dimensions", -1);
        if (dimensions <= 0) {
            throw new IllegalArgumentException("Missing or invalid 'dimensions' field");
        }

        List<String> tokens = new ArrayList<>(words.size());
        double[][] rows = new double[vectors.size()][];
        for (int i = 0; i < words.size(); i++) {
            String word = words.getString(i);
            if (word == null) {
                throw new IllegalArgumentException("Null word at index " + i);
            }
            tokens.add(word);

            JSONArray row = vectors.getJSONArray(i);
            if (row == null || row.size() != dimensions) {
                throw new IllegalArgumentException("Vector " + i + " ('" + word + "') must have "
                    + dimensions + " values");
            }
            rows[i] = new double[dimensions];
            for (int c = 0; c < dimensions; c++) {
                rows[i][c] = row.getDoubleValue(c);
            }
        }
        return EmbeddingMatrix.of(Vocabulary.ofSorted(tokens), rows);
    }

    public static void write(EmbeddingMatrix embedding, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = JSON.toJSONString(toJson(embedding), JSONWriter.Feature.PrettyFormat);
        Files.writeString(path, json, StandardCharsets.UTF_8);
        logger.info("Wrote {} to {}", embedding, path);
    }

    /**
     * @throws IOException if the file is missing or unreadable
     * @throws IllegalArgumentException if the content is not a valid embedding
     */
    public static EmbeddingMatrix read(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Embedding file not found: " + path);
        }
        String content = Files.readString(path, StandardCharsets.UTF_8);
        JSONObject root;
        try {
            root = JSON.parseObject(content);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Invalid embedding JSON in " + path + ": " + e.getMessage(), e);
        }
        EmbeddingMatrix embedding = fromJson(root);
        logger.info("Loaded {} from {}", embedding, path);
        return embedding;
    }
}
