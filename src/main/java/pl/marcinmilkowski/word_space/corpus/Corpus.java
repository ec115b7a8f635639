package pl.marcinmilkowski.word_space.corpus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An ordered sequence of documents, each an ordered sequence of tokens.
 *
 * Token order inside a document defines adjacency for windowing.
 * Documents are traversed in list order. Instances are immutable.
 */
public final class Corpus {

    private static final Corpus EMPTY = new Corpus(List.of());

    private final List<List<String>> documents;

    private Corpus(List<List<String>> documents) {
        this.documents = documents;
    }

    /**
     * Copy the given documents into a new corpus.
     *
     * @throws NullPointerException if any document or token is null
     */
    public static Corpus of(List<? extends List<String>> documents) {
        Objects.requireNonNull(documents, "documents");
        List<List<String>> copy = new ArrayList<>(documents.size());
        for (List<String> document : documents) {
            Objects.requireNonNull(document, "document");
            for (String token : document) {
                Objects.requireNonNull(token, "token");
            }
            copy.add(List.copyOf(document));
        }
        return new Corpus(Collections.unmodifiableList(copy));
    }

    public static Corpus empty() {
        return EMPTY;
    }

    public List<List<String>> documents() {
        return documents;
    }

    public List<String> document(int index) {
        return documents.get(index);
    }

    public int size() {
        return documents.size();
    }

    public boolean isEmpty() {
        return documents.isEmpty();
    }

    /**
     * Total number of tokens over all documents.
     */
    public long tokenCount() {
        long total = 0;
        for (List<String> document : documents) {
            total += document.size();
        }
        return total;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Corpus)) return false;
        return documents.equals(((Corpus) o).documents);
    }

    @Override
    public int hashCode() {
        return documents.hashCode();
    }

    @Override
    public String toString() {
        return String.format("Corpus[%d documents, %d tokens]", size(), tokenCount());
    }
}
