package pl.marcinmilkowski.word_space.embedding;

/**
 * A word and its cosine similarity to a query word.
 *
 * Sorted by similarity descending.
 */
public record Neighbor(
    String word,
    int index,              // Vocabulary index of the word
    double similarity       // Cosine similarity, -1..1
) implements Comparable<Neighbor> {

    @Override
    public int compareTo(Neighbor other) {
        int bySimilarity = Double.compare(other.similarity, this.similarity);
        return bySimilarity != 0 ? bySimilarity : Integer.compare(this.index, other.index);
    }

    @Override
    public String toString() {
        return String.format("%s (%.4f)", word, similarity);
    }
}
