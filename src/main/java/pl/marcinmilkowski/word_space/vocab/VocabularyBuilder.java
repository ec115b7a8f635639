package pl.marcinmilkowski.word_space.vocab;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.word_space.corpus.Corpus;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Collects the distinct tokens of a corpus into a sorted {@link Vocabulary}.
 * No normalization is applied: identity is exact and case-sensitive.
 */
public final class VocabularyBuilder {

    private static final Logger logger = LoggerFactory.getLogger(VocabularyBuilder.class);

    private VocabularyBuilder() {
    }

    public static Vocabulary build(Corpus corpus) {
        TreeSet<String> distinct = new TreeSet<>(Vocabulary.CODE_POINT_ORDER);
        for (List<String> document : corpus.documents()) {
            distinct.addAll(document);
        }
        logger.debug("Vocabulary: {} distinct tokens in {} documents", distinct.size(), corpus.size());
        return Vocabulary.ofSorted(new ArrayList<>(distinct));
    }
}
