package pl.marcinmilkowski.word_space.vocab;

import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sorted, immutable bijection between distinct tokens and dense indices [0, size).
 *
 * Index order is lexicographic by Unicode code point ({@link #CODE_POINT_ORDER}),
 * so it does not depend on the order in which the corpus was scanned.
 */
public final class Vocabulary {

    /**
     * Compares strings code point by code point. Unlike {@link String#compareTo},
     * characters outside the BMP sort after U+E000..U+FFFF.
     */
    public static final Comparator<String> CODE_POINT_ORDER = Vocabulary::compareCodePoints;

    private final List<String> tokens;
    private final Map<String, Integer> indexByToken;

    private Vocabulary(List<String> tokens) {
        this.tokens = tokens;
        Map<String, Integer> index = new HashMap<>(Math.max(16, tokens.size() * 2));
        for (int i = 0; i < tokens.size(); i++) {
            index.put(tokens.get(i), i);
        }
        this.indexByToken = index;
    }

    /**
     * Wrap an already sorted, duplicate-free token list.
     *
     * @throws IllegalArgumentException if the tokens are not strictly ascending
     */
    public static Vocabulary ofSorted(List<String> sortedTokens) {
        List<String> copy = List.copyOf(sortedTokens);
        for (int i = 1; i < copy.size(); i++) {
            if (compareCodePoints(copy.get(i - 1), copy.get(i)) >= 0) {
                throw new IllegalArgumentException("Tokens must be strictly ascending, found '"
                    + copy.get(i - 1) + "' before '" + copy.get(i) + "'");
            }
        }
        return new Vocabulary(copy);
    }

    /**
     * Tokens in index order.
     */
    public List<String> tokens() {
        return tokens;
    }

    public int size() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public boolean contains(String token) {
        return indexByToken.containsKey(token);
    }

    /**
     * @throws UnknownTokenException if the token is not in this vocabulary
     */
    public int indexOf(String token) {
        Integer index = indexByToken.get(token);
        if (index == null) {
            throw new UnknownTokenException(token);
        }
        return index;
    }

    public String tokenAt(int index) {
        return tokens.get(index);
    }

    /**
     * Token to index mapping, iterating in index order.
     */
    public Map<String, Integer> toIndexMap() {
        Map<String, Integer> map = new LinkedHashMap<>();
        for (int i = 0; i < tokens.size(); i++) {
            map.put(tokens.get(i), i);
        }
        return Collections.unmodifiableMap(map);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Vocabulary)) return false;
        return tokens.equals(((Vocabulary) o).tokens);
    }

    @Override
    public int hashCode() {
        return tokens.hashCode();
    }

    @Override
    public String toString() {
        return String.format("Vocabulary[%d tokens]", tokens.size());
    }

    private static int compareCodePoints(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            int ca = a.codePointAt(i);
            int cb = b.codePointAt(j);
            if (ca != cb) {
                return Integer.compare(ca, cb);
            }
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return Integer.compare(a.length() - i, b.length() - j);
    }
}
