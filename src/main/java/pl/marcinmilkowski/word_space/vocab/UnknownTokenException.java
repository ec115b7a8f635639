package pl.marcinmilkowski.word_space.vocab;

/**
 * Thrown when a token is looked up in a vocabulary that does not contain it.
 */
public class UnknownTokenException extends RuntimeException {

    private final String token;

    public UnknownTokenException(String token) {
        super("Token not in vocabulary: '" + token + "'");
        this.token = token;
    }

    public String getToken() {
        return token;
    }
}
