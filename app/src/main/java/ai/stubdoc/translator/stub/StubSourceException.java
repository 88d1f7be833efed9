package ai.stubdoc.translator.stub;

/**
 * Runtime exception raised when stub source text cannot be tokenised.
 */
public class StubSourceException extends RuntimeException {

    public StubSourceException(String message) {
        super(message);
    }
}
