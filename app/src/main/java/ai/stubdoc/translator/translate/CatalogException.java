package ai.stubdoc.translator.translate;

/**
 * Runtime exception raised when a message catalog cannot be located or decoded.
 */
public class CatalogException extends RuntimeException {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
