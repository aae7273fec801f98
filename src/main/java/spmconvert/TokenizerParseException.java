package spmconvert;

/**
 * An input document is not well-formed JSON.
 */
public class TokenizerParseException extends ConversionException {

    public TokenizerParseException(String message, Throwable cause) {
        super(message, cause);
    }

    public TokenizerParseException(String message) {
        super(message);
    }
}
