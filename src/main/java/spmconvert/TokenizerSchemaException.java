package spmconvert;

/**
 * An input document is well-formed but misses a required field, holds a value of
 * the wrong type, or declares vocabulary ids that are not exactly {@code [0, N)}.
 */
public class TokenizerSchemaException extends ConversionException {

    public TokenizerSchemaException(String message) {
        super(message);
    }
}
