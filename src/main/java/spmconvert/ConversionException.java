package spmconvert;

/**
 * Base type for conversion failures caused by the content of the input documents.
 *
 * <p>Plain I/O failures are reported as {@link java.io.IOException}; internal
 * inconsistencies of the chars map compiler as {@link CharsMapCompileException}.</p>
 */
public class ConversionException extends Exception {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
