package spmconvert;

/**
 * The chars map compiler rejected a table.
 *
 * <p>The byte remap table is a bijection, so this signals an internal error rather
 * than a problem with the user's input.</p>
 */
public class CharsMapCompileException extends IllegalStateException {

    public CharsMapCompileException(String message) {
        super(message);
    }

    public CharsMapCompileException(String message, Throwable cause) {
        super(message, cause);
    }
}
