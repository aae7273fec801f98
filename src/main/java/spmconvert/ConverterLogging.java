package spmconvert;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loggers of the {@code spmconvert} package.
 *
 * <p>The package logger is silent until {@link HfTokenizerConverter#setVerboseLogging(boolean)}
 * enables it. Every class obtains its logger here, so the package is silent no matter
 * which public entry point is called first.</p>
 */
final class ConverterLogging {
    private static final Logger PACKAGE_LOGGER = Logger.getLogger(ConverterLogging.class.getPackageName());

    static {
        PACKAGE_LOGGER.setLevel(Level.OFF);
    }

    private ConverterLogging() {
    }

    static Logger getLogger(Class<?> type) {
        return Logger.getLogger(type.getName());
    }

    static void setVerbose(boolean enabled) {
        PACKAGE_LOGGER.setLevel(enabled ? Level.INFO : Level.OFF);
    }
}
