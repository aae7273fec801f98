package spmconvert;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * The two documents of a Hugging Face tokenizer export.
 *
 * <p>{@code tokenizer_config.json} carries the special token configuration and
 * {@code tokenizer.json} the model vocabulary and added tokens. Both are read from
 * one directory, config first.</p>
 */
public final class TokenizerFiles {
    private static final Logger LOGGER = ConverterLogging.getLogger(TokenizerFiles.class);

    /**
     * File name of the tokenizer configuration document.
     */
    public static final String CONFIG_FILE = "tokenizer_config.json";

    /**
     * File name of the tokenizer document.
     */
    public static final String TOKENIZER_FILE = "tokenizer.json";

    private final JsonDocument config;
    private final JsonDocument tokenizer;

    public TokenizerFiles(JsonDocument config, JsonDocument tokenizer) {
        this.config = config;
        this.tokenizer = tokenizer;
    }

    /**
     * Loads both documents from {@code directory}.
     *
     * @param directory the Hugging Face tokenizer directory
     * @return the loaded documents
     * @throws IOException                 if the directory or a file cannot be read
     * @throws TokenizerParseException     if a file is not well-formed JSON
     * @throws TokenizerSchemaException    if a document root is not an object
     */
    public static TokenizerFiles load(Path directory)
            throws IOException, TokenizerParseException, TokenizerSchemaException {
        if (!Files.isDirectory(directory)) {
            throw new IOException("Not a tokenizer directory: " + directory);
        }
        Path configPath = directory.resolve(CONFIG_FILE);
        LOGGER.info(() -> "Loading " + configPath);
        JsonDocument config = JsonDocument.read(configPath);

        Path tokenizerPath = directory.resolve(TOKENIZER_FILE);
        LOGGER.info(() -> "Loading " + tokenizerPath);
        JsonDocument tokenizer = JsonDocument.read(tokenizerPath);

        return new TokenizerFiles(config, tokenizer);
    }

    /**
     * @return the {@code tokenizer_config.json} document
     */
    public JsonDocument config() {
        return config;
    }

    /**
     * @return the {@code tokenizer.json} document
     */
    public JsonDocument tokenizer() {
        return tokenizer;
    }
}
