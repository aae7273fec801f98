package spmconvert;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

/**
 * Converts a Hugging Face byte-level BPE tokenizer into a SentencePiece model file.
 *
 * <p>The pipeline runs in a fixed order and stops at the first failure:</p>
 * <ol>
 *   <li>load {@code tokenizer_config.json}</li>
 *   <li>load {@code tokenizer.json}</li>
 *   <li>build the normalizer and denormalizer tables from the byte remap table</li>
 *   <li>assemble the vocabulary</li>
 *   <li>assemble the model</li>
 *   <li>serialize and write the output file</li>
 * </ol>
 *
 * <p>Nothing is written unless every step succeeds, and an existing output file is
 * either fully replaced or left as it was. Converting the same input twice yields
 * byte-identical files.</p>
 */
public final class HfTokenizerConverter {
    private static final Logger LOGGER = ConverterLogging.getLogger(HfTokenizerConverter.class);

    private HfTokenizerConverter() {
    }

    /**
     * Enables or disables progress logging for the converter.
     *
     * @param enabled {@code true} to log at {@code INFO}, {@code false} to disable logging
     */
    public static void setVerboseLogging(boolean enabled) {
        ConverterLogging.setVerbose(enabled);
    }

    /**
     * Converts the tokenizer in {@code inputDir} and writes the model to {@code outputFile}.
     *
     * @param inputDir   directory holding {@code tokenizer_config.json} and {@code tokenizer.json}
     * @param outputFile model file to create or replace; parent directories are created
     * @return the model that was written
     * @throws IOException                 if an input cannot be read or the output cannot be written
     * @throws TokenizerParseException     if an input is not well-formed JSON
     * @throws TokenizerSchemaException    if an input misses a required field or has inconsistent ids
     * @throws CharsMapCompileException    if a normalization table cannot be compiled (internal error)
     */
    public static ModelDescriptor convert(Path inputDir, Path outputFile) throws IOException, ConversionException {
        TokenizerFiles files = TokenizerFiles.load(inputDir);
        ModelDescriptor model = convert(files);
        ModelAssembler.write(model, outputFile);
        LOGGER.info(() -> "Converted " + inputDir + " -> " + outputFile + " (" + model.trainer() + ")");
        return model;
    }

    /**
     * Builds the model from already loaded documents without writing it.
     *
     * @param files the loaded tokenizer documents
     * @return the model
     * @throws TokenizerSchemaException if a document misses a required field or has inconsistent ids
     * @throws CharsMapCompileException if a normalization table cannot be compiled (internal error)
     */
    public static ModelDescriptor convert(TokenizerFiles files) throws TokenizerSchemaException {
        List<ByteRemapTable.Entry> remap = ByteRemapTable.build();
        NormalizationTable normalizer = CharsMapCompiler.forwardTable(remap);
        NormalizationTable denormalizer = CharsMapCompiler.inverseTable(remap);

        List<VocabPiece> pieces = VocabAssembler.assemble(files.config(), files.tokenizer());
        return ModelAssembler.assemble(normalizer, denormalizer, pieces);
    }
}
