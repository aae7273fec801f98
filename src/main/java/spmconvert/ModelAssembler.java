package spmconvert;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Combines the normalization tables and the piece list into a {@link ModelDescriptor}
 * and writes it out.
 */
public final class ModelAssembler {

    private ModelAssembler() {
    }

    /**
     * Builds the model. The trainer's vocab size is the length of {@code pieces},
     * added tokens included.
     *
     * @param normalizer   byte &rarr; substitute table
     * @param denormalizer substitute &rarr; byte table
     * @param pieces       the assembled vocabulary
     * @return the model descriptor
     */
    public static ModelDescriptor assemble(NormalizationTable normalizer, NormalizationTable denormalizer,
                                           List<VocabPiece> pieces) {
        return new ModelDescriptor(normalizer, denormalizer, pieces, TrainerMetadata.bpe(pieces.size()));
    }

    /**
     * Serializes {@code model} and writes it to {@code target}, replacing any existing file.
     *
     * @param model  the model to write
     * @param target output file
     * @throws IOException if the file cannot be written
     */
    public static void write(ModelDescriptor model, Path target) throws IOException {
        ModelFileWriter.write(target, model.serialize());
    }
}
