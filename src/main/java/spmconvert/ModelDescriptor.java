package spmconvert;

import sentencepiece.SentencepieceModel.ModelProto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable SentencePiece model: normalizer, denormalizer, pieces and trainer metadata.
 *
 * <p>Built in one step by {@link ModelAssembler#assemble}; the protobuf message is
 * only created on {@link #toProto()}.</p>
 */
public final class ModelDescriptor {
    private final NormalizationTable normalizer;
    private final NormalizationTable denormalizer;
    private final List<VocabPiece> pieces;
    private final TrainerMetadata trainer;

    ModelDescriptor(NormalizationTable normalizer, NormalizationTable denormalizer,
                    List<VocabPiece> pieces, TrainerMetadata trainer) {
        this.normalizer = normalizer;
        this.denormalizer = denormalizer;
        this.pieces = Collections.unmodifiableList(new ArrayList<>(pieces));
        this.trainer = trainer;
    }

    public NormalizationTable normalizer() {
        return normalizer;
    }

    public NormalizationTable denormalizer() {
        return denormalizer;
    }

    public List<VocabPiece> pieces() {
        return pieces;
    }

    public TrainerMetadata trainer() {
        return trainer;
    }

    /**
     * @return the SentencePiece {@code ModelProto} for this model
     */
    public ModelProto toProto() {
        ModelProto.Builder builder = ModelProto.newBuilder();
        for (VocabPiece p : pieces) {
            builder.addPieces(ModelProto.SentencePiece.newBuilder()
                    .setPiece(p.piece())
                    .setScore(p.score())
                    .setType(p.kind().toProto()));
        }
        return builder
                .setTrainerSpec(trainer.toProto())
                .setNormalizerSpec(normalizer.toProto())
                .setDenormalizerSpec(denormalizer.toProto())
                .build();
    }

    /**
     * Serializes the model in the SentencePiece wire format. The output is
     * identical for identical models.
     *
     * @return the serialized model
     */
    public byte[] serialize() {
        return toProto().toByteArray();
    }

    @Override
    public String toString() {
        return "<ModelDescriptor " + trainer + ", " + pieces.size() + " pieces>";
    }
}
