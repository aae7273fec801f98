package spmconvert;

import com.google.protobuf.InvalidProtocolBufferException;
import sentencepiece.SentencepieceModel.ModelProto;
import sentencepiece.SentencepieceModel.NormalizerSpec;
import sentencepiece.SentencepieceModel.TrainerSpec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Summary of a SentencePiece model file, used to inspect converter output.
 */
public final class ModelSummary {
    private final ModelProto proto;
    private final Map<ModelProto.SentencePiece.Type, Integer> typeCounts;

    private ModelSummary(ModelProto proto) {
        this.proto = proto;
        Map<ModelProto.SentencePiece.Type, Integer> counts = new EnumMap<>(ModelProto.SentencePiece.Type.class);
        for (ModelProto.SentencePiece p : proto.getPiecesList()) {
            counts.merge(p.getType(), 1, Integer::sum);
        }
        this.typeCounts = Collections.unmodifiableMap(counts);
    }

    /**
     * Reads a model file.
     *
     * @param modelFile the {@code .model} file
     * @return the summary
     * @throws IOException             if the file cannot be read
     * @throws TokenizerParseException if the file is not a SentencePiece model
     */
    public static ModelSummary read(Path modelFile) throws IOException, TokenizerParseException {
        byte[] bytes = Files.readAllBytes(modelFile);
        try {
            return new ModelSummary(ModelProto.parseFrom(bytes));
        } catch (InvalidProtocolBufferException e) {
            throw new TokenizerParseException("Not a SentencePiece model: " + modelFile, e);
        }
    }

    /**
     * @return the parsed model message
     */
    public ModelProto proto() {
        return proto;
    }

    public int pieceCount() {
        return proto.getPiecesCount();
    }

    /**
     * @return number of pieces per piece type; types with no pieces are absent
     */
    public Map<ModelProto.SentencePiece.Type, Integer> typeCounts() {
        return typeCounts;
    }

    public TrainerSpec.ModelType modelType() {
        return proto.getTrainerSpec().getModelType();
    }

    public int vocabSize() {
        return proto.getTrainerSpec().getVocabSize();
    }

    /**
     * @return the decoded normalizer chars map, or {@code null} if the model has none
     */
    public PrecompiledCharsMap normalizer() {
        return charsMap(proto.getNormalizerSpec());
    }

    /**
     * @return the decoded denormalizer chars map, or {@code null} if the model has none
     */
    public PrecompiledCharsMap denormalizer() {
        return proto.hasDenormalizerSpec() ? charsMap(proto.getDenormalizerSpec()) : null;
    }

    private static PrecompiledCharsMap charsMap(NormalizerSpec spec) {
        if (spec.getPrecompiledCharsmap().isEmpty()) {
            return null;
        }
        return PrecompiledCharsMap.decode(spec.getPrecompiledCharsmap().toByteArray());
    }

    /**
     * Renders a multi-line, human-readable description.
     *
     * @return the description
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("Model type:  ").append(modelType()).append('\n');
        sb.append("Vocab size:  ").append(vocabSize()).append('\n');
        sb.append("Pieces:      ").append(pieceCount()).append('\n');
        typeCounts.forEach((type, count) ->
                sb.append("  ").append(String.format("%-12s", type)).append(' ').append(count).append('\n'));
        appendSpec(sb, "Normalizer", proto.getNormalizerSpec());
        if (proto.hasDenormalizerSpec()) {
            appendSpec(sb, "Denormalizer", proto.getDenormalizerSpec());
        }
        return sb.toString();
    }

    private static void appendSpec(StringBuilder sb, String label, NormalizerSpec spec) {
        sb.append(label).append(": ").append(spec.getName())
                .append(" (charsmap ").append(spec.getPrecompiledCharsmap().size()).append(" bytes")
                .append(", add_dummy_prefix=").append(spec.getAddDummyPrefix())
                .append(", remove_extra_whitespaces=").append(spec.getRemoveExtraWhitespaces())
                .append(", escape_whitespaces=").append(spec.getEscapeWhitespaces())
                .append(")\n");
    }

    @Override
    public String toString() {
        return "<ModelSummary " + modelType() + ", " + pieceCount() + " pieces>";
    }
}
