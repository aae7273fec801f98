package spmconvert;

import sentencepiece.SentencepieceModel.TrainerSpec;

/**
 * Trainer section of the model: the segmentation algorithm and the final vocabulary size.
 */
public final class TrainerMetadata {
    private final TrainerSpec.ModelType modelType;
    private final int vocabSize;

    private TrainerMetadata(TrainerSpec.ModelType modelType, int vocabSize) {
        this.modelType = modelType;
        this.vocabSize = vocabSize;
    }

    /**
     * @param vocabSize number of pieces in the model
     * @return metadata tagging the model as BPE
     */
    public static TrainerMetadata bpe(int vocabSize) {
        if (vocabSize < 0) {
            throw new IllegalArgumentException("Negative vocab size: " + vocabSize);
        }
        return new TrainerMetadata(TrainerSpec.ModelType.BPE, vocabSize);
    }

    public TrainerSpec.ModelType modelType() {
        return modelType;
    }

    public int vocabSize() {
        return vocabSize;
    }

    TrainerSpec toProto() {
        return TrainerSpec.newBuilder()
                .setModelType(modelType)
                .setVocabSize(vocabSize)
                .build();
    }

    @Override
    public String toString() {
        return "{model_type=" + modelType + ", vocab_size=" + vocabSize + "}";
    }
}
