package spmconvert;

import sentencepiece.SentencepieceModel.ModelProto.SentencePiece;

/**
 * Type of a vocabulary piece, mirroring the SentencePiece piece types this
 * converter emits.
 */
public enum PieceKind {
    /**
     * Ordinary piece from the trained vocabulary.
     */
    NORMAL(SentencePiece.Type.NORMAL),
    /**
     * The designated unknown token.
     */
    UNKNOWN(SentencePiece.Type.UNKNOWN),
    /**
     * Added token that is matched after normalization.
     */
    USER_DEFINED(SentencePiece.Type.USER_DEFINED);

    private final SentencePiece.Type protoType;

    PieceKind(SentencePiece.Type protoType) {
        this.protoType = protoType;
    }

    SentencePiece.Type toProto() {
        return protoType;
    }
}
