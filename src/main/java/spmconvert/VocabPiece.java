package spmconvert;

import java.util.Objects;

/**
 * One entry of the assembled vocabulary.
 */
public final class VocabPiece {
    private final String piece;
    private final PieceKind kind;
    private final float score;

    public VocabPiece(String piece, PieceKind kind, float score) {
        this.piece = Objects.requireNonNull(piece, "piece");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.score = score;
    }

    public String piece() {
        return piece;
    }

    public PieceKind kind() {
        return kind;
    }

    public float score() {
        return score;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VocabPiece)) return false;
        VocabPiece that = (VocabPiece) o;
        return Float.compare(score, that.score) == 0 && piece.equals(that.piece) && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(piece, kind, score);
    }

    @Override
    public String toString() {
        return "(" + piece + ", " + kind + ", " + score + ")";
    }
}
