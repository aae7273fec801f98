package spmconvert;

import com.google.protobuf.ByteString;
import sentencepiece.SentencepieceModel;

/**
 * Compiled normalizer or denormalizer spec: a precompiled chars map plus the
 * text normalization flags the runtime applies around it.
 */
public final class NormalizationTable {
    private final String name;
    private final byte[] precompiledCharsMap;
    private final boolean addDummyPrefix;
    private final boolean removeExtraWhitespaces;
    private final boolean escapeWhitespaces;

    private NormalizationTable(String name, byte[] precompiledCharsMap,
                               boolean addDummyPrefix, boolean removeExtraWhitespaces, boolean escapeWhitespaces) {
        this.name = name;
        this.precompiledCharsMap = precompiledCharsMap.clone();
        this.addDummyPrefix = addDummyPrefix;
        this.removeExtraWhitespaces = removeExtraWhitespaces;
        this.escapeWhitespaces = escapeWhitespaces;
    }

    /**
     * Creates a table that performs byte substitution only: no dummy prefix, no
     * whitespace trimming and no whitespace escaping, so raw bytes round-trip exactly.
     *
     * @param name                normalizer name stored in the model
     * @param precompiledCharsMap blob from {@link CharsMapCompiler#compile(CharsMap)}
     * @return the table
     */
    public static NormalizationTable byteSubstitution(String name, byte[] precompiledCharsMap) {
        return new NormalizationTable(name, precompiledCharsMap, false, false, false);
    }

    public String name() {
        return name;
    }

    /**
     * @return a copy of the compiled chars map blob
     */
    public byte[] precompiledCharsMap() {
        return precompiledCharsMap.clone();
    }

    public boolean addDummyPrefix() {
        return addDummyPrefix;
    }

    public boolean removeExtraWhitespaces() {
        return removeExtraWhitespaces;
    }

    public boolean escapeWhitespaces() {
        return escapeWhitespaces;
    }

    /**
     * @return the decoded chars map
     */
    public PrecompiledCharsMap decode() {
        return PrecompiledCharsMap.decode(precompiledCharsMap);
    }

    SentencepieceModel.NormalizerSpec toProto() {
        return SentencepieceModel.NormalizerSpec.newBuilder()
                .setName(name)
                .setPrecompiledCharsmap(ByteString.copyFrom(precompiledCharsMap))
                .setAddDummyPrefix(addDummyPrefix)
                .setRemoveExtraWhitespaces(removeExtraWhitespaces)
                .setEscapeWhitespaces(escapeWhitespaces)
                .build();
    }

    @Override
    public String toString() {
        return "<NormalizationTable " + name + ", " + precompiledCharsMap.length + " bytes>";
    }
}
