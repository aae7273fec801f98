package spmconvert;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Assembles the scored piece list from a Hugging Face vocabulary and its added tokens.
 *
 * <p>Pieces are emitted in id order with score {@code -id}, followed by every
 * normalized added token with score {@code -(N + j)}, where {@code N} is the
 * vocabulary size and {@code j} the token's position in the original
 * {@code added_tokens} list. Skipped (non-normalized) tokens still consume their
 * index, so scores depend only on list position.</p>
 *
 * <p>The scores only encode the order of entries in the source files; they are
 * not merge priorities.</p>
 */
public final class VocabAssembler {
    private static final Logger LOGGER = ConverterLogging.getLogger(VocabAssembler.class);

    private VocabAssembler() {
    }

    /**
     * Reads {@code unk_token} from the config document and {@code model.vocab} and
     * {@code added_tokens} from the tokenizer document, then assembles the pieces.
     *
     * @param config    the {@code tokenizer_config.json} document
     * @param tokenizer the {@code tokenizer.json} document
     * @return the ordered pieces
     * @throws TokenizerSchemaException if a required field is missing or malformed,
     *                                  or the vocabulary ids are not exactly {@code [0, N)}
     */
    public static List<VocabPiece> assemble(JsonDocument config, JsonDocument tokenizer) throws TokenizerSchemaException {
        String unkToken = readUnkToken(config);
        Map<String, Integer> vocab = readVocab(tokenizer);
        List<AddedToken> addedTokens = readAddedTokens(tokenizer);
        return assemble(vocab, unkToken, addedTokens);
    }

    /**
     * Assembles the pieces.
     *
     * @param vocab       token &rarr; id; ids must be exactly {@code 0..vocab.size()-1}
     * @param unkToken    the unknown token; no piece is marked unknown if it is not in {@code vocab}
     * @param addedTokens added tokens in file order
     * @return the ordered, unmodifiable piece list
     * @throws TokenizerSchemaException if an id is out of range, duplicated or missing
     */
    public static List<VocabPiece> assemble(Map<String, Integer> vocab, String unkToken, List<AddedToken> addedTokens)
            throws TokenizerSchemaException {
        String[] byId = orderById(vocab);
        int n = byId.length;

        List<VocabPiece> pieces = new ArrayList<>(n + addedTokens.size());
        boolean unkFound = false;
        for (int i = 0; i < n; i++) {
            String token = byId[i];
            boolean unk = token.equals(unkToken);
            unkFound |= unk;
            pieces.add(new VocabPiece(token, unk ? PieceKind.UNKNOWN : PieceKind.NORMAL, -i));
        }
        if (!unkFound) {
            LOGGER.warning(() -> "Unknown token \"" + unkToken + "\" is not in the vocabulary; no piece is marked UNKNOWN");
        }

        int skipped = 0;
        for (int j = 0; j < addedTokens.size(); j++) {
            AddedToken added = addedTokens.get(j);
            if (added.normalized()) {
                pieces.add(new VocabPiece(added.content(), PieceKind.USER_DEFINED, -(n + j)));
            } else {
                skipped++;
            }
        }

        final int skippedCount = skipped;
        LOGGER.info(() -> "Assembled " + pieces.size() + " pieces (" + n + " from vocab, "
                + (addedTokens.size() - skippedCount) + " added, " + skippedCount + " control tokens skipped)");
        return Collections.unmodifiableList(pieces);
    }

    private static String[] orderById(Map<String, Integer> vocab) throws TokenizerSchemaException {
        int n = vocab.size();
        String[] byId = new String[n];
        for (Map.Entry<String, Integer> e : vocab.entrySet()) {
            int id = e.getValue();
            if (id < 0 || id >= n) {
                throw new TokenizerSchemaException("Vocabulary id " + id + " of token \"" + e.getKey()
                        + "\" is outside [0, " + n + ")");
            }
            if (byId[id] != null) {
                throw new TokenizerSchemaException("Vocabulary id " + id + " is used by both \"" + byId[id]
                        + "\" and \"" + e.getKey() + "\"");
            }
            byId[id] = e.getKey();
        }
        for (int i = 0; i < n; i++) {
            if (byId[i] == null) {
                throw new TokenizerSchemaException("Vocabulary id " + i + " is not assigned to any token");
            }
        }
        return byId;
    }

    /**
     * Reads {@code unk_token}. Besides a plain string, the serialized added-token
     * form {@code {"content": "<unk>", ...}} written by newer exporters is accepted.
     *
     * @param config the {@code tokenizer_config.json} document
     * @return the unknown token string
     * @throws TokenizerSchemaException if the field is missing or has another type
     */
    static String readUnkToken(JsonDocument config) throws TokenizerSchemaException {
        JsonDocument unk = config.require("unk_token");
        if (unk.isObject()) {
            return unk.requireText("content");
        }
        return unk.asText();
    }

    /**
     * Reads {@code model.vocab}.
     *
     * @param tokenizer the {@code tokenizer.json} document
     * @return token &rarr; id in document order
     * @throws TokenizerSchemaException if the field is missing, not an object, or holds a non-integer id
     */
    static Map<String, Integer> readVocab(JsonDocument tokenizer) throws TokenizerSchemaException {
        JsonDocument vocab = tokenizer.requireObject("model").requireObject("vocab");
        Map<String, Integer> result = new LinkedHashMap<>();
        for (Map.Entry<String, JsonDocument> e : vocab.fields().entrySet()) {
            result.put(e.getKey(), e.getValue().asInt());
        }
        return result;
    }

    /**
     * Reads {@code added_tokens}; absent means none.
     *
     * @param tokenizer the {@code tokenizer.json} document
     * @return the added tokens in file order
     * @throws TokenizerSchemaException if a record lacks a string {@code content} or boolean {@code normalized}
     */
    static List<AddedToken> readAddedTokens(JsonDocument tokenizer) throws TokenizerSchemaException {
        List<AddedToken> tokens = new ArrayList<>();
        for (JsonDocument record : tokenizer.optionalArray("added_tokens")) {
            tokens.add(new AddedToken(record.requireText("content"), record.requireBoolean("normalized")));
        }
        return tokens;
    }
}
