package spmconvert;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VocabAssemblerTest {

    private static Map<String, Integer> abc() {
        Map<String, Integer> vocab = new LinkedHashMap<>();
        vocab.put("a", 0);
        vocab.put("b", 1);
        vocab.put("c", 2);
        return vocab;
    }

    @Test
    void testPiecesFollowIdOrderWithDescendingScores() throws Exception {
        List<VocabPiece> pieces = VocabAssembler.assemble(abc(), "b", List.of());
        assertEquals(Arrays.asList(
                new VocabPiece("a", PieceKind.NORMAL, 0),
                new VocabPiece("b", PieceKind.UNKNOWN, -1),
                new VocabPiece("c", PieceKind.NORMAL, -2)
        ), pieces);
    }

    @Test
    void testIdOrderDoesNotDependOnMapOrder() throws Exception {
        Map<String, Integer> vocab = new LinkedHashMap<>();
        vocab.put("c", 2);
        vocab.put("a", 0);
        vocab.put("b", 1);
        List<VocabPiece> pieces = VocabAssembler.assemble(vocab, "b", List.of());
        assertEquals("a", pieces.get(0).piece());
        assertEquals("b", pieces.get(1).piece());
        assertEquals("c", pieces.get(2).piece());
    }

    @Test
    void testNormalizedAddedTokenIsAppended() throws Exception {
        List<VocabPiece> pieces = VocabAssembler.assemble(abc(), "b", List.of(new AddedToken("<pad>", true)));
        assertEquals(4, pieces.size());
        assertEquals(new VocabPiece("<pad>", PieceKind.USER_DEFINED, -3), pieces.get(3));
    }

    @Test
    void testSkippedAddedTokenStillConsumesItsIndex() throws Exception {
        List<VocabPiece> pieces = VocabAssembler.assemble(abc(), "b", Arrays.asList(
                new AddedToken("<s>", false),
                new AddedToken("<x>", true),
                new AddedToken("</s>", false),
                new AddedToken("<y>", true)));
        assertEquals(5, pieces.size());
        assertEquals(new VocabPiece("<x>", PieceKind.USER_DEFINED, -4), pieces.get(3));
        assertEquals(new VocabPiece("<y>", PieceKind.USER_DEFINED, -6), pieces.get(4));
    }

    @Test
    void testScoresStrictlyDecrease() throws Exception {
        List<VocabPiece> pieces = VocabAssembler.assemble(abc(), "a", Arrays.asList(
                new AddedToken("<x>", true), new AddedToken("<z>", false), new AddedToken("<y>", true)));
        for (int i = 1; i < pieces.size(); i++) {
            assertTrue(pieces.get(i).score() < pieces.get(i - 1).score(), "at " + i);
        }
    }

    @Test
    void testMissingUnknownTokenMarksNothing() throws Exception {
        List<VocabPiece> pieces = VocabAssembler.assemble(abc(), "<unk>", List.of());
        assertTrue(pieces.stream().noneMatch(p -> p.kind() == PieceKind.UNKNOWN));
    }

    @Test
    void testIdGapIsSchemaError() {
        Map<String, Integer> vocab = new LinkedHashMap<>();
        vocab.put("a", 0);
        vocab.put("b", 1);
        vocab.put("d", 3);
        TokenizerSchemaException e = assertThrows(TokenizerSchemaException.class,
                () -> VocabAssembler.assemble(vocab, "a", List.of()));
        assertTrue(e.getMessage().contains("3"), e.getMessage());
    }

    @Test
    void testDuplicateAndNegativeIdsAreSchemaErrors() {
        Map<String, Integer> dup = new LinkedHashMap<>();
        dup.put("a", 0);
        dup.put("b", 0);
        TokenizerSchemaException e = assertThrows(TokenizerSchemaException.class,
                () -> VocabAssembler.assemble(dup, "a", List.of()));
        assertTrue(e.getMessage().contains("\"a\"") && e.getMessage().contains("\"b\""), e.getMessage());

        Map<String, Integer> negative = new LinkedHashMap<>();
        negative.put("a", -1);
        assertThrows(TokenizerSchemaException.class, () -> VocabAssembler.assemble(negative, "a", List.of()));
    }

    @Test
    void testAssembleFromDocuments() throws Exception {
        JsonDocument config = JsonDocument.parse("{\"unk_token\": \"b\"}", "tokenizer_config.json");
        JsonDocument tokenizer = JsonDocument.parse("{\"model\": {\"vocab\": {\"a\": 0, \"b\": 1, \"c\": 2}},"
                + " \"added_tokens\": [{\"id\": 3, \"content\": \"<pad>\", \"normalized\": true}]}", "tokenizer.json");
        List<VocabPiece> pieces = VocabAssembler.assemble(config, tokenizer);
        assertEquals(4, pieces.size());
        assertEquals(PieceKind.UNKNOWN, pieces.get(1).kind());
        assertEquals(new VocabPiece("<pad>", PieceKind.USER_DEFINED, -3), pieces.get(3));
    }

    @Test
    void testAbsentAddedTokensMeansNone() throws Exception {
        JsonDocument config = JsonDocument.parse("{\"unk_token\": \"a\"}", "tokenizer_config.json");
        JsonDocument tokenizer = JsonDocument.parse("{\"model\": {\"vocab\": {\"a\": 0}}}", "tokenizer.json");
        assertEquals(1, VocabAssembler.assemble(config, tokenizer).size());
    }

    @Test
    void testUnknownTokenInAddedTokenForm() throws Exception {
        JsonDocument config = JsonDocument.parse(
                "{\"unk_token\": {\"__type\": \"AddedToken\", \"content\": \"<unk>\", \"normalized\": true}}",
                "tokenizer_config.json");
        assertEquals("<unk>", VocabAssembler.readUnkToken(config));
    }

    @Test
    void testMissingUnknownTokenFieldIsSchemaError() throws Exception {
        JsonDocument config = JsonDocument.parse("{\"bos_token\": \"<s>\"}", "tokenizer_config.json");
        JsonDocument tokenizer = JsonDocument.parse("{\"model\": {\"vocab\": {\"a\": 0}}}", "tokenizer.json");
        TokenizerSchemaException e = assertThrows(TokenizerSchemaException.class,
                () -> VocabAssembler.assemble(config, tokenizer));
        assertEquals("tokenizer_config.json: required field $.unk_token is missing", e.getMessage());
    }

    @Test
    void testNullUnknownTokenIsWrongType() throws Exception {
        JsonDocument config = JsonDocument.parse("{\"unk_token\": null}", "tokenizer_config.json");
        JsonDocument tokenizer = JsonDocument.parse("{\"model\": {\"vocab\": {\"a\": 0}}}", "tokenizer.json");
        TokenizerSchemaException e = assertThrows(TokenizerSchemaException.class,
                () -> VocabAssembler.assemble(config, tokenizer));
        assertEquals("tokenizer_config.json: $.unk_token must be a string but was null", e.getMessage());
    }

    @Test
    void testMissingVocabIsSchemaError() throws Exception {
        JsonDocument config = JsonDocument.parse("{\"unk_token\": \"a\"}", "tokenizer_config.json");
        JsonDocument tokenizer = JsonDocument.parse("{\"model\": {\"type\": \"BPE\"}}", "tokenizer.json");
        TokenizerSchemaException e = assertThrows(TokenizerSchemaException.class,
                () -> VocabAssembler.assemble(config, tokenizer));
        assertEquals("tokenizer.json: required field $.model.vocab is missing", e.getMessage());
    }

    @Test
    void testMalformedRecordsAreSchemaErrors() throws Exception {
        JsonDocument stringId = JsonDocument.parse("{\"model\": {\"vocab\": {\"a\": \"0\"}}}", "tokenizer.json");
        TokenizerSchemaException e = assertThrows(TokenizerSchemaException.class,
                () -> VocabAssembler.readVocab(stringId));
        assertEquals("tokenizer.json: $.model.vocab[\"a\"] must be a 32-bit integer but was string", e.getMessage());

        JsonDocument noFlag = JsonDocument.parse("{\"added_tokens\": [{\"content\": \"<x>\"}]}", "tokenizer.json");
        e = assertThrows(TokenizerSchemaException.class, () -> VocabAssembler.readAddedTokens(noFlag));
        assertEquals("tokenizer.json: required field $.added_tokens[0].normalized is missing", e.getMessage());
    }
}
