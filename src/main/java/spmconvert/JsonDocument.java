package spmconvert;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Read-only view of a JSON document node with typed, path-aware lookups.
 *
 * <p>Every lookup distinguishes a missing field from a field of the wrong type
 * and reports the source file and JSON path (for example
 * {@code tokenizer.json: $.model.vocab}) in the resulting
 * {@link TokenizerSchemaException}.</p>
 */
public final class JsonDocument {
    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    private final JsonNode node;
    private final String source;
    private final String path;

    private JsonDocument(JsonNode node, String source, String path) {
        this.node = node;
        this.source = source;
        this.path = path;
    }

    /**
     * Reads and parses a JSON file whose root must be an object.
     *
     * @param file the file to read
     * @return the root document
     * @throws IOException               if the file cannot be read
     * @throws TokenizerParseException   if the content is not well-formed JSON
     * @throws TokenizerSchemaException  if the root is not a JSON object
     */
    public static JsonDocument read(Path file) throws IOException, TokenizerParseException, TokenizerSchemaException {
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new IOException("Cannot read " + file + ": " + e.getMessage(), e);
        }
        return parse(content, file.getFileName().toString());
    }

    /**
     * Parses JSON text whose root must be an object.
     *
     * @param json   the JSON text
     * @param source name used in error messages
     * @return the root document
     * @throws TokenizerParseException  if the content is not well-formed JSON
     * @throws TokenizerSchemaException if the root is not a JSON object
     */
    public static JsonDocument parse(String json, String source) throws TokenizerParseException, TokenizerSchemaException {
        return parse(json.getBytes(StandardCharsets.UTF_8), source);
    }

    private static JsonDocument parse(byte[] content, String source) throws TokenizerParseException, TokenizerSchemaException {
        JsonNode root;
        try {
            root = MAPPER.readTree(content);
        } catch (JsonProcessingException e) {
            JsonLocation loc = e.getLocation();
            String where = loc == null ? "" : " at line " + loc.getLineNr() + ", column " + loc.getColumnNr();
            throw new TokenizerParseException("Failed to parse " + source + where + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new TokenizerParseException("Failed to parse " + source + ": " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new TokenizerParseException("Failed to parse " + source + ": document is empty");
        }
        JsonDocument doc = new JsonDocument(root, source, "$");
        if (!root.isObject()) {
            throw doc.wrongType("an object");
        }
        return doc;
    }

    /**
     * @return the source file name used in error messages
     */
    public String source() {
        return source;
    }

    /**
     * @return the JSON path of this node, rooted at {@code $}
     */
    public String path() {
        return path;
    }

    public boolean isText() {
        return node.isTextual();
    }

    public boolean isObject() {
        return node.isObject();
    }

    /**
     * Returns the named child, or empty if it is absent or JSON {@code null}.
     *
     * @param field field name
     * @return the child document, if present
     */
    public Optional<JsonDocument> optional(String field) {
        JsonNode child = node.get(field);
        if (child == null || child.isNull()) {
            return Optional.empty();
        }
        return Optional.of(child(child, path + "." + field));
    }

    /**
     * Returns the named child, which must be present. An explicit JSON {@code null}
     * is returned as a child so that the typed accessors report it as a wrong type.
     *
     * @param field field name
     * @return the child document
     * @throws TokenizerSchemaException if the field is absent
     */
    public JsonDocument require(String field) throws TokenizerSchemaException {
        JsonNode child = node.get(field);
        if (child == null) {
            throw new TokenizerSchemaException(source + ": required field " + path + "." + field + " is missing");
        }
        return child(child, path + "." + field);
    }

    /**
     * @param field field name
     * @return the child object
     * @throws TokenizerSchemaException if the field is absent or not an object
     */
    public JsonDocument requireObject(String field) throws TokenizerSchemaException {
        JsonDocument child = require(field);
        if (!child.node.isObject()) {
            throw child.wrongType("an object");
        }
        return child;
    }

    /**
     * @param field field name
     * @return the string value
     * @throws TokenizerSchemaException if the field is absent or not a string
     */
    public String requireText(String field) throws TokenizerSchemaException {
        return require(field).asText();
    }

    /**
     * @param field field name
     * @return the boolean value
     * @throws TokenizerSchemaException if the field is absent or not a boolean
     */
    public boolean requireBoolean(String field) throws TokenizerSchemaException {
        JsonDocument child = require(field);
        if (!child.node.isBoolean()) {
            throw child.wrongType("a boolean");
        }
        return child.node.booleanValue();
    }

    /**
     * Returns the elements of the named array; an absent or {@code null} field
     * yields an empty list.
     *
     * @param field field name
     * @return the elements in document order
     * @throws TokenizerSchemaException if the field is present but not an array
     */
    public List<JsonDocument> optionalArray(String field) throws TokenizerSchemaException {
        Optional<JsonDocument> child = optional(field);
        if (child.isEmpty()) {
            return Collections.emptyList();
        }
        JsonDocument array = child.get();
        if (!array.node.isArray()) {
            throw array.wrongType("an array");
        }
        List<JsonDocument> elements = new ArrayList<>(array.node.size());
        for (int i = 0; i < array.node.size(); i++) {
            elements.add(child(array.node.get(i), array.path + "[" + i + "]"));
        }
        return elements;
    }

    /**
     * Returns the fields of this object in document order.
     *
     * @return field name &rarr; child document
     * @throws TokenizerSchemaException if this node is not an object
     */
    public Map<String, JsonDocument> fields() throws TokenizerSchemaException {
        if (!node.isObject()) {
            throw wrongType("an object");
        }
        Map<String, JsonDocument> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            fields.put(e.getKey(), child(e.getValue(), path + "[" + quote(e.getKey()) + "]"));
        }
        return fields;
    }

    /**
     * @return this node as a string
     * @throws TokenizerSchemaException if this node is not a string
     */
    public String asText() throws TokenizerSchemaException {
        if (!node.isTextual()) {
            throw wrongType("a string");
        }
        return node.textValue();
    }

    /**
     * @return this node as a 32-bit integer
     * @throws TokenizerSchemaException if this node is not an integral number in int range
     */
    public int asInt() throws TokenizerSchemaException {
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw wrongType("a 32-bit integer");
        }
        return node.intValue();
    }

    private JsonDocument child(JsonNode child, String childPath) {
        return new JsonDocument(child, source, childPath);
    }

    private TokenizerSchemaException wrongType(String expected) {
        return new TokenizerSchemaException(source + ": " + path + " must be " + expected
                + " but was " + node.getNodeType().name().toLowerCase(Locale.ROOT));
    }

    private static String quote(String s) {
        return "\"" + s.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    @Override
    public String toString() {
        return source + ": " + path;
    }
}
