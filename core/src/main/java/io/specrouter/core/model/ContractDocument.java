package io.specrouter.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.specrouter.core.error.ContractReadException;
import io.specrouter.core.error.InvalidJsonException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * One parsed contract file. The root tree is owned by this record and must not be mutated;
 * validators work on {@link #copyOfRoot()}.
 *
 * @param source where the contract was read from (may be a synthetic path for in-memory text)
 * @param text   the raw contract text
 * @param root   the parsed JSON tree
 */
public record ContractDocument(Path source, String text, JsonNode root) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public ContractDocument {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(root, "root must not be null");
    }

    /**
     * Reads and parses a contract file as UTF-8 JSON.
     *
     * @throws ContractReadException if the file cannot be read
     * @throws InvalidJsonException  if the content is not a JSON object
     */
    public static ContractDocument load(Path path) {
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ContractReadException("Failed to read contract: " + e.getMessage(), e, path.toString());
        }
        return parse(path, text);
    }

    /**
     * Parses contract text that is already in memory.
     *
     * @throws InvalidJsonException if the text is not a JSON object
     */
    public static ContractDocument parse(Path source, String text) {
        JsonNode root;
        try {
            root = MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new InvalidJsonException(
                    "Contract is not valid JSON: " + e.getOriginalMessage(), e, source.toString());
        }
        if (root == null || !root.isObject()) {
            throw new InvalidJsonException("Contract root must be a JSON object", null, source.toString());
        }
        return new ContractDocument(source, text, root);
    }

    /** A deep copy of the root tree that the caller may freely mutate. */
    public JsonNode copyOfRoot() {
        return root.deepCopy();
    }

    /** The file name without its last extension, used to locate companion resources. */
    public String baseName() {
        String fileName = source.getFileName() != null ? source.getFileName().toString() : source.toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
