package io.specrouter.core.validator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.specrouter.core.error.CompanionFileException;
import io.specrouter.core.error.CompanionFileException.Reason;
import io.specrouter.core.error.ContractReadException;
import io.specrouter.core.model.ContractDocument;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Requires documentation resources next to the contract, sharing its base name: {@code <base>.md}
 * with non-blank text and {@code <base>.jsonld} holding a JSON object.
 */
public final class CompanionFilesValidator implements ContractValidator {

    public static final String NAME = "companion-files";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void validate(ContractDocument document) {
        String source = document.source().toString();
        Path dir = document.source().toAbsolutePath().getParent();
        String base = document.baseName();

        Path markdown = dir.resolve(base + ".md");
        readNonBlank(markdown, source);

        Path linkedData = dir.resolve(base + ".jsonld");
        String jsonLd = readNonBlank(linkedData, source);
        JsonNode parsed;
        try {
            parsed = MAPPER.readTree(jsonLd);
        } catch (JsonProcessingException e) {
            throw new CompanionFileException(
                    "Linked data file is not valid JSON: " + linkedData + " (" + e.getOriginalMessage() + ")",
                    source,
                    linkedData.toString(),
                    Reason.MALFORMED);
        }
        if (parsed == null || !parsed.isObject()) {
            throw new CompanionFileException(
                    "Linked data file must contain a JSON object: " + linkedData,
                    source,
                    linkedData.toString(),
                    Reason.MALFORMED);
        }
    }

    private static String readNonBlank(Path file, String source) {
        if (!Files.isRegularFile(file)) {
            throw new CompanionFileException(
                    "Companion file is missing: " + file, source, file.toString(), Reason.MISSING);
        }
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ContractReadException("Failed to read companion file " + file, e, source);
        }
        if (text.isBlank()) {
            throw new CompanionFileException("Companion file is empty: " + file, source, file.toString(), Reason.EMPTY);
        }
        return text;
    }
}
