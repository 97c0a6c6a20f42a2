package io.specrouter.core.validator;

import com.fasterxml.jackson.databind.JsonNode;
import io.specrouter.core.error.UnsupportedVersionException;
import io.specrouter.core.model.ContractDocument;

/** Rejects contracts whose {@code openapi} version is not a 3.x version. Always runs first. */
public final class BaselineValidator implements ContractValidator {

    public static final String NAME = "baseline";

    static final String SUPPORTED_MAJOR = "3";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void validate(ContractDocument document) {
        JsonNode version = document.root().get("openapi");
        if (version == null || !version.isTextual()) {
            throw new UnsupportedVersionException(
                    "Missing or non-string 'openapi' version", document.source().toString());
        }
        String value = version.asText().trim();
        if (!value.equals(SUPPORTED_MAJOR) && !value.startsWith(SUPPORTED_MAJOR + ".")) {
            throw new UnsupportedVersionException(
                    "Unsupported OpenAPI version: " + value + " (only 3.x is supported)",
                    document.source().toString());
        }
    }
}
