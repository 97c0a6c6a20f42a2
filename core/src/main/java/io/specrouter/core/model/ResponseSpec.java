package io.specrouter.core.model;

/**
 * One declared response of an operation.
 *
 * @param status      HTTP status code
 * @param description free text, may be {@code null}
 * @param modelName   component schema name of the JSON body, or {@code null} when the response
 *                    declares no resolvable JSON schema reference
 */
public record ResponseSpec(int status, String description, String modelName) {

    public boolean hasModel() {
        return modelName != null;
    }
}
