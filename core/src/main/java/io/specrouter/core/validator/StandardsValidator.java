package io.specrouter.core.validator;

import com.fasterxml.jackson.databind.JsonNode;
import io.specrouter.core.error.AuthProviderHeaderMissingException;
import io.specrouter.core.error.AuthorizationHeaderMissingException;
import io.specrouter.core.error.NoEndpointsDefinedException;
import io.specrouter.core.error.OnlyOneEndpointAllowedException;
import io.specrouter.core.error.OnlyPostMethodAllowedException;
import io.specrouter.core.error.PostMethodIsMissingException;
import io.specrouter.core.error.ResponseBodyMissingException;
import io.specrouter.core.error.SchemaMissingException;
import io.specrouter.core.error.SecurityShouldNotBeDefinedException;
import io.specrouter.core.error.ServersShouldNotBeDefinedException;
import io.specrouter.core.error.WrongContentTypeException;
import io.specrouter.core.model.ContractDocument;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Enforces the single-endpoint data product convention:
 *
 * <ul>
 *   <li>no {@code servers} and no {@code security} sections;
 *   <li>exactly one path, declaring {@code post} and nothing else;
 *   <li>component schemas present, with request and response bodies declared as
 *       {@code application/json} and referencing an existing component;
 *   <li>a {@code 200} response with content;
 *   <li>{@code Authorization} and {@code X-Authorization-Provider} header parameters.
 * </ul>
 *
 * Rules are checked in that order and the first violation is raised. A missing request body is
 * allowed. The request and response bodies go through the same content check, so both report
 * {@link WrongContentTypeException} for a non-JSON media type.
 *
 * <p>The {@link #strict()} variant also requires the companion {@code .md} and {@code .jsonld}
 * files next to the contract.
 */
public class StandardsValidator implements ContractValidator {

    public static final String NAME = "standards";
    public static final String STRICT_NAME = "standards-strict";

    static final String JSON_MEDIA_TYPE = "application/json";
    static final String COMPONENT_PREFIX = "#/components/schemas/";
    static final String AUTHORIZATION_HEADER = "authorization";
    static final String AUTH_PROVIDER_HEADER = "x-authorization-provider";

    private final CompanionFilesValidator companionFiles;

    public StandardsValidator() {
        this(null);
    }

    private StandardsValidator(CompanionFilesValidator companionFiles) {
        this.companionFiles = companionFiles;
    }

    /** The standards checks plus the companion documentation files. */
    public static StandardsValidator strict() {
        return new StandardsValidator(new CompanionFilesValidator());
    }

    @Override
    public String name() {
        return companionFiles != null ? STRICT_NAME : NAME;
    }

    @Override
    public void validate(ContractDocument document) {
        String source = document.source().toString();
        JsonNode root = document.root();

        if (root.has("servers")) {
            throw new ServersShouldNotBeDefinedException("Servers should not be defined", source);
        }

        JsonNode paths = root.path("paths");
        if (!paths.isObject() || paths.isEmpty()) {
            throw new NoEndpointsDefinedException("No endpoints defined", source);
        }
        if (paths.size() > 1) {
            throw new OnlyOneEndpointAllowedException(
                    "Only one endpoint allowed, found " + paths.size(), source);
        }

        Iterator<String> names = paths.fieldNames();
        String path = names.next();
        JsonNode pathItem = paths.get(path);
        JsonNode post = pathItem.get("post");
        if (post == null || !post.isObject()) {
            throw new PostMethodIsMissingException("POST method is missing for " + path, source);
        }
        Set<String> methods = new HashSet<>();
        pathItem.fieldNames().forEachRemaining(methods::add);
        methods.remove("parameters");
        methods.remove("summary");
        methods.remove("description");
        if (!methods.equals(Set.of("post"))) {
            methods.remove("post");
            throw new OnlyPostMethodAllowedException(
                    "Only POST method allowed for " + path + ", found also " + methods, source);
        }

        JsonNode schemas = root.path("components").path("schemas");
        if (!schemas.isObject() || schemas.isEmpty()) {
            throw new SchemaMissingException("Component schemas are missing", source);
        }

        if (post.has("security") || root.has("security")) {
            throw new SecurityShouldNotBeDefinedException("Security should not be defined", source);
        }

        JsonNode requestContent = post.path("requestBody").path("content");
        if (hasContent(requestContent)) {
            validateComponentSchema(requestContent, schemas, "request body", source);
        }

        JsonNode okResponse = post.path("responses").path("200");
        JsonNode responseContent = okResponse.path("content");
        if (okResponse.isMissingNode() || !hasContent(responseContent)) {
            throw new ResponseBodyMissingException("Response body for status 200 is missing", source);
        }
        validateComponentSchema(responseContent, schemas, "response body", source);

        Set<String> headers = new HashSet<>();
        post.path("parameters").forEach(param -> {
            if ("header".equals(param.path("in").asText())) {
                headers.add(param.path("name").asText().toLowerCase(Locale.ROOT));
            }
        });
        pathItem.path("parameters").forEach(param -> {
            if ("header".equals(param.path("in").asText())) {
                headers.add(param.path("name").asText().toLowerCase(Locale.ROOT));
            }
        });
        if (!headers.contains(AUTHORIZATION_HEADER)) {
            throw new AuthorizationHeaderMissingException("Authorization header must be defined", source);
        }
        if (!headers.contains(AUTH_PROVIDER_HEADER)) {
            throw new AuthProviderHeaderMissingException(
                    "X-Authorization-Provider header must be defined", source);
        }

        if (companionFiles != null) {
            companionFiles.validate(document);
        }
    }

    /** An absent, {@code null} or empty {@code content} counts as no body. */
    private static boolean hasContent(JsonNode content) {
        return !content.isMissingNode() && !content.isNull() && !content.isEmpty();
    }

    /** Shared by request and response bodies. */
    private static void validateComponentSchema(JsonNode content, JsonNode schemas, String what, String source) {
        JsonNode json = content.get(JSON_MEDIA_TYPE);
        if (json == null) {
            throw new WrongContentTypeException(
                    "Content type of " + what + " must be " + JSON_MEDIA_TYPE + ", found " + fieldList(content),
                    source);
        }
        JsonNode ref = json.path("schema").path("$ref");
        if (!ref.isTextual()) {
            throw new SchemaMissingException("Schema reference missing for " + what, source);
        }
        String value = ref.asText();
        if (!value.startsWith(COMPONENT_PREFIX)) {
            throw new SchemaMissingException(
                    "Schema reference of " + what + " must point to " + COMPONENT_PREFIX + ", found " + value,
                    source);
        }
        String component = value.substring(COMPONENT_PREFIX.length());
        if (!schemas.has(component)) {
            throw new SchemaMissingException(
                    "Schema '" + component + "' referenced by " + what + " is not defined", source);
        }
    }

    private static String fieldList(JsonNode node) {
        Set<String> names = new LinkedHashSet<>();
        node.fieldNames().forEachRemaining(names::add);
        return names.toString();
    }
}
