package io.specrouter.core.openapi;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.specrouter.core.model.HttpMethod;
import io.specrouter.core.model.Parameter;
import io.specrouter.core.route.AdditionalResponse;
import io.specrouter.core.route.Route;
import io.specrouter.core.route.RouteTable;
import io.specrouter.core.schema.GeneratedModelModule;
import io.specrouter.core.schema.ModelType;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Renders a finalized {@link RouteTable} as an OpenAPI 3.1 document, the way the transport
 * publishes it on {@code /openapi.json}. Schemas are taken from the generated modules, so the
 * published document describes exactly what the routes validate.
 */
public final class OpenApiExporter {

    static final String OPENAPI_VERSION = "3.1.0";
    static final String SCHEMA_PREFIX = "#/components/schemas/";
    static final String HTTP_VALIDATION_ERROR = "HTTPValidationError";

    private static final String DEFS_PREFIX = "#/$defs/";
    private static final String JSON = "application/json";

    private final ObjectMapper mapper;

    public OpenApiExporter() {
        this(new ObjectMapper());
    }

    public OpenApiExporter(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /**
     * Builds the document.
     *
     * @param title   {@code info.title}
     * @param version {@code info.version}
     */
    public ObjectNode export(RouteTable table, String title, String version) {
        ObjectNode doc = mapper.createObjectNode();
        doc.put("openapi", OPENAPI_VERSION);
        ObjectNode info = doc.putObject("info");
        info.put("title", title);
        info.put("version", version);

        ObjectNode paths = doc.putObject("paths");
        for (Route route : table.routes()) {
            ObjectNode item = paths.has(route.path()) ? (ObjectNode) paths.get(route.path()) : paths.putObject(route.path());
            item.set(route.method().key(), operation(route));
        }

        ObjectNode schemas = doc.putObject("components").putObject("schemas");
        for (GeneratedModelModule module : table.modules()) {
            Iterator<Map.Entry<String, JsonNode>> defs = module.schemas().fields();
            while (defs.hasNext()) {
                Map.Entry<String, JsonNode> def = defs.next();
                if (!schemas.has(def.getKey())) {
                    schemas.set(def.getKey(), rewriteRefs(def.getValue()));
                }
            }
        }
        return doc;
    }

    /** The document as pretty-printed JSON text. */
    public String toJson(RouteTable table, String title, String version) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(export(table, title, version));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize OpenAPI document", e);
        }
    }

    private ObjectNode operation(Route route) {
        ObjectNode op = mapper.createObjectNode();
        op.put("summary", route.summary());
        if (route.description() != null) {
            op.put("description", route.description());
        }
        op.put("operationId", route.name());
        if (!route.tags().isEmpty()) {
            ArrayNode tags = op.putArray("tags");
            route.tags().forEach(tags::add);
        }
        if (route.deprecated()) {
            op.put("deprecated", true);
        }

        if (!route.headers().isEmpty()) {
            ArrayNode parameters = op.putArray("parameters");
            for (Parameter header : route.headers().values()) {
                ObjectNode param = parameters.addObject();
                param.put("name", header.name());
                param.put("in", header.location().value());
                param.put("required", header.required());
                if (header.description() != null) {
                    param.put("description", header.description());
                }
                param.putObject("schema").put("type", "string");
            }
        }

        ModelType request = route.requestModel();
        if (!request.isEmptyBody() && route.method() == HttpMethod.POST) {
            ObjectNode body = op.putObject("requestBody");
            body.put("required", true);
            ref(body.putObject("content").putObject(JSON).putObject("schema"), request.name());
        }

        ObjectNode responses = op.putObject("responses");
        ObjectNode ok = responses.putObject("200");
        ok.put("description", route.responseDescription());
        if (route.responseModel() != null) {
            ref(ok.putObject("content").putObject(JSON).putObject("schema"), route.responseModel().name());
        }
        for (Map.Entry<Integer, AdditionalResponse> entry : route.responses().entrySet()) {
            ObjectNode response = responses.putObject(String.valueOf(entry.getKey()));
            AdditionalResponse additional = entry.getValue();
            response.put("description", additional.description() != null ? additional.description() : "");
            if (additional.model() != null) {
                ref(response.putObject("content").putObject(JSON).putObject("schema"), additional.model().name());
            }
        }
        if (!responses.has("422")) {
            ObjectNode invalid = responses.putObject("422");
            invalid.put("description", "Validation Error");
            ref(invalid.putObject("content").putObject(JSON).putObject("schema"), HTTP_VALIDATION_ERROR);
        }
        return op;
    }

    private static void ref(ObjectNode schema, String modelName) {
        schema.put("$ref", SCHEMA_PREFIX + modelName);
    }

    // --- Helpers ---

    /** Points {@code $defs} references back at {@code components/schemas}. */
    private static JsonNode rewriteRefs(JsonNode node) {
        if (node.isObject()) {
            ObjectNode obj = (ObjectNode) node;
            Iterator<Map.Entry<String, JsonNode>> fields = obj.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                if ("$ref".equals(field.getKey()) && value.isTextual() && value.asText().startsWith(DEFS_PREFIX)) {
                    field.setValue(TextNode.valueOf(SCHEMA_PREFIX + value.asText().substring(DEFS_PREFIX.length())));
                } else {
                    rewriteRefs(value);
                }
            }
        } else if (node.isArray()) {
            node.forEach(OpenApiExporter::rewriteRefs);
        }
        return node;
    }
}
