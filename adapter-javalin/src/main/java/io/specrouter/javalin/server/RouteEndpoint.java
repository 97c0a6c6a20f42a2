package io.specrouter.javalin.server;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.specrouter.core.error.ModelValidationException;
import io.specrouter.core.error.RouteAbortException;
import io.specrouter.core.model.HttpHeaders;
import io.specrouter.core.model.RequestContext;
import io.specrouter.core.model.ValidationError;
import io.specrouter.core.route.Route;
import io.specrouter.core.schema.ModelInstance;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves one {@link Route}: decodes the JSON body, runs the route and writes the result.
 *
 * <p>Response mapping:
 * <ul>
 *   <li>success: {@code 200} with the handler result as JSON;
 *   <li>undecodable body or {@link ModelValidationException}: {@code 422} with
 *       {@code {"detail": [errors]}};
 *   <li>{@link RouteAbortException}: its status with {@code {"detail": message}};
 *   <li>anything else: {@code 500} with {@code {"detail": "Internal Server Error"}}.
 * </ul>
 *
 * Thread-safe: all request state is local to {@link #handle(Context)}.
 */
final class RouteEndpoint implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(RouteEndpoint.class);

    static final String JSON = "application/json";
    static final String INTERNAL_ERROR = "Internal Server Error";

    private final Route route;
    private final ObjectMapper mapper;

    RouteEndpoint(Route route, ObjectMapper mapper) {
        this.route = route;
        this.mapper = mapper;
    }

    @Override
    public void handle(Context ctx) throws Exception {
        ctx.contentType(JSON);

        JsonNode body;
        try {
            body = decode(ctx.body());
        } catch (JsonProcessingException e) {
            LOG.debug("Undecodable body on {} {}: {}", route.method(), route.path(), e.getOriginalMessage());
            write(ctx, 422, validationDetail(List.of(jsonInvalid(e))));
            return;
        }

        try {
            Object result = route.invoke(body, requestContext(ctx));
            write(ctx, 200, toJson(result));
            LOG.debug("Served {} {} -> 200", route.method(), route.path());
        } catch (ModelValidationException e) {
            LOG.debug("Rejected {} {}: {}", route.method(), route.path(), e.getMessage());
            write(ctx, e.status(), validationDetail(e.errors()));
        } catch (RouteAbortException e) {
            LOG.debug("Aborted {} {} with {}: {}", route.method(), route.path(), e.status(), e.getMessage());
            write(ctx, e.status(), mapper.createObjectNode().put("detail", e.getMessage()));
        } catch (RuntimeException e) {
            LOG.error("Handler failed on {} {}: {}", route.method(), route.path(), e.getMessage(), e);
            write(ctx, 500, mapper.createObjectNode().put("detail", INTERNAL_ERROR));
        }
    }

    private JsonNode decode(String text) throws JsonProcessingException {
        if (text == null || text.isBlank()) {
            return null;
        }
        return mapper.readTree(text);
    }

    private RequestContext requestContext(Context ctx) {
        Map<String, String> query = new LinkedHashMap<>();
        ctx.queryParamMap().forEach((name, values) -> {
            if (!values.isEmpty()) {
                query.put(name, values.get(0));
            }
        });
        return new RequestContext(
                route.method(), route.path(), HttpHeaders.of(ctx.headerMap()), query, ctx.pathParamMap());
    }

    private JsonNode toJson(Object result) {
        if (result == null) {
            return mapper.nullNode();
        }
        if (result instanceof ModelInstance instance) {
            return instance.json();
        }
        if (result instanceof JsonNode node) {
            return node;
        }
        return mapper.valueToTree(result);
    }

    private void write(Context ctx, int status, JsonNode payload) throws JsonProcessingException {
        ctx.status(status);
        ctx.result(mapper.writeValueAsString(payload));
    }

    // --- Error payloads ---

    private ObjectNode validationDetail(List<ValidationError> errors) {
        ObjectNode envelope = mapper.createObjectNode();
        ArrayNode detail = envelope.putArray("detail");
        for (ValidationError error : errors) {
            ObjectNode item = detail.addObject();
            item.put("type", error.type());
            ArrayNode loc = item.putArray("loc");
            for (Object segment : error.loc()) {
                if (segment instanceof Integer index) {
                    loc.add(index);
                } else {
                    loc.add(String.valueOf(segment));
                }
            }
            item.put("msg", error.msg());
            if (error.input() != null) {
                item.set("input", error.input());
            }
            if (error.ctx() != null && !error.ctx().isEmpty()) {
                item.set("ctx", mapper.valueToTree(error.ctx()));
            }
        }
        return envelope;
    }

    private static ValidationError jsonInvalid(JsonProcessingException e) {
        JsonLocation location = e.getLocation();
        int offset = location != null && location.getCharOffset() >= 0 ? (int) location.getCharOffset() : 0;
        return new ValidationError(
                "json_invalid",
                List.of("body", offset),
                "JSON decode error",
                null,
                Map.of("error", String.valueOf(e.getOriginalMessage())));
    }
}
