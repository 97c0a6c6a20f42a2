package io.specrouter.core.route;

import io.specrouter.core.model.Parameter;
import io.specrouter.core.schema.ModelType;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for one route while the route table is being assembled. Every field is nullable;
 * {@code null} means "not set here" and is filled from a lower-precedence source by
 * {@link #fillFrom(RouteInfo)}.
 *
 * <p>Not thread-safe. Once the table is finalized the instances it was built from are frozen and
 * reject further changes.
 */
public final class RouteInfo {

    private String description;
    private String name;
    private RouteNameFactory nameFactory;
    private String summary;
    private String responseDescription;
    private List<String> tags;
    private Boolean deprecated;
    private List<RouteDependency> dependencies;
    private Map<String, Parameter> headers;
    private ModelType requestModel;
    private ModelType responseModel;
    private Map<Integer, AdditionalResponse> responses;
    private RouteHandler handler;
    private boolean frozen;

    /** A registration with only a handler set. */
    public static RouteInfo of(RouteHandler handler) {
        return new RouteInfo().handler(handler);
    }

    /**
     * Copies into this instance every field that is {@code null} here and set on {@code other}.
     * Fields already set here are left untouched.
     *
     * @return this instance
     */
    public RouteInfo fillFrom(RouteInfo other) {
        checkMutable();
        if (other == null) {
            return this;
        }
        if (description == null) description = other.description;
        if (name == null) name = other.name;
        if (nameFactory == null) nameFactory = other.nameFactory;
        if (summary == null) summary = other.summary;
        if (responseDescription == null) responseDescription = other.responseDescription;
        if (tags == null) tags = other.tags;
        if (deprecated == null) deprecated = other.deprecated;
        if (dependencies == null) dependencies = other.dependencies;
        if (headers == null) headers = other.headers;
        if (requestModel == null) requestModel = other.requestModel;
        if (responseModel == null) responseModel = other.responseModel;
        if (responses == null) responses = other.responses;
        if (handler == null) handler = other.handler;
        return this;
    }

    /** An unfrozen copy of this instance. */
    public RouteInfo copy() {
        return new RouteInfo().fillFrom(this);
    }

    /** Rejects all further changes. */
    public RouteInfo freeze() {
        frozen = true;
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    // --- Fluent setters ---

    public RouteInfo description(String description) {
        checkMutable();
        this.description = description;
        return this;
    }

    public RouteInfo name(String name) {
        checkMutable();
        this.name = name;
        return this;
    }

    public RouteInfo nameFactory(RouteNameFactory nameFactory) {
        checkMutable();
        this.nameFactory = nameFactory;
        return this;
    }

    public RouteInfo summary(String summary) {
        checkMutable();
        this.summary = summary;
        return this;
    }

    public RouteInfo responseDescription(String responseDescription) {
        checkMutable();
        this.responseDescription = responseDescription;
        return this;
    }

    public RouteInfo tags(List<String> tags) {
        checkMutable();
        this.tags = tags != null ? List.copyOf(tags) : null;
        return this;
    }

    public RouteInfo deprecated(Boolean deprecated) {
        checkMutable();
        this.deprecated = deprecated;
        return this;
    }

    public RouteInfo dependencies(List<RouteDependency> dependencies) {
        checkMutable();
        this.dependencies = dependencies != null ? List.copyOf(dependencies) : null;
        return this;
    }

    public RouteInfo headers(Map<String, Parameter> headers) {
        checkMutable();
        this.headers = headers != null ? Collections.unmodifiableMap(new LinkedHashMap<>(headers)) : null;
        return this;
    }

    public RouteInfo requestModel(ModelType requestModel) {
        checkMutable();
        this.requestModel = requestModel;
        return this;
    }

    public RouteInfo responseModel(ModelType responseModel) {
        checkMutable();
        this.responseModel = responseModel;
        return this;
    }

    public RouteInfo responses(Map<Integer, AdditionalResponse> responses) {
        checkMutable();
        this.responses = responses != null ? Collections.unmodifiableMap(new LinkedHashMap<>(responses)) : null;
        return this;
    }

    public RouteInfo handler(RouteHandler handler) {
        checkMutable();
        this.handler = handler;
        return this;
    }

    // --- Accessors ---

    public String description() {
        return description;
    }

    public String name() {
        return name;
    }

    public RouteNameFactory nameFactory() {
        return nameFactory;
    }

    public String summary() {
        return summary;
    }

    public String responseDescription() {
        return responseDescription;
    }

    public List<String> tags() {
        return tags;
    }

    public Boolean deprecated() {
        return deprecated;
    }

    public List<RouteDependency> dependencies() {
        return dependencies;
    }

    public Map<String, Parameter> headers() {
        return headers;
    }

    public ModelType requestModel() {
        return requestModel;
    }

    public ModelType responseModel() {
        return responseModel;
    }

    public Map<Integer, AdditionalResponse> responses() {
        return responses;
    }

    public RouteHandler handler() {
        return handler;
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("RouteInfo is frozen: the route table has been finalized");
        }
    }

    @Override
    public String toString() {
        return "RouteInfo[name=" + name + ", summary=" + summary + ", handler=" + (handler != null) + "]";
    }
}
