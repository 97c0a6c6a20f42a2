package io.specrouter.javalin.config;

import java.util.List;
import java.util.Objects;

/**
 * Root configuration of the route server. Every field has a default; use {@link #builder()}.
 *
 * @param host            bind address
 * @param port            listen port, {@code 0} for an ephemeral port
 * @param contractsPath   contract file, or directory scanned for {@code *.json} contracts
 * @param validators      names of the validators run after the baseline, in order
 * @param strict          strict instead of lax request models
 * @param artifactDir     directory generated modules are written to and kept in, {@code null}
 *                        for transient modules
 * @param openapiPath     path the generated OpenAPI document is served on
 * @param openapiTitle    {@code info.title} of the served document
 * @param openapiVersion  {@code info.version} of the served document
 * @param healthEnabled   serve the liveness endpoint
 * @param healthPath      liveness endpoint path
 * @param loggingFormat   {@code json} or {@code text}
 * @param loggingLevel    root log level
 */
public record ServerConfig(
        String host,
        int port,
        String contractsPath,
        List<String> validators,
        boolean strict,
        String artifactDir,
        String openapiPath,
        String openapiTitle,
        String openapiVersion,
        boolean healthEnabled,
        String healthPath,
        String loggingFormat,
        String loggingLevel) {

    public ServerConfig {
        Objects.requireNonNull(host, "host must not be null");
        Objects.requireNonNull(contractsPath, "contractsPath must not be null");
        validators = validators != null ? List.copyOf(validators) : List.of();
        if (port < 0 || port > 65535) {
            throw new ConfigLoadException("port must be between 0 and 65535, got: " + port);
        }
    }

    /** Creates a new builder with the documented defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link ServerConfig}. */
    public static final class Builder {
        private String host = "0.0.0.0";
        private int port = 8000;
        private String contractsPath = "./contracts";
        private List<String> validators = List.of();
        private boolean strict;
        private String artifactDir;
        private String openapiPath = "/openapi.json";
        private String openapiTitle = "Spec Router";
        private String openapiVersion = "0.1.0";
        private boolean healthEnabled = true;
        private String healthPath = "/health";
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder contractsPath(String contractsPath) {
            this.contractsPath = contractsPath;
            return this;
        }

        public Builder validators(List<String> validators) {
            this.validators = validators;
            return this;
        }

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public Builder artifactDir(String artifactDir) {
            this.artifactDir = artifactDir;
            return this;
        }

        public Builder openapiPath(String openapiPath) {
            this.openapiPath = openapiPath;
            return this;
        }

        public Builder openapiTitle(String openapiTitle) {
            this.openapiTitle = openapiTitle;
            return this;
        }

        public Builder openapiVersion(String openapiVersion) {
            this.openapiVersion = openapiVersion;
            return this;
        }

        public Builder healthEnabled(boolean healthEnabled) {
            this.healthEnabled = healthEnabled;
            return this;
        }

        public Builder healthPath(String healthPath) {
            this.healthPath = healthPath;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public ServerConfig build() {
            return new ServerConfig(
                    host,
                    port,
                    contractsPath,
                    validators,
                    strict,
                    artifactDir,
                    openapiPath,
                    openapiTitle,
                    openapiVersion,
                    healthEnabled,
                    healthPath,
                    loggingFormat,
                    loggingLevel);
        }
    }
}
