package io.templateemit.core.config;

import java.util.Objects;

/**
 * Emission settings shared by every node of one compilation. Use {@link #builder()} to construct
 * instances; unset fields receive the defaults below.
 *
 * @param symbolicNameCodegen emit name-based resource references instead of computed resource id
 *     expressions (default {@code false})
 * @param moduleDeploymentApiVersion API version used when referencing module deployments (default
 *     {@value #DEFAULT_MODULE_API_VERSION})
 */
public record EmitterSettings(boolean symbolicNameCodegen, String moduleDeploymentApiVersion) {

    public static final String DEFAULT_MODULE_API_VERSION = "2020-10-01";

    /** Settings with every field at its default. */
    public static final EmitterSettings DEFAULT = builder().build();

    public EmitterSettings {
        Objects.requireNonNull(moduleDeploymentApiVersion, "moduleDeploymentApiVersion must not be null");
        if (moduleDeploymentApiVersion.isBlank()) {
            throw new IllegalArgumentException("moduleDeploymentApiVersion must not be blank");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder pre-populated with this instance's values. */
    public Builder toBuilder() {
        return new Builder().symbolicNameCodegen(symbolicNameCodegen).moduleDeploymentApiVersion(moduleDeploymentApiVersion);
    }

    public static final class Builder {
        private boolean symbolicNameCodegen = false;
        private String moduleDeploymentApiVersion = DEFAULT_MODULE_API_VERSION;

        Builder() {}

        public Builder symbolicNameCodegen(boolean symbolicNameCodegen) {
            this.symbolicNameCodegen = symbolicNameCodegen;
            return this;
        }

        public Builder moduleDeploymentApiVersion(String moduleDeploymentApiVersion) {
            this.moduleDeploymentApiVersion = moduleDeploymentApiVersion;
            return this;
        }

        public EmitterSettings build() {
            return new EmitterSettings(symbolicNameCodegen, moduleDeploymentApiVersion);
        }
    }
}
