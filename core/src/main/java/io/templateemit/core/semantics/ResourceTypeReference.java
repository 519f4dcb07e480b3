package io.templateemit.core.semantics;

import java.util.Objects;

/**
 * A resource type with an optional API version, e.g. {@code Microsoft.KeyVault/vaults@2019-09-01}.
 *
 * @param type fully-qualified type without version
 * @param apiVersion the API version, or {@code null}
 */
public record ResourceTypeReference(String type, String apiVersion) {

    /** Type of key vault resources, the only valid source of secret references. */
    public static final String KEY_VAULT_TYPE = "Microsoft.KeyVault/vaults";

    /** Type used for nested deployments emitted for modules. */
    public static final String DEPLOYMENTS_TYPE = "Microsoft.Resources/deployments";

    public ResourceTypeReference {
        Objects.requireNonNull(type, "type must not be null");
        if (type.isBlank()) {
            throw new IllegalArgumentException("type must not be blank");
        }
    }

    /** Parses {@code type@version} or a bare {@code type}. */
    public static ResourceTypeReference parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        int at = text.indexOf('@');
        if (at < 0) {
            return new ResourceTypeReference(text, null);
        }
        return new ResourceTypeReference(text.substring(0, at), text.substring(at + 1));
    }

    /** The type without its version. */
    public String formatType() {
        return type;
    }

    public boolean isKeyVault() {
        return KEY_VAULT_TYPE.equalsIgnoreCase(type);
    }
}
