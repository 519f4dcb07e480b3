package io.templateemit.core.semantics;

/** Deployment scope a resource or module is deployed at. */
public enum ResourceScope {
    RESOURCE_GROUP,
    SUBSCRIPTION,
    MANAGEMENT_GROUP,
    TENANT
}
