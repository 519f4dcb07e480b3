package io.templateemit.core.engine;

/** Names shared between the source language and the target document. */
final class LanguageConstants {

    private LanguageConstants() {}

    /** Source-level type-erasure wrapper; has no target representation. */
    static final String ANY_FUNCTION = "any";

    /** Source-level secret accessor on a key vault resource. */
    static final String GET_SECRET_FUNCTION = "getSecret";

    static final String COPY_INDEX_FUNCTION = "copyIndex";
    static final String LENGTH_FUNCTION = "length";

    static final String COPY_PROPERTY = "copy";
    static final String SERIAL_MODE = "serial";

    static final String MANAGEMENT_GROUP_TYPE = "Microsoft.Management/managementGroups";
}
