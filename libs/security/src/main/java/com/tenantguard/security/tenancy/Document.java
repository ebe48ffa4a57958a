package com.tenantguard.security.tenancy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A tenant-owned record held by a {@link DocumentStore}.
 *
 * @param id     store-assigned identifier
 * @param kind   resource kind, e.g. {@code contracts}
 * @param fields field values, including the {@value #TENANT_FIELD} field
 */
public record Document(String id, String kind, Map<String, Object> fields) {

    /** Field holding the owning tenant. */
    public static final String TENANT_FIELD = "tenantId";

    public Document {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("kind must not be null or blank");
        }
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * The owning tenant, or {@code null} for a record stored without one.
     */
    public String tenantId() {
        Object value = fields.get(TENANT_FIELD);
        return value == null ? null : value.toString();
    }

    public Object get(String field) {
        return fields.get(field);
    }

    /** Reference used in logs and errors, e.g. {@code contracts/42}. */
    public String reference() {
        return kind + "/" + id;
    }
}
