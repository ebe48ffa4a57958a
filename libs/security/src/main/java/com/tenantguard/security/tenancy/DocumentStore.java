package com.tenantguard.security.tenancy;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Raw document storage. Performs no tenant filtering of its own; callers reach it only through
 * {@link TenantScopedAccessor}.
 */
public interface DocumentStore {

    Optional<Document> get(String kind, String id);

    /**
     * All documents of {@code kind} whose fields equal every entry of {@code equalities}.
     */
    List<Document> findByFields(String kind, Map<String, Object> equalities);

    /**
     * Stores a new document and returns its id.
     */
    String insert(String kind, Map<String, Object> fields);

    /**
     * Merges {@code patch} into an existing document.
     *
     * @return false if no such document exists
     */
    boolean patch(String kind, String id, Map<String, Object> patch);

    /**
     * @return false if no such document exists
     */
    boolean delete(String kind, String id);
}
