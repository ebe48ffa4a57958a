package com.tenantguard.security.tenancy;

import com.tenantguard.security.NotFoundException;
import com.tenantguard.security.PermissionChecker;
import com.tenantguard.security.SecurityContext;
import com.tenantguard.security.TenantIsolationEnforcer;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Row-level security over one resource kind of a {@link DocumentStore}.
 * <p>
 * Every read is filtered to the caller's tenant and every write stamps it. A document that
 * exists in another tenant is reported as a {@link com.tenantguard.security.CrossTenantAccessException},
 * not filtered out. There is no bypass: the accessor is always bound to a concrete tenant.
 */
public class TenantScopedAccessor {

    private final DocumentStore store;
    private final String kind;
    private final SecurityContext context;

    public TenantScopedAccessor(DocumentStore store, String kind, SecurityContext context) {
        if (store == null) {
            throw new IllegalArgumentException("store must not be null");
        }
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("kind must not be null or blank");
        }
        if (context == null || context.tenantId() == null || context.tenantId().isBlank()) {
            throw new IllegalArgumentException("a security context with a tenant is required");
        }
        this.store = store;
        this.kind = kind;
        this.context = context;
    }

    public String kind() {
        return kind;
    }

    /** Every document of this kind owned by the caller's tenant. */
    public List<Document> list() {
        return store.findByFields(kind, Map.of(Document.TENANT_FIELD, context.tenantId()));
    }

    /**
     * Like {@link #list()} narrowed by equality filters. A {@code tenantId} filter is ignored.
     */
    public List<Document> listWhere(Map<String, Object> filters) {
        var equalities = new LinkedHashMap<String, Object>(filters == null ? Map.of() : filters);
        equalities.put(Document.TENANT_FIELD, context.tenantId());
        return store.findByFields(kind, equalities);
    }

    /**
     * @throws NotFoundException                                  when no such document exists
     * @throws com.tenantguard.security.CrossTenantAccessException when another tenant owns it
     */
    public Document byId(String id) {
        Document document = store.get(kind, id).orElseThrow(() -> new NotFoundException(kind, id));
        TenantIsolationEnforcer.enforce(context, document.tenantId(), document.reference());
        return document;
    }

    public String insert(Map<String, Object> data) {
        return insert(data, null);
    }

    /**
     * Stores a new document owned by the caller's tenant; any {@code tenantId} in {@code data}
     * is overwritten.
     *
     * @param requiredPermission checked first when non-null
     * @return the new document id
     */
    public String insert(Map<String, Object> data, String requiredPermission) {
        PermissionChecker.require(context, requiredPermission);
        var fields = new LinkedHashMap<String, Object>(data == null ? Map.of() : data);
        fields.put(Document.TENANT_FIELD, context.tenantId());
        return store.insert(kind, fields);
    }

    public Document update(String id, Map<String, Object> patch) {
        return update(id, patch, null);
    }

    /**
     * Patches a document of the caller's tenant. A {@code tenantId} key in the patch is dropped,
     * so a document can never be moved between tenants.
     *
     * @return the document after the patch
     */
    public Document update(String id, Map<String, Object> patch, String requiredPermission) {
        PermissionChecker.require(context, requiredPermission);
        byId(id);
        var safePatch = new LinkedHashMap<String, Object>(patch == null ? Map.of() : patch);
        safePatch.remove(Document.TENANT_FIELD);
        if (!store.patch(kind, id, safePatch)) {
            throw new NotFoundException(kind, id);
        }
        return store.get(kind, id).orElseThrow(() -> new NotFoundException(kind, id));
    }

    public void delete(String id) {
        delete(id, null);
    }

    public void delete(String id, String requiredPermission) {
        PermissionChecker.require(context, requiredPermission);
        byId(id);
        if (!store.delete(kind, id)) {
            throw new NotFoundException(kind, id);
        }
    }
}
