package com.tenantguard.security.tenancy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Thread-safe in-memory {@link DocumentStore}. Ids are random UUIDs.
 */
public class InMemoryDocumentStore implements DocumentStore {

    private final ConcurrentMap<String, ConcurrentMap<String, Document>> kinds = new ConcurrentHashMap<>();

    @Override
    public Optional<Document> get(String kind, String id) {
        return Optional.ofNullable(documents(kind).get(id));
    }

    @Override
    public List<Document> findByFields(String kind, Map<String, Object> equalities) {
        return documents(kind).values().stream()
                .filter(doc -> matches(doc, equalities))
                .toList();
    }

    @Override
    public String insert(String kind, Map<String, Object> fields) {
        String id = UUID.randomUUID().toString();
        documents(kind).put(id, new Document(id, kind, fields));
        return id;
    }

    @Override
    public boolean patch(String kind, String id, Map<String, Object> patch) {
        Document updated = documents(kind).computeIfPresent(id, (key, existing) -> {
            var merged = new LinkedHashMap<>(existing.fields());
            merged.putAll(patch);
            return new Document(id, kind, merged);
        });
        return updated != null;
    }

    @Override
    public boolean delete(String kind, String id) {
        return documents(kind).remove(id) != null;
    }

    public int count(String kind) {
        return documents(kind).size();
    }

    private ConcurrentMap<String, Document> documents(String kind) {
        return kinds.computeIfAbsent(kind, k -> new ConcurrentHashMap<>());
    }

    private static boolean matches(Document doc, Map<String, Object> equalities) {
        for (Map.Entry<String, Object> entry : equalities.entrySet()) {
            if (!Objects.equals(doc.get(entry.getKey()), entry.getValue())) {
                return false;
            }
        }
        return true;
    }
}
