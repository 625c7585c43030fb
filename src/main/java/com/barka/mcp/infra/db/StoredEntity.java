package com.barka.mcp.infra.db;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row of {@code pm_entity}. The body is the entity's JSON document without the bookkeeping
 * columns; {@link #toDocument()} merges both into the shape returned to callers.
 */
public record StoredEntity(
        String id,
        EntityKind kind,
        String organizationId,
        String clientId,
        boolean active,
        Map<String, Object> body,
        Instant createdAt,
        Instant updatedAt
) {
    public Map<String, Object> toDocument() {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("id", id);
        doc.putAll(body);
        doc.put("isActive", active);
        doc.put("createdAt", createdAt.toString());
        doc.put("updatedAt", updatedAt.toString());
        return doc;
    }
}
