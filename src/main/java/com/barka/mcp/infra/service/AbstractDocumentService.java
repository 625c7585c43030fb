package com.barka.mcp.infra.service;

import com.barka.mcp.core.error.DomainException;
import com.barka.mcp.domain.Scope;
import com.barka.mcp.infra.db.EntityKind;
import com.barka.mcp.infra.db.EntityRepository;
import com.barka.mcp.infra.db.StoredEntity;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Shared lookups and body helpers for the JDBC-backed services. Entity bodies are plain JSON
 * maps, so most accessors here are lenient about types.
 */
abstract class AbstractDocumentService {
    static final Set<String> BOOKKEEPING = Set.of("id", "isActive", "createdAt", "updatedAt");
    static final Set<String> OPEN_TASK_STATUSES = Set.of("not_started", "in_progress");
    static final double DEFAULT_HOURS_PER_WEEK = 40;
    private static final Pattern OBJECT_ID = Pattern.compile("^[0-9a-fA-F]{24}$");

    protected final EntityRepository repo;

    protected AbstractDocumentService(EntityRepository repo) {
        this.repo = repo;
    }

    protected StoredEntity require(EntityKind kind, String id, String notFound) {
        return repo.findActive(kind, id).orElseThrow(() -> new DomainException(notFound));
    }

    /** Soft-deletes {@code entity}, stamping who did it; fails if it is already gone. */
    protected void softDelete(StoredEntity entity, String userId, String notFound) {
        Map<String, Object> body = new LinkedHashMap<>(entity.body());
        body.put("lastModifiedBy", userId);
        if (!repo.deactivate(entity, body)) {
            throw new DomainException(notFound);
        }
    }

    protected Optional<StoredEntity> findScoped(EntityKind kind, String id, Scope scope) {
        return repo.findActive(kind, id).filter(e -> inScope(e, scope));
    }

    protected List<StoredEntity> all(EntityKind kind, Scope scope) {
        return repo.findAllActive(kind, scope);
    }

    protected List<StoredEntity> allTasks() {
        return repo.findAllActive(EntityKind.TASK, Scope.unscoped());
    }

    static boolean inScope(StoredEntity e, Scope scope) {
        return (scope.clientId() == null || scope.clientId().equals(e.clientId()))
                && (scope.organizationId() == null || scope.organizationId().equals(e.organizationId()));
    }

    static List<Map<String, Object>> documents(Collection<StoredEntity> entities) {
        List<Map<String, Object>> docs = new ArrayList<>(entities.size());
        for (StoredEntity e : entities) {
            docs.add(e.toDocument());
        }
        return docs;
    }

    /** Copies caller-supplied data, dropping columns the store owns. */
    static Map<String, Object> writable(Map<String, Object> data) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (data != null) {
            data.forEach((k, v) -> {
                if (!BOOKKEEPING.contains(k)) {
                    copy.put(k, v);
                }
            });
        }
        return copy;
    }

    /** Merges non-null changes over the current body. */
    static Map<String, Object> merged(Map<String, Object> body, Map<String, Object> changes) {
        Map<String, Object> next = new LinkedHashMap<>(body);
        writable(changes).forEach((k, v) -> {
            if (v != null) {
                next.put(k, v);
            }
        });
        return next;
    }

    static void requireFields(Map<String, Object> data, String... fields) {
        for (String f : fields) {
            Object v = data.get(f);
            if (v == null || (v instanceof String s && s.isBlank())) {
                throw new DomainException("Missing required fields: " + String.join(", ", fields));
            }
        }
    }

    /** Reference fields, when present, must be 24 hex character ids. */
    static void requireIds(Map<String, Object> data, String... fields) {
        for (String f : fields) {
            Object v = data.get(f);
            if (v != null && !(v instanceof String s && OBJECT_ID.matcher(s).matches())) {
                throw new DomainException("Invalid " + f + " id");
            }
        }
    }

    /** Equality on top-level keys; null filter values are ignored. */
    static boolean matches(Map<String, Object> doc, Map<String, Object> filters) {
        if (filters == null) {
            return true;
        }
        for (Map.Entry<String, Object> f : filters.entrySet()) {
            if (f.getValue() != null && !sameValue(doc.get(f.getKey()), f.getValue())) {
                return false;
            }
        }
        return true;
    }

    static boolean sameValue(Object a, Object b) {
        if (Objects.equals(a, b)) {
            return true;
        }
        return a != null && b != null && a.toString().equals(b.toString());
    }

    /** Case-insensitive substring match on a string, or on any string element of a list. */
    static boolean containsIgnoreCase(Object value, String term) {
        if (value == null || term == null) {
            return false;
        }
        String needle = term.toLowerCase(Locale.ROOT);
        if (value instanceof Collection<?> c) {
            for (Object o : c) {
                if (o != null && o.toString().toLowerCase(Locale.ROOT).contains(needle)) {
                    return true;
                }
            }
            return false;
        }
        return value.toString().toLowerCase(Locale.ROOT).contains(needle);
    }

    static boolean anyContains(Map<String, Object> body, String term, String... keys) {
        for (String k : keys) {
            if (containsIgnoreCase(body.get(k), term)) {
                return true;
            }
        }
        return false;
    }

    static String str(Map<String, Object> m, String key) {
        Object v = m == null ? null : m.get(key);
        return v == null ? null : v.toString();
    }

    static double number(Object v, double fallback) {
        if (v instanceof Number n) {
            return n.doubleValue();
        }
        if (v instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s);
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    static Map<String, Object> map(Map<String, Object> m, String key) {
        Object v = m == null ? null : m.get(key);
        if (!(v instanceof Map<?, ?> nested)) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        nested.forEach((k, val) -> copy.put(String.valueOf(k), val));
        return copy;
    }

    static List<Object> list(Map<String, Object> m, String key) {
        Object v = m == null ? null : m.get(key);
        return v instanceof List<?> l ? new ArrayList<>(l) : new ArrayList<>();
    }

    /** Parses ISO-8601 date-times or plain dates (taken as UTC midnight). */
    static Instant instant(Object v) {
        if (v == null) {
            return null;
        }
        String s = v.toString();
        try {
            return OffsetDateTime.parse(s).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(s);
            } catch (DateTimeParseException e2) {
                try {
                    return LocalDate.parse(s).atStartOfDay().toInstant(ZoneOffset.UTC);
                } catch (DateTimeParseException e3) {
                    return null;
                }
            }
        }
    }

    static long daysUntil(Instant now, Instant due) {
        return (long) Math.ceil(Duration.between(now, due).toMillis() / 86_400_000.0);
    }

    static double hoursPerWeek(Map<String, Object> memberBody) {
        double h = number(map(memberBody, "capacity").get("hoursPerWeek"), DEFAULT_HOURS_PER_WEEK);
        return h > 0 ? h : DEFAULT_HOURS_PER_WEEK;
    }

    static int completion(Map<String, Object> body) {
        return (int) Math.round(number(map(body, "progress").get("completionPercentage"), 0));
    }

    static int projectCompletion(List<StoredEntity> tasks, String projectId) {
        return (Integer) JdbcProjectService.progress(tasksWhere(tasks, "project", projectId)).get("completionPercentage");
    }

    static boolean isOpen(StoredEntity task) {
        return OPEN_TASK_STATUSES.contains(str(task.body(), "status"));
    }

    static List<StoredEntity> tasksWhere(List<StoredEntity> tasks, String key, String value) {
        List<StoredEntity> res = new ArrayList<>();
        for (StoredEntity t : tasks) {
            if (value.equals(str(t.body(), key))) {
                res.add(t);
            }
        }
        return res;
    }

    static double round1(double v) {
        return Math.round(v * 10) / 10.0;
    }
}
