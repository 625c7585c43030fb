package com.barka.mcp.infra.db;

import com.barka.mcp.domain.Scope;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Document-style persistence for projects, tasks and team members in a single table.
 */
public class EntityRepository {
    private static final TypeReference<Map<String, Object>> BODY_TYPE = new TypeReference<>() {};
    private static final String COLUMNS = "id,kind,organization_id,client_id,active,body,created_at,updated_at";

    private final JdbcTemplate jdbc;
    private final ObjectMapper om;
    private final Clock clock;

    public EntityRepository(JdbcTemplate jdbc, ObjectMapper om, Clock clock) {
        this.jdbc = jdbc;
        this.om = om;
        this.clock = clock;
    }

    private final RowMapper<StoredEntity> mapper = new RowMapper<>() {
        @Override
        public StoredEntity mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new StoredEntity(
                    rs.getString("id"),
                    EntityKind.valueOf(rs.getString("kind")),
                    rs.getString("organization_id"),
                    rs.getString("client_id"),
                    rs.getBoolean("active"),
                    readBody(rs.getString("body")),
                    rs.getTimestamp("created_at").toInstant(),
                    rs.getTimestamp("updated_at").toInstant()
            );
        }
    };

    public Instant now() {
        return clock.instant();
    }

    public StoredEntity insert(EntityKind kind, Map<String, Object> body) {
        Instant now = clock.instant();
        String id = StoreIds.newId(now);
        jdbc.update("INSERT INTO pm_entity(" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?)",
                id, kind.name(), string(body.get("organization")), string(body.get("client")), true,
                writeBody(body), Timestamp.from(now), Timestamp.from(now));
        return new StoredEntity(id, kind, string(body.get("organization")), string(body.get("client")), true,
                body, now, now);
    }

    public Optional<StoredEntity> findActive(EntityKind kind, String id) {
        List<StoredEntity> list = jdbc.query("SELECT " + COLUMNS + " FROM pm_entity WHERE kind=? AND id=? AND active=TRUE",
                mapper, kind.name(), id);
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }

    /**
     * Active entities of a kind, newest first, narrowed by whichever scoping identifiers are set.
     */
    public List<StoredEntity> findAllActive(EntityKind kind, Scope scope) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM pm_entity WHERE kind=? AND active=TRUE");
        List<Object> args = new ArrayList<>();
        args.add(kind.name());
        if (scope.clientId() != null) {
            sql.append(" AND client_id=?");
            args.add(scope.clientId());
        }
        if (scope.organizationId() != null) {
            sql.append(" AND organization_id=?");
            args.add(scope.organizationId());
        }
        sql.append(" ORDER BY created_at DESC, id DESC");
        return jdbc.query(sql.toString(), mapper, args.toArray());
    }

    public StoredEntity update(StoredEntity entity, Map<String, Object> body) {
        Instant now = clock.instant();
        String org = string(body.get("organization"));
        String client = string(body.get("client"));
        jdbc.update("UPDATE pm_entity SET organization_id=?, client_id=?, body=?, updated_at=? WHERE id=?",
                org, client, writeBody(body), Timestamp.from(now), entity.id());
        return new StoredEntity(entity.id(), entity.kind(), org, client, entity.active(), body,
                entity.createdAt(), now);
    }

    /**
     * Writes the final body and clears {@code active} in one statement. False when the row was
     * already inactive or gone.
     */
    public boolean deactivate(StoredEntity entity, Map<String, Object> body) {
        return jdbc.update("UPDATE pm_entity SET body=?, updated_at=?, active=FALSE WHERE kind=? AND id=? AND active=TRUE",
                writeBody(body), Timestamp.from(clock.instant()), entity.kind().name(), entity.id()) > 0;
    }

    private String writeBody(Map<String, Object> body) {
        try {
            return om.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Entity body is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private Map<String, Object> readBody(String json) throws SQLException {
        try {
            return om.readValue(json, BODY_TYPE);
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt entity body: " + e.getOriginalMessage(), e);
        }
    }

    private static String string(Object value) {
        return value == null ? null : value.toString();
    }
}
