package uk.gegc.tunetrivia.features.operation.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.tunetrivia.features.operation.application.OperationApplier;
import uk.gegc.tunetrivia.features.operation.domain.model.InsertBatch;
import uk.gegc.tunetrivia.features.operation.domain.model.InsertRecord;
import uk.gegc.tunetrivia.features.operation.domain.model.Operation;
import uk.gegc.tunetrivia.features.operation.domain.model.RecordKind;
import uk.gegc.tunetrivia.features.operation.domain.model.UpdateStatus;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Applies operations with plain JDBC. Every operation is a single statement,
 * or a single batch inside one transaction for {@link InsertBatch}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JdbcOperationApplier implements OperationApplier {

    private static final Pattern COLUMN_NAME = Pattern.compile("[a-z_][a-z0-9_]*");

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public List<Map<String, Object>> apply(Operation operation) {
        if (operation instanceof InsertRecord insert) {
            return List.of(insertOne(insert.kind(), insert.payload()));
        }
        if (operation instanceof UpdateStatus update) {
            return updateOne(update);
        }
        if (operation instanceof InsertBatch batch) {
            return insertBatch(batch);
        }
        throw new IllegalArgumentException("Unsupported operation: " + operation);
    }

    private Map<String, Object> insertOne(RecordKind kind, Map<String, Object> payload) {
        Map<String, Object> row = prepareRow(payload);
        jdbcTemplate.update(insertSql(kind, row.keySet()), toParameters(row));
        log.debug("Inserted {} into {}", row.get("id"), kind.tableName());
        return row;
    }

    private List<Map<String, Object>> updateOne(UpdateStatus update) {
        Map<String, Object> fields = new LinkedHashMap<>(update.fields());
        fields.remove("id");
        if (update.kind() == RecordKind.YOUTUBE_URL && !fields.containsKey("updated_at")) {
            fields.put("updated_at", Timestamp.from(clock.instant()));
        }
        fields.keySet().forEach(this::requireValidColumn);

        StringBuilder sql = new StringBuilder("UPDATE ").append(update.kind().tableName()).append(" SET ");
        List<String> assignments = new ArrayList<>();
        for (String column : fields.keySet()) {
            assignments.add(column + " = :" + column);
        }
        sql.append(String.join(", ", assignments)).append(" WHERE id = :id");

        MapSqlParameterSource params = toParameters(fields);
        params.addValue("id", update.id());

        int updated = jdbcTemplate.update(sql.toString(), params);
        if (updated == 0) {
            log.warn("{} matched no rows", update.describe());
            return List.of();
        }
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", update.id());
        row.putAll(fields);
        return List.of(row);
    }

    private List<Map<String, Object>> insertBatch(InsertBatch batch) {
        List<Map<String, Object>> rows = new ArrayList<>(batch.payloads().size());
        Set<String> columns = new LinkedHashSet<>();
        for (Map<String, Object> payload : batch.payloads()) {
            Map<String, Object> row = prepareRow(payload);
            rows.add(row);
            columns.addAll(row.keySet());
        }

        SqlParameterSource[] params = new SqlParameterSource[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            Map<String, Object> row = rows.get(i);
            MapSqlParameterSource source = toParameters(row);
            for (String column : columns) {
                if (!source.hasValue(column)) {
                    source.addValue(column, null);
                }
            }
            params[i] = source;
        }

        String sql = insertSql(batch.kind(), columns);
        transactionTemplate.executeWithoutResult(status -> jdbcTemplate.batchUpdate(sql, params));
        log.debug("Inserted {} rows into {}", rows.size(), batch.kind().tableName());
        return rows;
    }

    private Map<String, Object> prepareRow(Map<String, Object> payload) {
        Map<String, Object> row = new LinkedHashMap<>();
        // ids are fixed when the operation is built, so a retry writes the same key
        row.put("id", payload.get("id"));
        payload.forEach((column, value) -> {
            if (!"id".equals(column)) {
                requireValidColumn(column);
                row.put(column, value);
            }
        });
        if (!row.containsKey("created_at")) {
            row.put("created_at", Timestamp.from(clock.instant()));
        }
        return row;
    }

    private String insertSql(RecordKind kind, Collection<String> columns) {
        List<String> placeholders = columns.stream().map(column -> ":" + column).toList();
        return "INSERT INTO " + kind.tableName()
                + " (" + String.join(", ", columns) + ") VALUES ("
                + String.join(", ", placeholders) + ")";
    }

    private MapSqlParameterSource toParameters(Map<String, Object> row) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        row.forEach((column, value) -> params.addValue(column, toColumnValue(value)));
        return params;
    }

    private Object toColumnValue(Object value) {
        if (value instanceof Collection<?> || value instanceof Map<?, ?>) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Value cannot be stored as JSON: " + e.getOriginalMessage(), e);
            }
        }
        if (value instanceof Instant instant) {
            return Timestamp.from(instant);
        }
        return value;
    }

    private void requireValidColumn(String column) {
        if (column == null || !COLUMN_NAME.matcher(column).matches()) {
            throw new IllegalArgumentException("Invalid column name: " + column);
        }
    }
}
