package com.bqwatch.backend.logging;

import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.FieldValue;
import com.google.cloud.bigquery.FieldValueList;
import com.google.cloud.bigquery.InsertAllRequest;
import com.google.cloud.bigquery.InsertAllResponse;
import com.google.cloud.bigquery.QueryJobConfiguration;
import com.google.cloud.bigquery.QueryParameterValue;
import com.google.cloud.bigquery.TableId;
import com.google.cloud.bigquery.TableResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Streams check log entries into a BigQuery table with {@code timestamp TIMESTAMP, message STRING}
 * columns.
 */
public class BigQueryCheckLogStore implements CheckLogStore {

    private final BigQuery bigQuery;
    private final TableId tableId;

    public BigQueryCheckLogStore(BigQuery bigQuery, String projectId, CheckLogProperties properties) {
        this.bigQuery = bigQuery;
        this.tableId =
                projectId == null || projectId.isBlank()
                        ? TableId.of(properties.getDataset(), properties.getTable())
                        : TableId.of(projectId, properties.getDataset(), properties.getTable());
    }

    @Override
    public void append(LogEntry entry) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", entry.timestamp().toString());
        row.put("message", entry.message());
        InsertAllResponse response;
        try {
            response = bigQuery.insertAll(InsertAllRequest.newBuilder(tableId).addRow(row).build());
        } catch (BigQueryException ex) {
            throw new CheckLogException("Failed to append to check log table " + tableName(), ex);
        }
        if (response.hasErrors()) {
            throw new CheckLogException(
                    "Check log table " + tableName() + " rejected the entry: " + response.getInsertErrors());
        }
    }

    @Override
    public long lastIndex() {
        TableResult result = runQuery("SELECT COUNT(*) AS total FROM " + qualifiedTable(), Map.of());
        for (FieldValueList row : result.iterateAll()) {
            return row.get("total").getLongValue() - 1L;
        }
        return -1L;
    }

    @Override
    public List<LogEntry> readRecent(int count) {
        String sql =
                "SELECT timestamp, message FROM "
                        + qualifiedTable()
                        + " ORDER BY timestamp DESC"
                        + " LIMIT @limit";
        TableResult result = runQuery(sql, Map.of("limit", QueryParameterValue.int64(count)));
        List<LogEntry> entries = new ArrayList<>();
        for (FieldValueList row : result.iterateAll()) {
            entries.add(new LogEntry(toInstant(row.get("timestamp")), toText(row.get("message"))));
        }
        Collections.reverse(entries);
        return entries;
    }

    private TableResult runQuery(String sql, Map<String, QueryParameterValue> params) {
        QueryJobConfiguration.Builder builder = QueryJobConfiguration.newBuilder(sql).setUseLegacySql(false);
        params.forEach(builder::addNamedParameter);
        try {
            return bigQuery.query(builder.build());
        } catch (BigQueryException ex) {
            throw new CheckLogException("Failed to read check log table " + tableName(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new CheckLogException("Interrupted while reading check log table " + tableName(), ex);
        }
    }

    private Instant toInstant(FieldValue value) {
        if (value == null || value.isNull()) {
            return null;
        }
        return value.getTimestampInstant();
    }

    private String toText(FieldValue value) {
        if (value == null || value.isNull()) {
            return "";
        }
        return value.getStringValue();
    }

    private String qualifiedTable() {
        return "`" + tableName() + "`";
    }

    private String tableName() {
        if (tableId.getProject() == null) {
            return tableId.getDataset() + "." + tableId.getTable();
        }
        return tableId.getProject() + "." + tableId.getDataset() + "." + tableId.getTable();
    }
}
