package com.bqwatch.backend.query.bigquery;

import com.bqwatch.backend.query.JobResultsPage;
import com.bqwatch.backend.query.QueryExecutionException;
import com.bqwatch.backend.query.QueryExecutionService;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQuery.QueryResultsOption;
import com.google.cloud.bigquery.BigQueryError;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.DatasetId;
import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.FieldValue;
import com.google.cloud.bigquery.FieldValueList;
import com.google.cloud.bigquery.Job;
import com.google.cloud.bigquery.JobException;
import com.google.cloud.bigquery.JobId;
import com.google.cloud.bigquery.JobInfo;
import com.google.cloud.bigquery.JobStatus;
import com.google.cloud.bigquery.QueryJobConfiguration;
import com.google.cloud.bigquery.Schema;
import com.google.cloud.bigquery.TableResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class BigQueryQueryExecutionService implements QueryExecutionService {

    private static final Logger LOGGER = LoggerFactory.getLogger(BigQueryQueryExecutionService.class);
    private static final String JOB_PREFIX = "bqwatch_";

    private final BigQuery bigQuery;
    private final BigQueryProperties properties;

    public BigQueryQueryExecutionService(BigQuery bigQuery, BigQueryProperties properties) {
        this.bigQuery = bigQuery;
        this.properties = properties;
    }

    @Override
    public JobResultsPage submit(String sql) {
        QueryJobConfiguration.Builder builder = QueryJobConfiguration.newBuilder(sql).setUseLegacySql(false);
        defaultDataset().ifPresent(builder::setDefaultDataset);
        JobId jobId = jobId(JOB_PREFIX + UUID.randomUUID());
        Job job;
        try {
            job = bigQuery.create(JobInfo.of(jobId, builder.build()));
        } catch (BigQueryException ex) {
            throw new QueryExecutionException(null, "Failed to submit query job to BigQuery", ex);
        }
        LOGGER.debug("Submitted BigQuery job {}", job.getJobId().getJob());
        return toPage(job, null);
    }

    @Override
    public JobResultsPage getJobResults(String jobId, String pageToken) {
        Job job;
        try {
            job = bigQuery.getJob(jobId(jobId));
        } catch (BigQueryException ex) {
            throw new QueryExecutionException(jobId, "Failed to refresh BigQuery job " + jobId, ex);
        }
        if (job == null) {
            throw new QueryExecutionException(jobId, "BigQuery job " + jobId + " not found");
        }
        return toPage(job, pageToken);
    }

    private JobResultsPage toPage(Job job, String pageToken) {
        String id = job.getJobId().getJob();
        JobStatus status = job.getStatus();
        BigQueryError error = status != null ? status.getError() : null;
        if (error != null) {
            throw new QueryExecutionException(id, "BigQuery job " + id + " failed: " + error.getMessage());
        }
        if (status == null || !JobStatus.State.DONE.equals(status.getState())) {
            return JobResultsPage.pending(id);
        }
        try {
            TableResult result = job.getQueryResults(pageOptions(pageToken));
            return toPage(id, result);
        } catch (BigQueryException | JobException ex) {
            throw new QueryExecutionException(id, "Failed to read results of BigQuery job " + id, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new QueryExecutionException(id, "Interrupted while reading results of BigQuery job " + id, ex);
        }
    }

    private JobResultsPage toPage(String jobId, TableResult result) {
        List<String> headers = headers(result.getSchema());
        List<List<String>> rows = new ArrayList<>();
        for (FieldValueList row : result.getValues()) {
            List<String> cells = new ArrayList<>(row.size());
            for (FieldValue value : row) {
                cells.add(toCell(value));
            }
            rows.add(Collections.unmodifiableList(cells));
        }
        String nextPageToken = result.getNextPageToken();
        return new JobResultsPage(
                jobId,
                true,
                headers,
                rows,
                result.getTotalRows(),
                nextPageToken != null && !nextPageToken.isBlank() ? nextPageToken : null);
    }

    private List<String> headers(Schema schema) {
        if (schema == null || schema.getFields() == null) {
            return List.of();
        }
        List<String> headers = new ArrayList<>();
        for (Field field : schema.getFields()) {
            headers.add(field.getName());
        }
        return headers;
    }

    private String toCell(FieldValue value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.getAttribute() == FieldValue.Attribute.PRIMITIVE) {
            return value.getStringValue();
        }
        Object raw = value.getValue();
        return raw != null ? raw.toString() : null;
    }

    private QueryResultsOption[] pageOptions(String pageToken) {
        List<QueryResultsOption> options = new ArrayList<>();
        options.add(QueryResultsOption.pageSize(properties.getPageSize()));
        if (pageToken != null && !pageToken.isBlank()) {
            options.add(QueryResultsOption.pageToken(pageToken));
        }
        return options.toArray(new QueryResultsOption[0]);
    }

    private Optional<DatasetId> defaultDataset() {
        String dataset = properties.getDataset();
        if (dataset == null || dataset.isBlank()) {
            return Optional.empty();
        }
        String projectId = properties.getProjectId();
        if (projectId == null || projectId.isBlank()) {
            return Optional.of(DatasetId.of(dataset));
        }
        return Optional.of(DatasetId.of(projectId, dataset));
    }

    private JobId jobId(String job) {
        JobId.Builder builder = JobId.newBuilder().setJob(job);
        if (properties.getProjectId() != null && !properties.getProjectId().isBlank()) {
            builder.setProject(properties.getProjectId());
        }
        if (properties.getLocation() != null && !properties.getLocation().isBlank()) {
            builder.setLocation(properties.getLocation());
        }
        return builder.build();
    }
}
