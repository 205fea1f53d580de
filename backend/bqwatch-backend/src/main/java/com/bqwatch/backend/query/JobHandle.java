package com.bqwatch.backend.query;

public record JobHandle(String jobId, boolean complete, String pageToken) {

    public boolean hasNextPage() {
        return pageToken != null && !pageToken.isBlank();
    }
}
