package com.lbg.markets.etl.watcher.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Callback payload a worker posts once it has finished with a dispatched file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CompletionNotice(
        @JsonProperty("filename") String filename,
        @JsonProperty("status") String status,
        @JsonProperty("details") Object details,
        @JsonProperty("worker_id") String workerId,
        @JsonProperty("timestamp") String timestamp
) {
    public boolean isSuccess() {
        return "success".equalsIgnoreCase(status);
    }

    public boolean isFailure() {
        return "failure".equalsIgnoreCase(status);
    }

    public String detailsText() {
        return details != null ? String.valueOf(details) : null;
    }
}
