package com.flagship.etl_agent.dispatch;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of running a handler on a delivered job or message.
 *
 * An ERROR result carries the exception detail instead of the exception itself,
 * so it can be stored in the result backend and returned over HTTP.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResult(
        @JsonProperty("status") TaskStatus status,
        @JsonProperty("correlation_id") String correlationId,
        @JsonProperty("data") Object data,
        @JsonProperty("error") String error) {

    public static TaskResult pending(String correlationId) {
        return new TaskResult(TaskStatus.PENDING, correlationId, null, null);
    }

    public static TaskResult success(String correlationId, Object data) {
        return new TaskResult(TaskStatus.SUCCESS, correlationId, data, null);
    }

    public static TaskResult error(String correlationId, Throwable cause) {
        String detail = cause.getClass().getSimpleName()
                + (cause.getMessage() != null ? ": " + cause.getMessage() : "");
        return new TaskResult(TaskStatus.ERROR, correlationId, null, detail);
    }

    public static TaskResult error(String correlationId, String detail) {
        return new TaskResult(TaskStatus.ERROR, correlationId, null, detail);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == TaskStatus.SUCCESS;
    }
}
