package com.cred.freestyle.marketplace.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Body of every API error: {timestamp, status, error, message, path, details}.
 * {@code details} is omitted when empty.
 *
 * @author Marketplace Team
 */
@Getter
@Setter
@NoArgsConstructor
@JsonPropertyOrder({"timestamp", "status", "error", "message", "path", "details"})
public class ErrorResponse {

    private Instant timestamp = Instant.now();
    private Integer status;
    private String error;
    private String message;
    private String path;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private Map<String, Object> details = new LinkedHashMap<>();

    public ErrorResponse(Integer status, String error, String message, String path) {
        this.status = status;
        this.error = error;
        this.message = message;
        this.path = path;
    }

    /**
     * Add a detail entry. Null values are skipped.
     *
     * @param key Detail key
     * @param value Detail value
     * @return this response
     */
    public ErrorResponse addDetail(String key, Object value) {
        if (value != null) {
            details.put(key, value);
        }
        return this;
    }
}
