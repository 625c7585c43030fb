package com.barka.mcp.core.response;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * The only shape ever returned from {@code call_tool}. Exactly one of {@code data} and
 * {@code error_message} is set; {@code error_kind} accompanies the message.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record McpResponse<T>(
        String status,
        T data,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("error_kind") ErrorKind errorKind
) {
    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    public static <T> McpResponse<T> success(T data) {
        return new McpResponse<>(SUCCESS, data, null, null);
    }

    public static <T> McpResponse<T> error(ErrorKind kind, String message) {
        Objects.requireNonNull(kind, "kind");
        return new McpResponse<>(ERROR, null, singleLine(message), kind);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }

    private static String singleLine(String message) {
        if (message == null || message.isBlank()) {
            return "Unknown error";
        }
        return message.replaceAll("\\s*[\\r\\n]+\\s*", " ").trim();
    }
}
