package com.cvrfplatform.belief.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body for every non-2xx response. {@code field} is set only for validation failures.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    @JsonProperty("code")    String code,
    @JsonProperty("message") String message,
    @JsonProperty("field")   String field
) {}
