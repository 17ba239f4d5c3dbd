package com.planforge.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    /** Machine-readable code, e.g. {@code generation_in_progress}. */
    private String error;
    private String message;
    private Integer status;
    private Instant timestamp;
    private String path;
    private Long attemptsUsed;
    private Integer attemptCap;
}
