package com.logflow.anomaly.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class ErrorResponseDto {
    private int status;
    private String error;
    private String message;
    private Instant timestamp;
}
