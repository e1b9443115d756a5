package com.scorekeeperapp.scoring.dto.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private String message;
    private T data;
    private List<String> warnings;

    public static <T> ApiResponse<T> ok(String message, T data) {
        return ApiResponse.<T>builder()
                .message(message)
                .data(data)
                .build();
    }

    public static <T> ApiResponse<T> ok(String message, T data, List<String> warnings) {
        return ApiResponse.<T>builder()
                .message(message)
                .data(data)
                .warnings((warnings == null || warnings.isEmpty()) ? null : warnings)
                .build();
    }
}
