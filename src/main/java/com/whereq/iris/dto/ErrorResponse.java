package com.whereq.iris.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Error body returned by the API when a request could not produce its regular response.
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@Schema(description = "Error returned when a request failed")
public class ErrorResponse {

    @Schema(description = "HTTP status code", example = "500")
    private int status;

    @Schema(description = "What went wrong", example = "No output files were generated.")
    private String errorMessage;

    @Schema(description = "Per-file errors collected before the request failed")
    private List<String> errorLog;

    public static ErrorResponse of(int status, String errorMessage) {
        return new ErrorResponse(status, errorMessage, List.of());
    }

    public static ErrorResponse of(int status, String errorMessage, List<String> errorLog) {
        return new ErrorResponse(status, errorMessage, errorLog == null ? List.of() : List.copyOf(errorLog));
    }
}
