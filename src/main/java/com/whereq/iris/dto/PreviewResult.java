package com.whereq.iris.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Preview of one uploaded image, or the reason there is none.
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Preview of one uploaded image")
public class PreviewResult {

    @Schema(description = "Filename as uploaded", example = "cells.czi")
    private String filename;

    @Schema(description = "Name the file was stored under", example = "3f2a9c1e_cells.czi")
    private String uniqueFilename;

    @Schema(description = "Preview image as a data URI", example = "data:image/png;base64,iVBORw0...")
    private String preview;

    @Schema(description = "Image metadata as reported by the engine")
    private String metadata;

    @Schema(description = "Lower-case file extension", example = "czi")
    private String fileType;

    @Schema(description = "Error message if no preview could be produced")
    private String error;

    @JsonIgnore
    public boolean isFailed() {
        return error != null;
    }

    public static PreviewResult error(String filename, String error) {
        return PreviewResult.builder()
            .filename(filename)
            .error(error)
            .build();
    }
}
