package com.whereq.iris.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for image upload.
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Previews for every uploaded image")
public class UploadResponse {

    @Schema(description = "One entry per uploaded file, in upload order")
    private List<PreviewResult> results;
}
