package com.whereq.iris.controller;

import com.whereq.iris.dto.UploadResponse;
import com.whereq.iris.exception.EmptyBatchException;
import com.whereq.iris.service.ImagePreviewService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.Part;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Uploads images and returns a preview for each of them.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/images")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Images", description = "Upload images and preview them")
public class ImageUploadController {

    private final ImagePreviewService previewService;

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Upload images", description = "Convert every uploaded image into a PNG preview plus metadata")
    public Mono<ResponseEntity<UploadResponse>> upload(@RequestBody Mono<MultiValueMap<String, Part>> form) {
        return form
            .flatMapMany(parts -> {
                List<FilePartImage> files = MultipartForms.files(parts);
                log.info("Received upload of {} files", files.size());
                return previewService.preview(files);
            })
            .collectList()
            .map(results -> ResponseEntity.ok(new UploadResponse(results)))
            .onErrorResume(EmptyBatchException.class, e -> {
                log.error("Validation error: {}", e.getMessage());
                return Mono.just(ResponseEntity.badRequest().build());
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Unexpected error during upload", e);
                return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build());
            });
    }
}
