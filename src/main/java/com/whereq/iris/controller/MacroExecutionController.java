package com.whereq.iris.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.iris.dto.ErrorResponse;
import com.whereq.iris.exception.BatchExecutionException;
import com.whereq.iris.exception.EmptyBatchException;
import com.whereq.iris.exception.EngineUnavailableException;
import com.whereq.iris.model.BatchResult;
import com.whereq.iris.model.JobParameters;
import com.whereq.iris.service.CleanupScheduler;
import com.whereq.iris.service.MacroOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.Part;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs a user macro against a batch of uploaded images and streams back the zipped results.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/macros")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Macro Execution", description = "Execute ImageJ macros against uploaded images")
public class MacroExecutionController {

    static final String ERROR_COUNT_HEADER = "X-Iris-Error-Count";
    static final int CHUNK_SIZE = 1024 * 1024;

    private final MacroOrchestrator orchestrator;
    private final CleanupScheduler cleanupScheduler;
    private final ObjectMapper objectMapper;

    @PostMapping(value = "/execute", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Execute macro",
            description = "Run the macro against every uploaded image and download all produced files as one zip")
    public Mono<ResponseEntity<Flux<DataBuffer>>> execute(@RequestBody Mono<MultiValueMap<String, Part>> form) {
        return form
            .flatMap(parts -> {
                List<FilePartImage> files = MultipartForms.files(parts);
                log.info("Received macro execution request for {} files", files.size());
                return orchestrator.execute(files, MultipartForms.field(parts, "macroScript"), parameters(parts));
            })
            .map(this::toZipResponse)
            .onErrorResume(EmptyBatchException.class, e -> {
                log.error("Validation error: {}", e.getMessage());
                return Mono.just(error(HttpStatus.BAD_REQUEST, ErrorResponse.of(400, e.getMessage())));
            })
            .onErrorResume(IllegalArgumentException.class, e -> {
                log.error("Invalid parameter: {}", e.getMessage());
                return Mono.just(error(HttpStatus.BAD_REQUEST, ErrorResponse.of(400, "Invalid parameter: " + e.getMessage())));
            })
            .onErrorResume(BatchExecutionException.class, e -> {
                log.error("Batch failed: {}", e.getMessage());
                return Mono.just(error(HttpStatus.INTERNAL_SERVER_ERROR, ErrorResponse.of(500, e.getMessage(), e.getErrorLog())));
            })
            .onErrorResume(EngineUnavailableException.class, e -> {
                log.error("Engine unavailable: {}", e.getMessage());
                return Mono.just(error(HttpStatus.SERVICE_UNAVAILABLE, ErrorResponse.of(503, e.getMessage())));
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Unexpected error during macro execution", e);
                return Mono.just(error(HttpStatus.INTERNAL_SERVER_ERROR,
                    ErrorResponse.of(500, "Internal server error: " + e.getMessage())));
            });
    }

    private ResponseEntity<Flux<DataBuffer>> toZipResponse(BatchResult result) {
        Path archive = result.getArchive().getPath();
        log.info("Sending ZIP file: {} ({} bytes)", archive, result.getArchive().getSize());

        Flux<DataBuffer> body = cleanupScheduler.releaseAfter(
            DataBufferUtils.read(archive, DefaultDataBufferFactory.sharedInstance, CHUNK_SIZE),
            archive.getParent());

        return ResponseEntity.ok()
            .contentType(MediaType.parseMediaType("application/zip"))
            .contentLength(result.getArchive().getSize())
            .header(HttpHeaders.CONTENT_DISPOSITION,
                ContentDisposition.attachment().filename(archive.getFileName().toString()).build().toString())
            .header(ERROR_COUNT_HEADER, String.valueOf(result.getErrorLog().size()))
            .body(body);
    }

    private ResponseEntity<Flux<DataBuffer>> error(HttpStatus status, ErrorResponse response) {
        byte[] json;
        try {
            json = objectMapper.writeValueAsBytes(response);
        } catch (JsonProcessingException e) {
            json = ("{\"status\":" + response.getStatus() + "}").getBytes(StandardCharsets.UTF_8);
        }
        return ResponseEntity.status(status)
            .contentType(MediaType.APPLICATION_JSON)
            .body(Flux.just(DefaultDataBufferFactory.sharedInstance.wrap(json)));
    }

    static JobParameters parameters(MultiValueMap<String, Part> parts) {
        JobParameters parameters = JobParameters.defaults();
        String minSize = MultipartForms.field(parts, "minSize");
        String maxSize = MultipartForms.field(parts, "maxSize");
        String minCircularity = MultipartForms.field(parts, "minCircularity");
        String maxCircularity = MultipartForms.field(parts, "maxCircularity");
        if (minSize != null) {
            parameters.setMinSize(Double.parseDouble(minSize.strip()));
        }
        if (maxSize != null) {
            parameters.setMaxSize(maxSize.strip());
        }
        if (minCircularity != null) {
            parameters.setMinCircularity(Double.parseDouble(minCircularity.strip()));
        }
        if (maxCircularity != null) {
            parameters.setMaxCircularity(Double.parseDouble(maxCircularity.strip()));
        }
        return parameters;
    }
}
