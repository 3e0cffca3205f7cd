package com.whereq.iris.controller;

import com.whereq.iris.dto.ErrorResponse;
import com.whereq.iris.service.MacroGenerationService;
import com.whereq.iris.stream.StreamTransport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/**
 * Server-sent event streams for macro generation and prompt improvement.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
@Validated
@Tag(name = "Macro Generation", description = "Generate ImageJ macros with a language model")
public class MacroGenerationController {

    private final MacroGenerationService generationService;
    private final StreamTransport transport;

    @GetMapping(value = "/stream-generate-macro", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Generate macro",
            description = "Stream a generated macro as description, macro_script and explanation sections, "
                    + "optionally preceded by the improved prompt it was generated from")
    public Flux<ServerSentEvent<String>> generateMacro(
            @Parameter(description = "What the macro should do") @RequestParam("input") @NotBlank String input,
            @Parameter(description = "Improve the prompt before generating")
            @RequestParam(value = "improve_prompt", defaultValue = "false") boolean improvePrompt) {
        log.info("Received macro generation request (improve prompt: {})", improvePrompt);
        return transport.stream(generationService.generateMacro(input, improvePrompt));
    }

    @GetMapping(value = "/stream-improve-prompt", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Improve prompt", description = "Stream a more detailed version of a generation prompt")
    public Flux<ServerSentEvent<String>> improvePrompt(
            @Parameter(description = "Prompt to improve") @RequestParam("input") @NotBlank String input) {
        log.info("Received prompt improvement request");
        return transport.stream(generationService.improvePrompt(input));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> invalidInput(ConstraintViolationException e) {
        log.error("Validation error: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.of(400, "Input must not be blank"));
    }
}
