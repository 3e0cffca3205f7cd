package com.whereq.iris.controller;

import com.whereq.iris.dto.PreviewResult;
import com.whereq.iris.exception.EmptyBatchException;
import com.whereq.iris.service.ImagePreviewService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.function.BodyInserters;
import reactor.core.publisher.Flux;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ImageUploadControllerTest {

    private ImagePreviewService previewService;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        previewService = mock(ImagePreviewService.class);
        client = WebTestClient.bindToController(new ImageUploadController(previewService)).build();
    }

    @Test
    void upload_returnsOneResultPerFile() {
        when(previewService.preview(anyList())).thenReturn(Flux.just(
                PreviewResult.builder()
                        .filename("a.czi")
                        .uniqueFilename("1a2b3c4d_a.czi")
                        .preview("data:image/png;base64,AAAA")
                        .metadata("Width: 512")
                        .fileType("czi")
                        .build(),
                PreviewResult.error("b.czi", "Preview path missing from engine output")));

        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("files", resource("a.czi"));
        builder.part("files", resource("b.czi"));

        client.post().uri("/api/v1/images/upload")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(builder.build()))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.results.length()").isEqualTo(2)
                .jsonPath("$.results[0].preview").isEqualTo("data:image/png;base64,AAAA")
                .jsonPath("$.results[0].fileType").isEqualTo("czi")
                .jsonPath("$.results[1].filename").isEqualTo("b.czi")
                .jsonPath("$.results[1].error").isEqualTo("Preview path missing from engine output")
                .jsonPath("$.results[1].preview").doesNotExist();
    }

    @Test
    void upload_withoutFilesIsBadRequest() {
        when(previewService.preview(anyList())).thenReturn(Flux.error(new EmptyBatchException()));

        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("note", "nothing attached");

        client.post().uri("/api/v1/images/upload")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(builder.build()))
                .exchange()
                .expectStatus().isBadRequest();
    }

    private static ByteArrayResource resource(String name) {
        return new ByteArrayResource(new byte[]{7, 7, 7}) {
            @Override
            public String getFilename() {
                return name;
            }
        };
    }
}
