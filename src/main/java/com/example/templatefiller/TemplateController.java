package com.example.templatefiller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
public class TemplateController {

    public static final String UNRESOLVED_HEADER = "X-Unresolved-Placeholders";
    private static final MediaType DOCX = MediaType.parseMediaType(S3DocumentStore.DOCX_CONTENT_TYPE);

    private final TemplateFiller templateFiller;
    private final TemplateSource templateSource;
    private final DocumentSink documentSink;

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    /** Fills a stored template and returns it as a download. */
    @PostMapping("/fill")
    public ResponseEntity<byte[]> fill(@RequestBody FillRequest request) {
        log.info("fill: template={}, {} placeholders, {} images", request.getTemplateKey(),
                sizeOf(request.getPlaceholders()), sizeOf(request.getImages()));
        byte[] template = templateSource.fetch(request.getTemplateKey());
        FillResult result = templateFiller.fill(template, request.getPlaceholders(), request.getImages());

        ResponseEntity.BodyBuilder ok = ResponseEntity.ok()
                .contentType(DOCX)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(request.getOutputFilename()).build().toString());
        if (!result.unresolved.isEmpty()) ok.header(UNRESOLVED_HEADER, String.join(",", result.unresolved));
        return ok.body(result.document);
    }

    /** Fills a stored template and uploads the result next to it. */
    @PostMapping("/fill-and-upload")
    public UploadResponse fillAndUpload(@RequestBody FillAndUploadRequest request) {
        if (request.getOutputKey() == null || request.getOutputKey().isBlank()) {
            throw new IllegalArgumentException("output_key is required");
        }
        log.info("fill-and-upload: template={} -> {}", request.getTemplateKey(), request.getOutputKey());
        byte[] template = templateSource.fetch(request.getTemplateKey());
        FillResult result = templateFiller.fill(template, request.getPlaceholders(), request.getImages());
        String url = documentSink.store(request.getOutputKey(), result.document);
        return new UploadResponse(true, request.getOutputKey(), url, new ArrayList<>(result.unresolved));
    }

    /** Lists the placeholders a stored template expects. */
    @PostMapping("/placeholders")
    public PlaceholdersResponse placeholders(@RequestBody PlaceholdersRequest request) {
        byte[] template = templateSource.fetch(request.getTemplateKey());
        return new PlaceholdersResponse(request.getTemplateKey(), new ArrayList<>(templateFiller.placeholders(template)));
    }

    private static int sizeOf(Map<?, ?> m) { return m == null ? 0 : m.size(); }
}
