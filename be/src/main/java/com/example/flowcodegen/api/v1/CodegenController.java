package com.example.flowcodegen.api.v1;

import com.example.flowcodegen.api.v1.dto.DialectListResponse;
import com.example.flowcodegen.api.v1.dto.GenerateCodeRequest;
import com.example.flowcodegen.api.v1.dto.GeneratedCodeResponse;
import com.example.flowcodegen.service.CodeGenerationService;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;

/**
 * REST controller compiling editor graphs to Python.
 * <p>
 * {@code POST /api/v1/codegen} returns the code as JSON, {@code POST /api/v1/codegen/export} as a
 * {@code .py} attachment, {@code GET /api/v1/codegen/dialects} lists the output dialects.
 * </p>
 */
@RestController
@RequestMapping("/api/v1/codegen")
@RequiredArgsConstructor
@Slf4j
public class CodegenController {

    private final CodeGenerationService service;

    @PostMapping
    public ResponseEntity<GeneratedCodeResponse> generate(@Valid @RequestBody GenerateCodeRequest request) {
        log.info("Generating code name={} dialect={} nodeCount={} edgeCount={}",
                request.name(), request.dialect(), request.nodes().size(), request.edges().size());
        return ResponseEntity.ok(service.generate(request));
    }

    @PostMapping("/export")
    public ResponseEntity<String> export(@Valid @RequestBody GenerateCodeRequest request) {
        log.info("Exporting code name={} dialect={} nodeCount={}", request.name(), request.dialect(), request.nodes().size());
        GeneratedCodeResponse generated = service.generate(request);
        String filename = service.exportFileName(request.name());
        return ResponseEntity.ok()
                .contentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8))
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(filename).build().toString())
                .body(generated.code());
    }

    @GetMapping("/dialects")
    public ResponseEntity<DialectListResponse> dialects() {
        log.debug("Listing dialects");
        return ResponseEntity.ok(service.listDialects());
    }
}
