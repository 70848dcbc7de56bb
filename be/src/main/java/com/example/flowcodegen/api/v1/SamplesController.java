package com.example.flowcodegen.api.v1;

import com.example.flowcodegen.api.SampleWorkflowNotFoundException;
import com.example.flowcodegen.api.v1.dto.GenerateCodeRequest;
import com.example.flowcodegen.api.v1.dto.GeneratedCodeResponse;
import com.example.flowcodegen.api.v1.dto.SampleListResponse;
import com.example.flowcodegen.config.SampleWorkflowCatalog;
import com.example.flowcodegen.service.CodeGenerationService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the bundled sample graphs and their generated code.
 */
@RestController
@RequestMapping("/api/v1/samples")
@RequiredArgsConstructor
@Slf4j
public class SamplesController {

    private final SampleWorkflowCatalog catalog;
    private final CodeGenerationService service;

    @GetMapping
    public ResponseEntity<SampleListResponse> list() {
        log.debug("Listing sample workflows");
        return ResponseEntity.ok(new SampleListResponse(catalog.list()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<GenerateCodeRequest> getById(@PathVariable String id) {
        log.info("Getting sample workflow id={}", id);
        return ResponseEntity.ok(find(id));
    }

    @GetMapping("/{id}/code")
    public ResponseEntity<GeneratedCodeResponse> code(@PathVariable String id, @RequestParam(required = false) String dialect) {
        log.info("Generating code for sample id={} dialect={}", id, dialect);
        GenerateCodeRequest sample = find(id);
        GenerateCodeRequest request = new GenerateCodeRequest(
                sample.name(),
                dialect != null && !dialect.isBlank() ? dialect : sample.dialect(),
                sample.nodes(),
                sample.edges());
        return ResponseEntity.ok(service.generate(request));
    }

    private GenerateCodeRequest find(String id) {
        return catalog.find(id).orElseThrow(() -> new SampleWorkflowNotFoundException(id));
    }
}
