package com.example.flowcodegen.config;

import com.example.flowcodegen.api.v1.dto.GenerateCodeRequest;
import com.example.flowcodegen.api.v1.dto.SampleListItem;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Collectors;

/**
 * Loads the sample graphs bundled under {@code classpath:samples/} at startup. A sample's id is
 * its file name without {@code .json}; samples are listed by id.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SampleWorkflowCatalog implements ApplicationRunner {

    private static final String SAMPLES_PATTERN = "classpath:samples/*.json";
    private static final String EXTENSION = ".json";

    private final JsonMapper jsonMapper;
    private final Map<String, GenerateCodeRequest> samples = new ConcurrentSkipListMap<>();

    @Override
    public void run(ApplicationArguments args) throws IOException {
        Resource[] resources = new PathMatchingResourcePatternResolver().getResources(SAMPLES_PATTERN);
        Arrays.stream(resources)
                .sorted(Comparator.comparing(resource -> String.valueOf(resource.getFilename())))
                .forEach(this::loadSample);
        log.info("Loaded {} sample workflows", samples.size());
    }

    private void loadSample(Resource resource) {
        String filename = resource.getFilename();
        if (filename == null || !filename.endsWith(EXTENSION)) {
            return;
        }
        String id = filename.substring(0, filename.length() - EXTENSION.length());
        try (InputStream in = resource.getInputStream()) {
            samples.put(id, jsonMapper.readValue(in, GenerateCodeRequest.class));
            log.debug("Loaded sample workflow: {}", id);
        } catch (JacksonException e) {
            log.error("Failed to parse sample workflow {}: {}", filename, e.getMessage());
        } catch (IOException e) {
            log.error("Failed to read sample workflow {}: {}", filename, e.getMessage());
        }
    }

    public List<SampleListItem> list() {
        return samples.entrySet().stream()
                .map(entry -> new SampleListItem(
                        entry.getKey(),
                        entry.getValue().name(),
                        entry.getValue().nodes() != null ? entry.getValue().nodes().size() : 0,
                        entry.getValue().edges() != null ? entry.getValue().edges().size() : 0))
                .collect(Collectors.toList());
    }

    public Optional<GenerateCodeRequest> find(String id) {
        return Optional.ofNullable(samples.get(id));
    }
}
