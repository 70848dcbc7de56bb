package com.example.flowcodegen.codegen.dialect;

import com.example.flowcodegen.codegen.WorkflowCodeGenerator;
import org.springframework.stereotype.Component;
import tools.jackson.databind.json.JsonMapper;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Default implementation of {@link DialectRegistry} registering the "agentchord" and "agentweave" dialects.
 */
@Component
public class DefaultDialectRegistry implements DialectRegistry {

    private final Map<String, WorkflowCodeGenerator> generators;

    public DefaultDialectRegistry(JsonMapper jsonMapper) {
        this.generators = Stream.of(new AgentChordDialect(), new AgentWeaveDialect())
                .map(dialect -> new WorkflowCodeGenerator(dialect, jsonMapper))
                .collect(Collectors.toMap(generator -> generator.dialect().id(), Function.identity()));
    }

    @Override
    public Optional<WorkflowCodeGenerator> find(String dialectId) {
        if (dialectId == null || dialectId.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(generators.get(dialectId.trim().toLowerCase(Locale.ROOT)));
    }

    @Override
    public List<CodeDialect> getDialects() {
        return generators.values().stream()
                .map(WorkflowCodeGenerator::dialect)
                .sorted(Comparator.comparing(CodeDialect::id))
                .collect(Collectors.toList());
    }

    @Override
    public List<String> getAvailableDialectIds() {
        return generators.keySet().stream().sorted().collect(Collectors.toList());
    }
}
