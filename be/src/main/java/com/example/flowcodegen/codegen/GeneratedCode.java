package com.example.flowcodegen.codegen;

import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The four sections of a generated program. Blank sections are dropped when assembling.
 */
public record GeneratedCode(
        OutputFormat format,
        String imports,
        String declarations,
        String body,
        String entrypoint
) {

    public GeneratedCode {
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(imports, "imports");
    }

    public String toSource() {
        return Stream.of(imports, declarations, body, entrypoint)
                .filter(section -> section != null && !section.isBlank())
                .collect(Collectors.joining("\n\n"));
    }
}
