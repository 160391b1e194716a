package org.pyp.runtime;

import java.nio.file.Path;
import java.util.List;

/**
 * A request to translate and run one template.
 *
 * @param text The template text.
 * @param inputId The template name used in diagnostics and as {@code sys.argv[0]}.
 * @param outputPath Where to write the output, or {@code null} to write to the console.
 * @param scriptPath Where to keep the generated script, or {@code null} to not keep it.
 * @param arguments Extra template arguments, appended to {@code sys.argv}.
 * @param seed The seed for Python's {@code random} module, or {@code null}.
 */
public record RunRequest(String text, String inputId, Path outputPath, Path scriptPath,
                         List<String> arguments, Long seed) {

    public RunRequest {
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }
}
