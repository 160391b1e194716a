package org.pyp.runtime;

import org.pyp.compiler.api.GeneratedScript;
import org.pyp.compiler.diagnostics.Diagnostic;

import java.util.Optional;

/**
 * The outcome of running a template.
 *
 * @param script The generated script, or {@code null} if parsing failed.
 * @param diagnostic The failure, or {@code null} on success.
 */
public record RunResult(GeneratedScript script, Diagnostic diagnostic) {

    public static RunResult success(GeneratedScript script) {
        return new RunResult(script, null);
    }

    public static RunResult failure(GeneratedScript script, Diagnostic diagnostic) {
        return new RunResult(script, diagnostic);
    }

    public boolean isSuccess() {
        return diagnostic == null;
    }

    public Optional<Diagnostic> getDiagnostic() {
        return Optional.ofNullable(diagnostic);
    }

    public Optional<GeneratedScript> getScript() {
        return Optional.ofNullable(script);
    }
}
