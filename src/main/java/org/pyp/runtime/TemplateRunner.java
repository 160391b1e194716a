package org.pyp.runtime;

import org.pyp.compiler.api.GeneratedScript;
import org.pyp.compiler.api.ITemplateCompiler;
import org.pyp.compiler.api.SourceInfo;
import org.pyp.compiler.api.TemplateParseException;
import org.pyp.compiler.diagnostics.Diagnostic;
import org.pyp.config.PypSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Translates a template, runs the generated script and attributes failures to template lines.
 * <p>
 * Output for a file destination is written to a temporary file next to it and moved into
 * place only when the script succeeds, so the destination never holds partial output.
 */
public class TemplateRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(TemplateRunner.class);

    private final ITemplateCompiler compiler;
    private final IScriptExecutor executor;
    private final PypSettings settings;
    private final Writer console;
    private final Writer debugOutput;

    /**
     * @param compiler The template compiler.
     * @param executor The executor for generated scripts.
     * @param settings The runtime settings.
     * @param console Where output goes when no output file is requested.
     */
    public TemplateRunner(ITemplateCompiler compiler, IScriptExecutor executor, PypSettings settings, Writer console) {
        this(compiler, executor, settings, console, null);
    }

    /**
     * @param compiler The template compiler.
     * @param executor The executor for generated scripts.
     * @param settings The runtime settings.
     * @param console Where output goes when no output file is requested.
     * @param debugOutput Where the generated code is printed before it runs in debug mode, or {@code null}.
     */
    public TemplateRunner(ITemplateCompiler compiler, IScriptExecutor executor, PypSettings settings, Writer console,
                          Writer debugOutput) {
        this.compiler = compiler;
        this.executor = executor;
        this.settings = settings;
        this.console = console;
        this.debugOutput = debugOutput;
    }

    /**
     * Translates and runs a template.
     *
     * @param text The template text.
     * @param inputId The template name used in diagnostics.
     * @param outputPath The output file, or {@code null} for the console.
     * @param scriptPath Where to keep the generated script, or {@code null}.
     * @return The result; a failure carries a diagnostic.
     * @throws IOException if the generated script cannot be written, or output cannot be set up.
     */
    public RunResult parseAndRun(String text, String inputId, Path outputPath, Path scriptPath) throws IOException {
        return run(new RunRequest(text, inputId, outputPath, scriptPath, List.of(), null));
    }

    /**
     * Translates and runs a template.
     *
     * @param request The run request.
     * @return The result; a failure carries a diagnostic.
     * @throws IOException if the generated script cannot be written, or output cannot be set up.
     */
    public RunResult run(RunRequest request) throws IOException {
        GeneratedScript script;
        try {
            script = compiler.compile(request.text(), request.inputId());
        } catch (TemplateParseException e) {
            LOGGER.warn("Parse error in '{}' at line {}: {}", request.inputId(), e.getLineNumber(), e.getMessage());
            return RunResult.failure(null, Diagnostic.fromParseError(e));
        }

        String unitName;
        if (request.scriptPath() != null) {
            Files.writeString(request.scriptPath(), script.pythonText(), settings.encoding());
            unitName = request.scriptPath().toString();
            LOGGER.debug("Wrote generated script to {}", request.scriptPath());
        } else {
            unitName = "<pyp " + request.inputId() + ">";
        }

        if (settings.debug() && debugOutput != null) {
            debugOutput.write("PYTHON CODE:\n");
            debugOutput.write(script.pythonText());
            debugOutput.flush();
        }

        List<String> argv = new ArrayList<>();
        argv.add(request.inputId());
        argv.addAll(request.arguments());

        Path tempOutput = request.outputPath() == null ? null
                : request.outputPath().resolveSibling(request.outputPath().getFileName() + settings.tempSuffix());
        Writer output = tempOutput == null ? console : openOutput(tempOutput);

        boolean success = false;
        try {
            LineSink sink = line -> output.write(line + "\n");
            executor.execute(script.pythonText(), unitName, new ScriptContext(sink, argv, request.seed()));
            success = true;
        } catch (ScriptExecutionException e) {
            LOGGER.warn("{} while running '{}' (generated line {}): {}", e.getErrorType(), request.inputId(),
                    e.getGeneratedLine().isPresent() ? e.getGeneratedLine().getAsInt() : "?", e.getMessage());
            return RunResult.failure(script, toDiagnostic(e, script, unitName));
        } finally {
            finishOutput(output, tempOutput, request.outputPath(), success);
        }
        return RunResult.success(script);
    }

    /**
     * Opens the temporary file the output is written to before it is moved into place.
     * @param tempOutput The temporary file.
     * @return The writer.
     * @throws IOException if the file cannot be created.
     */
    protected Writer openOutput(Path tempOutput) throws IOException {
        return Files.newBufferedWriter(tempOutput, settings.encoding());
    }

    private void finishOutput(Writer output, Path tempOutput, Path destination, boolean success) throws IOException {
        if (tempOutput == null) {
            output.flush();
            return;
        }
        if (!success) {
            try {
                output.close();
            } catch (IOException e) {
                // the script failure is the error that gets reported
                LOGGER.warn("Failed to close temporary output {}", tempOutput, e);
            } finally {
                Files.deleteIfExists(tempOutput);
            }
            return;
        }
        try {
            output.close();
            promote(tempOutput, destination);
        } catch (IOException e) {
            Files.deleteIfExists(tempOutput);
            throw e;
        }
        LOGGER.debug("Output written to {}", destination);
    }

    private static void promote(Path tempOutput, Path destination) throws IOException {
        try {
            Files.move(tempOutput, destination, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOGGER.debug("Atomic move not supported for {}, replacing instead", destination);
            Files.move(tempOutput, destination, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Diagnostic toDiagnostic(ScriptExecutionException e, GeneratedScript script, String unitName) {
        Optional<SourceInfo> location = e.getGeneratedLine().isPresent()
                ? script.resolve(e.getGeneratedLine().getAsInt())
                : Optional.empty();

        if (e.getKind() == ScriptExecutionException.Kind.SYNTAX) {
            return new Diagnostic(Diagnostic.Type.SYNTAX_ERROR, e.getErrorType(), e.getMessage(),
                    script.programName(), location.orElse(null), e.getDetail(), List.of());
        }

        String detail = null;
        if (location.isEmpty() && e.getGeneratedLine().isPresent()) {
            detail = String.format("  File \"%s\", line %d", unitName, e.getGeneratedLine().getAsInt());
        }
        List<String> traceback = settings.debug() ? mapTraceback(e.getFrameLines(), script) : List.of();
        return new Diagnostic(Diagnostic.Type.RUNTIME_ERROR, e.getErrorType(), e.getMessage(),
                script.programName(), location.orElse(null), detail, traceback);
    }

    private static List<String> mapTraceback(List<Integer> frameLines, GeneratedScript script) {
        List<String> lines = new ArrayList<>();
        for (int generatedLine : frameLines) {
            Optional<SourceInfo> frame = script.resolve(generatedLine);
            if (frame.isPresent()) {
                lines.add("  " + frame.get());
                lines.add("    " + frame.get().lineContent());
            } else {
                lines.add("(Unknown pyp line)");
            }
        }
        return lines;
    }
}
