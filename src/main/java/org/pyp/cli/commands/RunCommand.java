package org.pyp.cli.commands;

import org.pyp.cli.CommandLineInterface;
import org.pyp.compiler.TemplateCompiler;
import org.pyp.config.PypSettings;
import org.pyp.runtime.RunRequest;
import org.pyp.runtime.RunResult;
import org.pyp.runtime.TemplateRunner;
import org.pyp.runtime.jython.JythonScriptExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "run", description = "Translates a template to Python and runs it.")
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Parameters(index = "0", paramLabel = "TEMPLATE", description = "The template file.")
    private File template;

    @Parameters(index = "1..*", paramLabel = "ARGS", description = "Arguments passed to the script as sys.argv[1:].")
    private List<String> arguments = new ArrayList<>();

    @Option(names = {"-o", "--output"}, description = "Write the output to this file instead of standard output.")
    private File output;

    @Option(names = {"-p", "--py"}, description = "Keep the generated Python script in this file.")
    private File script;

    @Option(names = "--debug", description = "Print the generated code and the template traceback on failures.")
    private boolean debug;

    @Option(names = "--seed", description = "Seed for Python's random module.")
    private Long seed;

    @Override
    public Integer call() {
        PypSettings settings = parent.getSettings();
        if (debug) {
            settings = settings.withDebug(true);
        }
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        String text;
        try {
            text = Files.readString(template.toPath(), settings.encoding());
        } catch (IOException e) {
            err.println("Cannot read template " + template + ": " + e.getMessage());
            return 1;
        }

        TemplateRunner runner = new TemplateRunner(new TemplateCompiler(), new JythonScriptExecutor(), settings, out, err);
        RunRequest request = new RunRequest(text, template.getPath(),
                output != null ? output.toPath() : null,
                script != null ? script.toPath() : null,
                arguments, seed);

        RunResult result;
        try {
            result = runner.run(request);
        } catch (IOException e) {
            log.error("I/O failure while running {}", template, e);
            err.println("Error running " + template + ": " + e.getMessage());
            return 1;
        } finally {
            out.flush();
        }

        if (!result.isSuccess()) {
            result.getDiagnostic().ifPresent(diagnostic -> err.println(diagnostic.render()));
            err.flush();
            return 1;
        }
        return 0;
    }
}
