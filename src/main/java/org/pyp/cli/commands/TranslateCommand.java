package org.pyp.cli.commands;

import org.pyp.cli.CommandLineInterface;
import org.pyp.compiler.TemplateCompiler;
import org.pyp.compiler.api.GeneratedScript;
import org.pyp.compiler.api.TemplateParseException;
import org.pyp.compiler.diagnostics.Diagnostic;
import org.pyp.config.PypSettings;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@Command(name = "translate", description = "Translates a template to Python without running it.")
public class TranslateCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Parameters(index = "0", paramLabel = "TEMPLATE", description = "The template file.")
    private File template;

    @Option(names = {"-p", "--py"}, description = "Write the generated Python script to this file instead of standard output.")
    private File script;

    @Override
    public Integer call() {
        PypSettings settings = parent.getSettings();
        try {
            GeneratedScript generated = new TemplateCompiler().compile(template.toPath(), settings.encoding());
            if (script != null) {
                Files.writeString(script.toPath(), generated.pythonText(), settings.encoding());
            } else {
                spec.commandLine().getOut().print(generated.pythonText());
                spec.commandLine().getOut().flush();
            }
            return 0;
        } catch (TemplateParseException e) {
            spec.commandLine().getErr().println(Diagnostic.fromParseError(e).render());
            return 1;
        } catch (IOException e) {
            spec.commandLine().getErr().println("Error translating " + template + ": " + e.getMessage());
            return 1;
        }
    }
}
