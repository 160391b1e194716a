package org.pyp.compiler.api;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Defines the public interface for the pyp template compiler.
 */
public interface ITemplateCompiler {

    /**
     * Translates a template into a Python script.
     *
     * @param sourceLines The lines of the template.
     * @param programName A name for the template, used in diagnostics.
     * @return The {@link GeneratedScript} with its line map.
     * @throws TemplateParseException if the template's control keywords are not properly nested.
     */
    GeneratedScript compile(List<String> sourceLines, String programName) throws TemplateParseException;

    /**
     * Translates a template given as one text.
     *
     * @param text The complete template text.
     * @param programName A name for the template, used in diagnostics.
     * @return The {@link GeneratedScript} with its line map.
     * @throws TemplateParseException if the template's control keywords are not properly nested.
     */
    GeneratedScript compile(String text, String programName) throws TemplateParseException;

    /**
     * Translates the template stored in a file.
     * @param templatePath The path to the template.
     * @param encoding The encoding of the template file.
     * @return The {@link GeneratedScript}.
     * @throws TemplateParseException if the template is structurally invalid.
     * @throws IOException if the file cannot be read.
     */
    default GeneratedScript compile(Path templatePath, Charset encoding) throws TemplateParseException, IOException {
        return compile(Files.readString(templatePath, encoding), templatePath.toString());
    }
}
