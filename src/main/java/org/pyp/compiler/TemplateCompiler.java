package org.pyp.compiler;

import org.pyp.compiler.api.GeneratedScript;
import org.pyp.compiler.api.ITemplateCompiler;
import org.pyp.compiler.api.TemplateParseException;
import org.pyp.compiler.backend.emit.CodeGenerator;
import org.pyp.compiler.frontend.SourceLine;
import org.pyp.compiler.frontend.parser.BlockParser;
import org.pyp.compiler.frontend.parser.ParseResult;
import org.pyp.compiler.frontend.preprocessor.PreProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The main template compiler. This class orchestrates the translation pipeline from template
 * text to a Python script: preprocessing, parsing and code generation. It is not thread-safe.
 */
public class TemplateCompiler implements ITemplateCompiler {

    private static final Logger LOGGER = LoggerFactory.getLogger(TemplateCompiler.class);

    /**
     * {@inheritDoc}
     */
    @Override
    public GeneratedScript compile(String text, String programName) throws TemplateParseException {
        return compile(PreProcessor.splitLines(text), programName);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public GeneratedScript compile(List<String> sourceLines, String programName) throws TemplateParseException {
        // Phase 1: Preprocessing (multi-line expressions)
        List<SourceLine> lines = new PreProcessor().process(sourceLines);

        // Phase 2: Parsing (tree and line map)
        ParseResult parsed = new BlockParser(programName).parse(lines);

        // Phase 3: Code generation
        String python = new CodeGenerator().generate(parsed.root());

        LOGGER.debug("Compiled '{}': {} template lines, {} generated lines, {} mapped",
                programName, sourceLines.size(), parsed.generatedLineCount(), parsed.lineMap().size());
        return new GeneratedScript(programName, List.copyOf(sourceLines), python, parsed.lineMap());
    }
}
