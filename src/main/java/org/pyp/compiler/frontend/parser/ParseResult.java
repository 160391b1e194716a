package org.pyp.compiler.frontend.parser;

import org.pyp.compiler.api.LineMap;
import org.pyp.compiler.frontend.parser.ast.Sequence;

/**
 * The output of the {@link BlockParser}.
 *
 * @param root The root sequence of the template.
 * @param lineMap The generated-line to template-line mapping.
 * @param generatedLineCount The number of lines code generation will produce for {@code root}.
 */
public record ParseResult(Sequence root, LineMap lineMap, int generatedLineCount) {}
