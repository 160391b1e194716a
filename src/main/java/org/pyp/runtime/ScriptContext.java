package org.pyp.runtime;

import java.util.List;

/**
 * What the host provides to one execution of a generated script.
 *
 * @param output The output capability, bound to {@code _PRINT} in the script.
 * @param arguments The script's {@code sys.argv}; the first element is the template name.
 * @param seed The seed for Python's {@code random} module, or {@code null} to leave it unseeded.
 */
public record ScriptContext(LineSink output, List<String> arguments, Long seed) {

    public ScriptContext {
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }
}
