package org.pyp.runtime;

import java.io.IOException;

/**
 * The single capability a generated script gets from its host: writing one line of output.
 */
@FunctionalInterface
public interface LineSink {

    /**
     * Writes one output line; the line terminator is added by the sink.
     * @param line The line content.
     * @throws IOException if the output cannot be written.
     */
    void writeLine(String line) throws IOException;
}
