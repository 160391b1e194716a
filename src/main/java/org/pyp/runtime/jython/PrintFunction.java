package org.pyp.runtime.jython;

import org.pyp.runtime.LineSink;
import org.python.core.Py;
import org.python.core.PyObject;
import org.python.core.PyString;
import org.python.core.PyUnicode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * The Python callable bound to {@code _PRINT}: writes its single argument as one output line.
 */
final class PrintFunction extends PyObject {

    private final transient LineSink sink;

    PrintFunction(LineSink sink) {
        this.sink = sink;
    }

    @Override
    public PyObject __call__(PyObject[] args, String[] keywords) {
        if (args.length != 1 || keywords.length != 0) {
            throw Py.TypeError("_PRINT() takes exactly 1 argument (" + args.length + " given)");
        }
        try {
            sink.writeLine(asText(args[0]));
        } catch (IOException e) {
            throw Py.IOError(e);
        }
        return Py.None;
    }

    /**
     * Byte strings hold UTF-8, the encoding string literals of the generated source are compiled
     * with; unicode strings are taken as they are.
     */
    static String asText(PyObject value) {
        if (value instanceof PyUnicode unicode) {
            return unicode.getString();
        }
        PyString string = value instanceof PyString text ? text : value.__str__();
        if (string instanceof PyUnicode unicode) {
            return unicode.getString();
        }
        return new String(string.getString().getBytes(StandardCharsets.ISO_8859_1), StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "<built-in function _PRINT>";
    }
}
