package org.pyp.runtime.jython;

import org.pyp.runtime.IScriptExecutor;
import org.pyp.runtime.ScriptContext;
import org.pyp.runtime.ScriptExecutionException;
import org.python.core.Py;
import org.python.core.PyCode;
import org.python.core.PyException;
import org.python.core.PyFrame;
import org.python.core.PyList;
import org.python.core.PyObject;
import org.python.core.PySystemState;
import org.python.core.PyTraceback;
import org.python.util.PythonInterpreter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Runs generated scripts on Jython. Every execution gets a fresh interpreter whose namespace
 * holds nothing but {@code _PRINT}.
 */
public class JythonScriptExecutor implements IScriptExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(JythonScriptExecutor.class);

    /** Name under which the output capability is visible to the script. */
    public static final String OUTPUT_FUNCTION = "_PRINT";

    private static boolean runtimeInitialized = false;

    private static synchronized void initializeRuntime() {
        if (runtimeInitialized) {
            return;
        }
        Properties properties = new Properties();
        properties.setProperty("python.import.site", "false");
        properties.setProperty("python.cachedir.skip", "true");
        properties.setProperty("python.console.encoding", "UTF-8");
        PythonInterpreter.initialize(System.getProperties(), properties, new String[0]);
        runtimeInitialized = true;
        LOGGER.debug("Jython runtime initialized");
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void execute(String scriptText, String unitName, ScriptContext context) throws ScriptExecutionException {
        initializeRuntime();

        PySystemState systemState = new PySystemState();
        systemState.argv = toPyList(context.arguments());
        PythonInterpreter interpreter = new PythonInterpreter(null, systemState);
        try {
            PyCode code;
            try {
                code = interpreter.compile(scriptText, unitName);
            } catch (PyException e) {
                throw syntaxFailure(e);
            }

            interpreter.set(OUTPUT_FUNCTION, new PrintFunction(context.output()));
            if (context.seed() != null) {
                interpreter.exec("import random as _pyp_random\n_pyp_random.seed(" + context.seed() + ")\ndel _pyp_random\n");
            }

            LOGGER.debug("Executing '{}'", unitName);
            try {
                interpreter.exec(code);
            } catch (PyException e) {
                throw runtimeFailure(e, unitName);
            }
        } finally {
            interpreter.cleanup();
        }
    }

    private static ScriptExecutionException syntaxFailure(PyException e) {
        e.normalize();
        Integer line = intAttribute(e.value, "lineno");
        PyObject msg = attribute(e.value, "msg");
        String message = msg != null ? msg.toString() : String.valueOf(e.value);
        return new ScriptExecutionException(ScriptExecutionException.Kind.SYNTAX, typeName(e), message,
                line, line == null ? List.of() : List.of(line), e.toString().trim());
    }

    private static ScriptExecutionException runtimeFailure(PyException e, String unitName) {
        e.normalize();
        List<Integer> frames = new ArrayList<>();
        PyObject next = e.traceback;
        while (next instanceof PyTraceback traceback) {
            PyFrame frame = traceback.tb_frame;
            if (frame != null && frame.f_code != null && unitName.equals(frame.f_code.co_filename)) {
                frames.add(traceback.tb_lineno);
            }
            next = traceback.tb_next;
        }
        Integer innermost = frames.isEmpty() ? null : frames.get(frames.size() - 1);
        String message = e.value == null || e.value == Py.None ? "" : e.value.__str__().toString();
        return new ScriptExecutionException(ScriptExecutionException.Kind.RUNTIME, typeName(e), message,
                innermost, frames, e.toString().trim());
    }

    private static String typeName(PyException e) {
        PyObject name = attribute(e.type, "__name__");
        return name != null ? name.toString() : String.valueOf(e.type);
    }

    private static PyObject attribute(PyObject target, String name) {
        if (target == null) {
            return null;
        }
        PyObject value = target.__findattr__(name);
        return value == null || value == Py.None ? null : value;
    }

    private static Integer intAttribute(PyObject target, String name) {
        PyObject value = attribute(target, name);
        return value == null ? null : value.asInt();
    }

    // byte strings in UTF-8, like the string literals of the script
    private static PyList toPyList(List<String> values) {
        PyObject[] items = new PyObject[values.size()];
        for (int i = 0; i < values.size(); i++) {
            items[i] = Py.newStringUTF8(values.get(i));
        }
        return new PyList(items);
    }
}
