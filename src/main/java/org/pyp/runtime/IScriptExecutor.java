package org.pyp.runtime;

/**
 * Runs generated scripts. Implementations compile the text as one unit, expose
 * {@link ScriptContext#output()} to it and report failures with generated line numbers.
 */
public interface IScriptExecutor {

    /**
     * Compiles and runs a script, blocking until it finishes.
     *
     * @param scriptText The generated Python source.
     * @param unitName The name the script is compiled under; frames of this unit are the ones
     *                 reported on failure.
     * @param context The host capabilities.
     * @throws ScriptExecutionException if the script does not compile or raises while running.
     */
    void execute(String scriptText, String unitName, ScriptContext context) throws ScriptExecutionException;
}
