package org.botblocks.compiler.api;

import org.botblocks.diagnostics.DiagnosticSink;
import org.botblocks.model.Program;

/**
 * Defines the public interface of the block-program compiler.
 * <p>
 * Compilation never fails as a whole: user mistakes become diagnostics and the best-effort
 * script is always returned.
 */
public interface IBlockCompiler {

    /**
     * Compiles a program.
     *
     * @param program The program snapshot; it is neither retained nor modified.
     * @return The script and all diagnostics.
     */
    CompilationResult compile(Program program);

    /**
     * Compiles a program and forwards each diagnostic to the given sink as it is reported.
     *
     * @param program The program snapshot; it is neither retained nor modified.
     * @param sink    Receiver of the diagnostics.
     * @return The script and all diagnostics.
     */
    CompilationResult compile(Program program, DiagnosticSink sink);
}
