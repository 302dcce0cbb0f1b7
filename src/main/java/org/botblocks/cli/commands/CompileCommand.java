package org.botblocks.cli.commands;

import com.typesafe.config.ConfigException;
import org.botblocks.cli.CommandLineInterface;
import org.botblocks.compiler.BlockCompiler;
import org.botblocks.compiler.CompilerSettings;
import org.botblocks.compiler.DuplicateUnconditionalPolicy;
import org.botblocks.compiler.api.CompilationResult;
import org.botblocks.diagnostics.LoggingDiagnosticSink;
import org.botblocks.model.BlockCatalog;
import org.botblocks.model.Program;
import org.botblocks.persistence.ProgramJsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@Command(name = "compile", description = "Compiles a block program JSON file to robot script source.")
public class CompileCommand implements Callable<Integer> {

    /** Exit code when at least one error diagnostic was reported. */
    public static final int EXIT_COMPILE_ERRORS = 1;
    /** Exit code when the program file cannot be read. */
    public static final int EXIT_UNREADABLE_INPUT = 2;
    /** Exit code when the script cannot be written to the output file. */
    public static final int EXIT_UNWRITABLE_OUTPUT = 3;

    private static final Logger LOG = LoggerFactory.getLogger(CompileCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the program JSON file.")
    private File file;

    @Option(names = {"-o", "--output"}, description = "Write the script to this file instead of standard output.")
    private File output;

    @Option(names = "--duplicate-policy",
            description = "Handling of several unguarded rules on one trigger: ${COMPLETION-CANDIDATES}.")
    private DuplicateUnconditionalPolicy duplicatePolicy;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        CompilerSettings settings;
        try {
            settings = CompilerSettings.fromConfig(parent.getConfig());
        } catch (ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Invalid compiler configuration: " + e.getMessage(), e);
        }
        if (duplicatePolicy != null) {
            settings = settings.withDuplicatePolicy(duplicatePolicy);
        }

        PrintWriter err = spec.commandLine().getErr();
        Program program;
        try {
            program = new ProgramJsonCodec(BlockCatalog.initializeWithDefaults()).read(file.toPath());
        } catch (IOException e) {
            LOG.debug("Failed to read {}", file, e);
            err.println("Cannot read program '" + file + "': " + e.getMessage());
            return EXIT_UNREADABLE_INPUT;
        }

        CompilationResult result = new BlockCompiler(settings).compile(program, new LoggingDiagnosticSink(file.getName()));
        if (!result.diagnostics().isEmpty()) {
            err.println(result.summary());
        }
        err.flush();

        if (output != null) {
            try {
                Files.writeString(output.toPath(), result.script(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                LOG.debug("Failed to write {}", output, e);
                err.println("Cannot write script '" + output + "': " + e.getMessage());
                err.flush();
                return EXIT_UNWRITABLE_OUTPUT;
            }
            LOG.info("Wrote {} handler(s) to {}", result.handlers().size(), output);
        } else {
            PrintWriter out = spec.commandLine().getOut();
            out.print(result.script());
            out.flush();
        }
        return result.hasErrors() ? EXIT_COMPILE_ERRORS : 0;
    }
}
