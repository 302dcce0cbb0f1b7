package org.botblocks.cli.commands;

import org.botblocks.compiler.codegen.RendererRegistry;
import org.botblocks.model.BlockCatalog;
import org.botblocks.model.BlockType;
import org.botblocks.model.ParameterSpec;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.io.PrintWriter;
import java.util.stream.Collectors;

@Command(name = "blocks", description = "Lists the available blocks with their parameters and ranges.")
public class BlocksCommand implements Runnable {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        BlockCatalog catalog = BlockCatalog.initializeWithDefaults();
        RendererRegistry renderers = RendererRegistry.initializeWithDefaults();
        PrintWriter out = spec.commandLine().getOut();
        for (BlockType type : catalog.types()) {
            String params = type.parameters().stream().map(ParameterSpec::toString).collect(Collectors.joining(" "));
            out.printf("%-18s %-7s %s%s%n", type.identity(), type.kind(), params,
                    renderers.supports(type.kind(), type.identity()) ? "" : "  (no code generator)");
        }
        out.flush();
    }
}
