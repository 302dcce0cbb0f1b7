package org.botblocks.compiler;

import org.botblocks.compiler.api.CompilationResult;
import org.botblocks.compiler.api.EmittedHandler;
import org.botblocks.compiler.api.IBlockCompiler;
import org.botblocks.compiler.codegen.HandlerEmitter;
import org.botblocks.compiler.codegen.RendererRegistry;
import org.botblocks.compiler.codegen.features.StateMemory;
import org.botblocks.compiler.grouping.GuardPlanner;
import org.botblocks.compiler.grouping.HandlerPlan;
import org.botblocks.compiler.grouping.IndexedRule;
import org.botblocks.compiler.grouping.TriggerGroup;
import org.botblocks.compiler.grouping.TriggerGrouper;
import org.botblocks.diagnostics.DiagnosticCode;
import org.botblocks.diagnostics.DiagnosticSink;
import org.botblocks.diagnostics.DiagnosticsEngine;
import org.botblocks.model.Block;
import org.botblocks.model.Program;
import org.botblocks.model.Rule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The main compiler implementation. This class orchestrates the pipeline from a block program
 * to script text.
 * <p>
 * An instance only holds immutable settings and a read-only renderer registry; all working state
 * belongs to a single {@link #compile(Program, DiagnosticSink)} call, so one instance can compile
 * several programs concurrently.
 */
public class BlockCompiler implements IBlockCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(BlockCompiler.class);

    private final CompilerSettings settings;
    private final RendererRegistry renderers;

    public BlockCompiler() {
        this(CompilerSettings.defaults());
    }

    public BlockCompiler(CompilerSettings settings) {
        this(settings, RendererRegistry.initializeWithDefaults());
    }

    /**
     * @param settings  Compiler options.
     * @param renderers Renderer table; must not be modified while compilations run.
     */
    public BlockCompiler(CompilerSettings settings, RendererRegistry renderers) {
        this.settings = settings;
        this.renderers = renderers;
    }

    @Override
    public CompilationResult compile(Program program) {
        return compile(program, DiagnosticSink.none());
    }

    @Override
    public CompilationResult compile(Program program, DiagnosticSink sink) {
        if (program.isEmpty()) {
            LOG.debug("Empty program, nothing to compile");
            return new CompilationResult("", List.of(), List.of());
        }
        DiagnosticsEngine diagnostics = new DiagnosticsEngine(sink);

        // Phase 1: Rule validation and block invariants
        List<IndexedRule> candidates = new ArrayList<>();
        for (int i = 0; i < program.size(); i++) {
            Rule rule = program.rule(i);
            diagnostics.reportAll(rule.validate(i));
            boolean intact = checkBlockInvariants(rule, i, diagnostics);
            if (rule.hasEvent() && intact) {
                candidates.add(new IndexedRule(i, rule));
            }
        }

        // Phase 2: Identity check, once per distinct identity
        Set<String> unknown = findUnknownIdentities(program, diagnostics);
        List<IndexedRule> usable = candidates.stream()
                .filter(c -> c.rule().blocks().noneMatch(b -> unknown.contains(identityKey(b))))
                .toList();

        // Phase 3: Grouping by trigger
        List<TriggerGroup> groups = TriggerGrouper.group(usable);

        // Phase 4: Guard synthesis
        GuardPlanner planner = new GuardPlanner(settings.duplicatePolicy(), diagnostics);
        List<HandlerPlan> plans = groups.stream()
                .map(planner::plan)
                .flatMap(Optional::stream)
                .toList();

        // Phase 5: Emission
        HandlerEmitter emitter = new HandlerEmitter(renderers, settings.indent());
        List<EmittedHandler> handlers = new ArrayList<>(plans.size());
        for (HandlerPlan plan : plans) {
            handlers.add(new EmittedHandler(plan.key(), emitter.emit(plan), plan.ruleIndices()));
        }

        // Phase 6: Assembly
        String script = assemble(plans, handlers);

        LOG.debug("Compiled {} rule(s) into {} handler(s) with {} diagnostic(s)",
                program.size(), handlers.size(), diagnostics.getDiagnostics().size());
        return new CompilationResult(script, handlers, diagnostics.getDiagnostics());
    }

    private boolean checkBlockInvariants(Rule rule, int ruleIndex, DiagnosticsEngine diagnostics) {
        boolean intact = true;
        for (Block block : rule.blocks().toList()) {
            Optional<String> violation = block.type().checkParameters(block.parameters());
            if (violation.isPresent()) {
                LOG.error("Rule {} holds a block that bypassed construction checks: {}", ruleIndex, violation.get());
                diagnostics.report(DiagnosticCode.INTERNAL_INVARIANT_VIOLATION, ruleIndex,
                        "Internal error, block was not range-checked: " + violation.get());
                intact = false;
            }
        }
        return intact;
    }

    private Set<String> findUnknownIdentities(Program program, DiagnosticsEngine diagnostics) {
        Set<String> checked = new HashSet<>();
        Set<String> unknown = new HashSet<>();
        for (int i = 0; i < program.size(); i++) {
            for (Block block : program.rule(i).blocks().toList()) {
                String key = identityKey(block);
                if (!checked.add(key)) {
                    continue;
                }
                if (!renderers.supports(block)) {
                    unknown.add(key);
                    diagnostics.report(DiagnosticCode.UNKNOWN_IDENTITY, i,
                            "No code generator for " + block.kind() + " block '" + block.identity() + "'");
                }
            }
        }
        return unknown;
    }

    private static String identityKey(Block block) {
        return block.kind() + ":" + block.identity();
    }

    private String assemble(List<HandlerPlan> plans, List<EmittedHandler> handlers) {
        StringBuilder script = new StringBuilder();
        boolean usesStateMemory = plans.stream()
                .flatMap(HandlerPlan::emittedRules)
                .flatMap(Rule::blocks)
                .anyMatch(b -> b.type().touchesStateMemory());
        if (settings.emitStateDeclaration() && usesStateMemory) {
            script.append(StateMemory.declaration(settings.stateVariableCount())).append("\n\n");
        }
        for (int i = 0; i < handlers.size(); i++) {
            if (i > 0) {
                script.append('\n');
            }
            script.append(handlers.get(i).text());
        }
        return script.toString();
    }
}
