package org.botblocks.compiler.codegen;

import org.botblocks.compiler.grouping.GuardBranch;
import org.botblocks.compiler.grouping.HandlerPlan;
import org.botblocks.compiler.grouping.IndexedRule;
import org.botblocks.model.Block;
import org.botblocks.model.Rule;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Emits the text of one handler from its plan, calling the registered renderer once per block.
 * <p>
 * Every block reaching this class has a registered renderer; the compiler filters rules with
 * unknown identities out before emission.
 */
public class HandlerEmitter {

    private final RendererRegistry renderers;
    private final String indent;

    public HandlerEmitter(RendererRegistry renderers, String indent) {
        this.renderers = renderers;
        this.indent = indent;
    }

    /**
     * @param plan The handler plan.
     * @return The handler text, ending with a newline.
     */
    public String emit(HandlerPlan plan) {
        ScriptWriter out = new ScriptWriter(indent);
        out.line(renderers.signature(plan.event()).header());
        out.indent();
        List<GuardBranch> branches = plan.branches();
        if (branches.isEmpty()) {
            plan.fallbackRule().ifPresent(fallback -> emitActions(fallback.rule(), out));
        } else {
            for (int i = 0; i < branches.size(); i++) {
                GuardBranch branch = branches.get(i);
                out.line((i == 0 ? "if " : "elseif ") + condition(branch.conditions()) + " then");
                emitBody(branch.source(), out);
            }
            if (plan.fallbackRule().isPresent()) {
                out.line("else");
                emitBody(plan.fallbackRule().get(), out);
            }
            out.line("end");
        }
        out.dedent();
        return out.toString();
    }

    private String condition(List<Block> conditions) {
        return conditions.stream().map(renderers::condition).collect(Collectors.joining(" and "));
    }

    private void emitBody(IndexedRule source, ScriptWriter out) {
        out.indent();
        emitActions(source.rule(), out);
        out.dedent();
    }

    private void emitActions(Rule rule, ScriptWriter out) {
        for (Block action : rule.actions()) {
            renderers.render(action, out);
        }
    }
}
