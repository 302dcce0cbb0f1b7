package org.botblocks.compiler.grouping;

import org.botblocks.model.Block;

import java.util.List;

/**
 * One if / elseif branch of a merged handler.
 *
 * @param source     The rule the branch comes from.
 * @param conditions The distinct state blocks whose conjunction guards the branch.
 */
public record GuardBranch(IndexedRule source, List<Block> conditions) {

    public GuardBranch {
        conditions = List.copyOf(conditions);
    }
}
