package org.botblocks.compiler.api;

import org.botblocks.model.TriggerKey;

import java.util.List;

/**
 * The emitted text of one merged event handler.
 *
 * @param trigger     The trigger key shared by the merged rules.
 * @param text        The handler source, ending with a newline.
 * @param ruleIndices Program indices of the rules emitted into this handler, ascending.
 */
public record EmittedHandler(TriggerKey trigger, String text, List<Integer> ruleIndices) {

    public EmittedHandler {
        ruleIndices = List.copyOf(ruleIndices);
    }
}
