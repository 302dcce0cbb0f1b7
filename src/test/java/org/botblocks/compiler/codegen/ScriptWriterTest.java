package org.botblocks.compiler.codegen;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ScriptWriterTest {

    @Test
    void indentsLinesByLevel() {
        ScriptWriter out = new ScriptWriter("\t");
        out.line("a");
        out.indent();
        out.line("b");
        out.dedent();
        out.line("c");

        assertThat(out.toString()).isEqualTo("a\n\tb\nc\n");
    }

    @Test
    void dedentBelowZeroFails() {
        ScriptWriter out = new ScriptWriter("\t");

        assertThatThrownBy(out::dedent).isInstanceOf(IllegalStateException.class);
        assertThat(out.toString()).isEmpty();
    }
}
