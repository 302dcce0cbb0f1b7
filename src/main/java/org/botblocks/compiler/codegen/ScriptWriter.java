package org.botblocks.compiler.codegen;

/**
 * Line-oriented output buffer with indentation, owned by one compile call.
 */
public final class ScriptWriter {

    private final StringBuilder out = new StringBuilder();
    private final String indentUnit;
    private int level;

    /**
     * @param indentUnit The string written once per indentation level, e.g. a tab.
     */
    public ScriptWriter(String indentUnit) {
        this.indentUnit = indentUnit;
    }

    /**
     * Appends one line at the current indentation, followed by a newline.
     *
     * @param text The line content.
     */
    public void line(String text) {
        for (int i = 0; i < level; i++) {
            out.append(indentUnit);
        }
        out.append(text).append('\n');
    }

    public void indent() {
        level++;
    }

    public void dedent() {
        if (level == 0) {
            throw new IllegalStateException("Cannot dedent below level 0");
        }
        level--;
    }

    @Override
    public String toString() {
        return out.toString();
    }
}
