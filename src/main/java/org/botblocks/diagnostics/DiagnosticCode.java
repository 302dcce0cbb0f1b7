package org.botblocks.diagnostics;

/**
 * Defines unique, testable codes for every finding the compiler can report.
 * This decouples tests and hosts from the wording of the messages.
 */
public enum DiagnosticCode {
    // region Rule validation
    /** A rule has no event block; it is left out of the script. */
    MISSING_EVENT(Diagnostic.Severity.ERROR, Category.VALIDATION),
    /** A rule has no action block, so firing it has no effect. */
    EMPTY_ACTION_LIST(Diagnostic.Severity.WARNING, Category.VALIDATION),
    /** Two state blocks require different values of the same state variable. */
    CONTRADICTORY_GUARD(Diagnostic.Severity.WARNING, Category.VALIDATION),
    // endregion

    // region Compilation
    /** More than one rule without a guard shares the same trigger. */
    DUPLICATE_UNCONDITIONAL_RULE(Diagnostic.Severity.ERROR, Category.COMPILE),
    /** A guarded rule is shadowed by an earlier rule with a weaker guard. */
    UNREACHABLE_RULE(Diagnostic.Severity.WARNING, Category.COMPILE),
    /** A block identity has no renderer and cannot be emitted. */
    UNKNOWN_IDENTITY(Diagnostic.Severity.ERROR, Category.COMPILE),
    // endregion

    // region Internal
    /** A block violates its type's arity or ranges; it bypassed the validating factory. */
    INTERNAL_INVARIANT_VIOLATION(Diagnostic.Severity.ERROR, Category.INTERNAL);
    // endregion

    /**
     * Stage that produces a diagnostic.
     */
    public enum Category {
        /** Per-rule structural checks. */
        VALIDATION,
        /** Driver-level findings about the program as a whole. */
        COMPILE,
        /** Precondition violations by the caller, not authored by the user. */
        INTERNAL
    }

    private final Diagnostic.Severity severity;
    private final Category category;

    DiagnosticCode(Diagnostic.Severity severity, Category category) {
        this.severity = severity;
        this.category = category;
    }

    public Diagnostic.Severity severity() {
        return severity;
    }

    public Category category() {
        return category;
    }

    /**
     * @return {@code true} if this code signals a caller bug rather than a user mistake.
     */
    public boolean isInternal() {
        return category == Category.INTERNAL;
    }
}
