package org.botblocks.diagnostics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Contains unit tests for the {@link DiagnosticsEngine}.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
class DiagnosticsEngineTest {

    @Mock
    private DiagnosticSink sink;

    @Test
    void forwardsEveryDiagnosticToTheSinkInOrder() {
        DiagnosticsEngine engine = new DiagnosticsEngine(sink);

        engine.report(DiagnosticCode.EMPTY_ACTION_LIST, 0, "no actions");
        engine.report(DiagnosticCode.MISSING_EVENT, 1, "no event");

        ArgumentCaptor<Diagnostic> captor = ArgumentCaptor.forClass(Diagnostic.class);
        verify(sink, times(2)).accept(captor.capture());
        assertThat(captor.getAllValues()).containsExactlyElementsOf(engine.getDiagnostics());
    }

    @Test
    void severityFollowsTheCode() {
        DiagnosticsEngine engine = new DiagnosticsEngine();

        engine.report(DiagnosticCode.UNREACHABLE_RULE, 3, "shadowed");
        assertThat(engine.hasErrors()).isFalse();

        engine.report(DiagnosticCode.DUPLICATE_UNCONDITIONAL_RULE, 4, "duplicate");
        assertThat(engine.hasErrors()).isTrue();
        assertThat(engine.hasErrorFor(4)).isTrue();
        assertThat(engine.hasErrorFor(3)).isFalse();
        assertThat(engine.summary()).isEqualTo(
                "[WARNING] rule 3: shadowed (UNREACHABLE_RULE)\n[ERROR] rule 4: duplicate (DUPLICATE_UNCONDITIONAL_RULE)");
    }

    @Test
    void onlyInvariantViolationsAreInternal() {
        for (DiagnosticCode code : DiagnosticCode.values()) {
            assertThat(code.isInternal()).isEqualTo(code == DiagnosticCode.INTERNAL_INVARIANT_VIOLATION);
        }
    }
}
