package io.qzark.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutionResultTest {

    @Test
    void zeroExitIsSuccess() {
        ExecutionResult result = ExecutionResult.fromExit(0, "ok\n", "warning\n");

        assertThat(result.succeeded()).isTrue();
        assertThat(result.errorMessage()).isNull();
    }

    @Test
    void failurePrefersTrimmedStderr() {
        ExecutionResult result = ExecutionResult.fromExit(2, "partial output\n", "  boom\n");

        assertThat(result.failed()).isTrue();
        assertThat(result.exitCode()).isEqualTo(2);
        assertThat(result.errorMessage()).isEqualTo("boom");
    }

    @Test
    void failureFallsBackToStdoutThenUnknownError() {
        assertThat(ExecutionResult.fromExit(1, " only stdout \n", "   ").errorMessage()).isEqualTo("only stdout");
        assertThat(ExecutionResult.fromExit(1, "", "").errorMessage()).isEqualTo(ExecutionResult.UNKNOWN_ERROR);
    }
}
