package org.neuralchilli.stepgraph.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class LoadResultTest {

    @Test
    void shouldReportNoErrorOnSuccess() {
        LoadResult result = LoadResult.success("etl");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.name()).isEqualTo("etl");
        assertThat(result.error()).isEmpty();
    }

    @Test
    void shouldCarryExceptionMessageOnFailure() {
        LoadResult result = LoadResult.failure("broken.yaml", new IllegalArgumentException("Unknown op 'x'"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.name()).isEqualTo("broken.yaml");
        assertThat(result.error()).contains("Unknown op 'x'");
    }

    @Test
    void shouldNameExceptionTypeWhenMessageIsMissing() {
        // Given: An exception raised without a message
        LoadResult result = LoadResult.failure("broken.yaml", new NullPointerException());

        // Then
        assertThat(result.error()).contains("NullPointerException");
    }
}
