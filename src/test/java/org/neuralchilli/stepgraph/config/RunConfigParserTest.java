package org.neuralchilli.stepgraph.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.stepgraph.plan.RunConfig;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class RunConfigParserTest {

    private RunConfigParser parser;

    @BeforeEach
    void setup() {
        parser = new RunConfigParser();
    }

    @Test
    void shouldParseInputsAndTags() {
        // Given
        String yaml = """
                ops:
                  split:
                    inputs:
                      path: /data/in.csv
                      limit: 5
                  sub.load:
                    inputs:
                      tables: [users, orders]
                tags:
                  owner: data-eng
                """;

        // When
        RunConfig config = parser.parse(yaml);

        // Then
        assertThat(config.input("split", "path")).isEqualTo("/data/in.csv");
        assertThat(config.input("split", "limit")).isEqualTo(5);
        assertThat(config.input("sub.load", "tables")).isEqualTo(List.of("users", "orders"));
        assertThat(config.hasInput("split", "other")).isFalse();
        assertThat(config.tags()).containsEntry("owner", "data-eng");
    }

    @Test
    void shouldTreatEmptyDocumentAsEmptyConfig() {
        RunConfig config = parser.parse("");

        assertThat(config.inputs()).isEmpty();
        assertThat(config.tags()).isEmpty();
    }

    @Test
    void shouldRejectMalformedOps() {
        assertThatThrownBy(() -> parser.parse("ops: [split]\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'ops' must be a map");
    }
}
