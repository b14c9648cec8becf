package org.rostilos.branchtree.core.model.topology;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EEdgeConfidence")
class EEdgeConfidenceTest {

    @ParameterizedTest
    @CsvSource({"high, HIGH", "MEDIUM, MEDIUM", " low , LOW"})
    void fromIdIsLenient(String id, EEdgeConfidence expected) {
        assertThat(EEdgeConfidence.fromId(id)).isEqualTo(expected);
    }

    @Test
    void fromIdRejectsUnknownIds() {
        assertThatThrownBy(() -> EEdgeConfidence.fromId("certain"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EEdgeConfidence.fromId(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("serializes edges with lowercase confidence ids")
    void serializesWithLowercaseId() throws Exception {
        String json = new ObjectMapper().writeValueAsString(Edge.inferred("main", "feature/login", EEdgeConfidence.HIGH));

        assertThat(json).contains("\"confidence\":\"high\"");
    }
}
