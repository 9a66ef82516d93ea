package it.aw.normativerag.registry;

import it.aw.normativerag.exception.ValidationException;
import it.aw.normativerag.model.Chunk;
import it.aw.normativerag.model.ChunkMetadata;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkRegistryTest {

    private ChunkRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ChunkRegistry(null);
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    void findsIdsByMetadataWithinCollection() {
        registry.register("normative_comunale", List.of("c1", "c2", "c3"), List.of(
                chunk("Tarquinia", "nta.txt"), chunk("Tarquinia", "reg.txt"), chunk("Viterbo", "nta.txt")));
        registry.register("normative_regionale", List.of("r1"), List.of(chunk("Tarquinia", "nta.txt")));

        assertThat(registry.findIds("normative_comunale", Map.of(ChunkMetadata.MUNICIPALITY, "Tarquinia")))
                .containsExactly("c1", "c2");
        assertThat(registry.findIds("normative_comunale", Map.of(
                ChunkMetadata.MUNICIPALITY, "Tarquinia", ChunkMetadata.SOURCE, "nta.txt")))
                .containsExactly("c1");
        assertThat(registry.findIds("normative_comunale", Map.of())).containsExactly("c1", "c2", "c3");
    }

    @Test
    void removeAndCount() {
        registry.register("normative_nazionale", List.of("n1", "n2"), List.of(chunk(null, "a.txt"), chunk(null, "b.txt")));

        assertThat(registry.count("normative_nazionale")).isEqualTo(2);
        assertThat(registry.remove("normative_nazionale", List.of("n1", "missing"))).isEqualTo(1);
        assertThat(registry.count("normative_nazionale")).isEqualTo(1);
        assertThat(registry.count("normative_comunale")).isZero();
    }

    @Test
    void reRegisteringSameIdIsIgnored() {
        registry.register("normative_nazionale", List.of("n1"), List.of(chunk(null, "a.txt")));
        registry.register("normative_nazionale", List.of("n1"), List.of(chunk(null, "a.txt")));

        assertThat(registry.count("normative_nazionale")).isEqualTo(1);
    }

    @Test
    void rejectsUnknownFilterKeys() {
        assertThatThrownBy(() -> registry.findIds("normative_comunale", Map.of("colore", "rosso")))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ChunkRegistry.validate(Map.of(ChunkMetadata.HIERARCHY_LEVEL, "Comunale")))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void persistsAcrossReopen(@TempDir Path dir) {
        Path db = dir.resolve("registry.duckdb");
        try (ChunkRegistry first = new ChunkRegistry(db)) {
            first.register("normative_comunale", List.of("c1"), List.of(chunk("Tarquinia", "nta.txt")));
        }
        try (ChunkRegistry reopened = new ChunkRegistry(db)) {
            assertThat(reopened.findIds("normative_comunale", Map.of(ChunkMetadata.SOURCE, "nta.txt")))
                    .containsExactly("c1");
        }
    }

    private static Chunk chunk(String municipality, String source) {
        return new Chunk("Articolo 1 testo", ChunkMetadata.builder()
                .normativeLevel("comunale")
                .municipality(municipality)
                .source(source)
                .build());
    }
}
