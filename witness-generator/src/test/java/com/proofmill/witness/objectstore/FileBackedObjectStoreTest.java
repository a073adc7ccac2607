package com.proofmill.witness.objectstore;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.proofmill.witness.circuit.BaseLayerProof;
import com.proofmill.witness.circuit.ProofArtifact;
import com.proofmill.witness.circuit.RecursionLayerProof;
import com.proofmill.witness.model.AggregationRound;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileBackedObjectStoreTest {

    @TempDir Path dir;

    FileBackedObjectStore store;
    ObjectStoreClient     client;

    @BeforeEach
    void setUp() {
        store  = new FileBackedObjectStore(dir);
        client = new ObjectStoreClient(store, new ObjectMapper());
    }

    @Test
    void put_thenGet_returnsBytesAndObjectName() {
        CircuitKey key = new CircuitKey(42, 1, 0, 0, AggregationRound.SCHEDULER);

        String url = store.put(key, "circuit".getBytes(StandardCharsets.UTF_8));

        assertThat(url).isEqualTo("42_0_1_SCHEDULER_0.bin");
        assertThat(new String(store.get(key), StandardCharsets.UTF_8)).isEqualTo("circuit");
        assertThat(dir.resolve("prover_jobs_fri").resolve(url)).exists();
    }

    @Test
    void put_twiceUnderSameKey_overwritesSingleObject() throws Exception {
        ProofKey key = new ProofKey(5);

        store.put(key, "first".getBytes(StandardCharsets.UTF_8));
        store.put(key, "second".getBytes(StandardCharsets.UTF_8));

        assertThat(new String(store.get(key), StandardCharsets.UTF_8)).isEqualTo("second");
        // No temp files or duplicates left behind
        try (Stream<Path> files = Files.list(dir.resolve("proofs_fri"))) {
            assertThat(files.toList()).containsExactly(dir.resolve("proofs_fri").resolve("proof_5.bin"));
        }
    }

    @Test
    void get_missingObject_throwsObjectStoreException() {
        assertThatThrownBy(() -> store.get(new ProofKey(404)))
                .isInstanceOf(ObjectStoreException.class)
                .hasMessageContaining("proofs_fri/proof_404.bin");
    }

    @Test
    void client_roundTripsProofVariants() {
        client.put(new ProofKey(1), new RecursionLayerProof(3, "r"));
        client.put(new ProofKey(2), new BaseLayerProof(3, "b"));

        assertThat(client.get(new ProofKey(1), ProofArtifact.class)).isEqualTo(new RecursionLayerProof(3, "r"));
        assertThat(client.get(new ProofKey(2), ProofArtifact.class)).isEqualTo(new BaseLayerProof(3, "b"));
    }

    @Test
    void client_undecodableBlob_throwsBlobDecodeException() {
        store.put(new ProofKey(9), "not json".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> client.get(new ProofKey(9), ProofArtifact.class))
                .isInstanceOf(BlobDecodeException.class)
                .isNotInstanceOf(ObjectStoreException.class)
                .hasMessageContaining("proof_9.bin");
    }

    @Test
    void client_unknownProofKind_throwsBlobDecodeException() {
        store.put(new ProofKey(10), """
                {"kind":"scheduler_final","circuitType":1,"proof":"x"}
                """.getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> client.get(new ProofKey(10), ProofArtifact.class))
                .isInstanceOf(BlobDecodeException.class)
                .hasMessageContaining("ProofArtifact");
    }
}
