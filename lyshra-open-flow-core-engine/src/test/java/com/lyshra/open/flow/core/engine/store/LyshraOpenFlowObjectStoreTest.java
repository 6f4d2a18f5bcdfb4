package com.lyshra.open.flow.core.engine.store;

import com.lyshra.open.flow.core.engine.store.artifact.FileSystemArtifactRepository;
import com.lyshra.open.flow.core.engine.store.memory.InMemoryClusterMemory;
import com.lyshra.open.flow.integration.contract.store.IClusterMemory;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowStorageTier;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowStoreStrategy;
import com.lyshra.open.flow.integration.exception.ObjectNotFoundException;
import com.lyshra.open.flow.integration.exception.ObjectSerializationException;
import com.lyshra.open.flow.integration.exception.ObjectStorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.io.Serializable;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LyshraOpenFlowObjectStore")
class LyshraOpenFlowObjectStoreTest {

    @TempDir
    Path artifactDir;

    private InMemoryClusterMemory clusterMemory;
    private Optional<IClusterMemory> session;
    private LyshraOpenFlowObjectStore store;

    @BeforeEach
    void setUp() {
        clusterMemory = new InMemoryClusterMemory();
        session = Optional.of(clusterMemory);
        store = LyshraOpenFlowObjectStore.create(() -> session, new FileSystemArtifactRepository(artifactDir),
                LyshraOpenFlowStoreStrategy.FALLBACK, "default");
    }

    record Checkpoint(String model, long step) implements Serializable {
    }

    // =========================================================================
    // ROUND TRIPS
    // =========================================================================

    @Nested
    @DisplayName("Round trips")
    class RoundTripTests {

        @ParameterizedTest
        @EnumSource(LyshraOpenFlowStoreStrategy.class)
        @DisplayName("plain data comes back equal")
        void plainData(LyshraOpenFlowStoreStrategy strategy) {
            Map<String, Object> value = Map.of("name", "features", "rows", List.of(1, 2, 3), "ratio", 0.5);

            StepVerifier.create(store.put("features", value, strategy, "team-a")
                            .then(store.get("features", strategy, "team-a")))
                    .expectNext(value)
                    .verifyComplete();
        }

        @ParameterizedTest
        @EnumSource(LyshraOpenFlowStoreStrategy.class)
        @DisplayName("serializable objects come back equal")
        void serializableObject(LyshraOpenFlowStoreStrategy strategy) {
            Checkpoint checkpoint = new Checkpoint("resnet", 42L);

            StepVerifier.create(store.put("checkpoint", checkpoint, strategy, "team-a")
                            .then(store.get("checkpoint", Checkpoint.class, strategy, "team-a")))
                    .expectNext(checkpoint)
                    .verifyComplete();
        }

        @Test
        @DisplayName("namespaces are isolated")
        void namespaceIsolation() {
            store.put("shared", "a", LyshraOpenFlowStoreStrategy.CLUSTER_MEMORY, "team-a").block();

            StepVerifier.create(store.get("shared", LyshraOpenFlowStoreStrategy.CLUSTER_MEMORY, "team-b"))
                    .expectError(ObjectNotFoundException.class)
                    .verify();
        }

        @Test
        @DisplayName("defaults apply when strategy and namespace are omitted")
        void defaults() {
            store.put("implicit", "value", null, null).block();

            StepVerifier.create(store.exists("implicit", LyshraOpenFlowStoreStrategy.CLUSTER_MEMORY, "default"))
                    .expectNext(true)
                    .verifyComplete();
        }

        @Test
        @DisplayName("mutating the original after put does not change the stored value")
        void storedCopyIsDetached() {
            List<Integer> values = new ArrayList<>(List.of(1, 2));
            store.put("list", values, LyshraOpenFlowStoreStrategy.CLUSTER_MEMORY, null).block();
            values.add(3);

            StepVerifier.create(store.get("list", LyshraOpenFlowStoreStrategy.CLUSTER_MEMORY, null))
                    .expectNext(List.of(1, 2))
                    .verifyComplete();
        }
    }

    // =========================================================================
    // FAILURES AND FALLBACK
    // =========================================================================

    @Nested
    @DisplayName("Failures and fallback")
    class FailureTests {

        @Test
        @DisplayName("fallback writes and reads the artifact tier while cluster memory is down")
        void fallbackWhenUnavailable() {
            // Given
            clusterMemory.setAvailable(false);

            // When
            store.put("model", "weights", LyshraOpenFlowStoreStrategy.FALLBACK, "team-a").block();

            // Then
            StepVerifier.create(store.get("model", LyshraOpenFlowStoreStrategy.FALLBACK, "team-a"))
                    .expectNext("weights")
                    .verifyComplete();
            StepVerifier.create(store.exists("model", LyshraOpenFlowStoreStrategy.ARTIFACT, "team-a"))
                    .expectNext(true)
                    .verifyComplete();
        }

        @Test
        @DisplayName("fallback reads the artifact tier when the key is missing from memory")
        void fallbackOnMiss() {
            store.put("report", "durable", LyshraOpenFlowStoreStrategy.ARTIFACT, null).block();

            StepVerifier.create(store.get("report", LyshraOpenFlowStoreStrategy.FALLBACK, null))
                    .expectNext("durable")
                    .verifyComplete();
        }

        @Test
        @DisplayName("cluster memory strategy fails when no executor session exists")
        void noSession() {
            session = Optional.empty();

            StepVerifier.create(store.put("k", "v", LyshraOpenFlowStoreStrategy.CLUSTER_MEMORY, null))
                    .expectErrorSatisfies(error -> {
                        ObjectStorageException storageError = assertInstanceOf(ObjectStorageException.class, error);
                        assertEquals(LyshraOpenFlowStorageTier.CLUSTER_MEMORY, storageError.getTier());
                    })
                    .verify();
        }

        @Test
        @DisplayName("missing key is reported on every strategy")
        void missingKey() {
            for (LyshraOpenFlowStoreStrategy strategy : LyshraOpenFlowStoreStrategy.values()) {
                StepVerifier.create(store.get("absent", strategy, null))
                        .expectError(ObjectNotFoundException.class)
                        .verify();
            }
        }

        @Test
        @DisplayName("value no serializer accepts is rejected")
        void unserializable() {
            Object value = new Object();

            StepVerifier.create(store.put("opaque", value, LyshraOpenFlowStoreStrategy.ARTIFACT, null))
                    .expectError(ObjectSerializationException.class)
                    .verify();
        }

        @Test
        @DisplayName("blank key is rejected")
        void blankKey() {
            StepVerifier.create(store.get(" ", null, null))
                    .expectError(IllegalArgumentException.class)
                    .verify();
        }
    }

    // =========================================================================
    // BULK OPERATIONS
    // =========================================================================

    @Nested
    @DisplayName("Listing and clearing")
    class BulkTests {

        @Test
        @DisplayName("delete is idempotent")
        void deleteTwice() {
            store.put("temp", "x", LyshraOpenFlowStoreStrategy.ARTIFACT, null).block();

            store.delete("temp", LyshraOpenFlowStoreStrategy.ARTIFACT, null).block();
            store.delete("temp", LyshraOpenFlowStoreStrategy.ARTIFACT, null).block();

            StepVerifier.create(store.exists("temp", LyshraOpenFlowStoreStrategy.ARTIFACT, null))
                    .expectNext(false)
                    .verifyComplete();
        }

        @Test
        @DisplayName("fallback lists the union of both tiers")
        void listUnion() {
            store.put("b", "memory", LyshraOpenFlowStoreStrategy.CLUSTER_MEMORY, "ns").block();
            store.put("a", "disk", LyshraOpenFlowStoreStrategy.ARTIFACT, "ns").block();
            store.put("b", "disk", LyshraOpenFlowStoreStrategy.ARTIFACT, "ns").block();

            StepVerifier.create(store.list(LyshraOpenFlowStoreStrategy.FALLBACK, "ns").collectList())
                    .expectNext(List.of("a", "b"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("clear removes every key of the namespace only")
        void clearNamespace() {
            store.put("one", 1, LyshraOpenFlowStoreStrategy.CLUSTER_MEMORY, "ns").block();
            store.put("two", 2, LyshraOpenFlowStoreStrategy.CLUSTER_MEMORY, "ns").block();
            store.put("kept", 3, LyshraOpenFlowStoreStrategy.CLUSTER_MEMORY, "other").block();

            StepVerifier.create(store.clear(LyshraOpenFlowStoreStrategy.CLUSTER_MEMORY, "ns"))
                    .expectNext(2)
                    .verifyComplete();
            StepVerifier.create(store.list(LyshraOpenFlowStoreStrategy.CLUSTER_MEMORY, "ns"))
                    .verifyComplete();
            StepVerifier.create(store.exists("kept", LyshraOpenFlowStoreStrategy.CLUSTER_MEMORY, "other"))
                    .expectNext(true)
                    .verifyComplete();
        }
    }

    // =========================================================================
    // CONCURRENCY
    // =========================================================================

    @Nested
    @DisplayName("Concurrent access")
    class ConcurrencyTests {

        @ParameterizedTest
        @EnumSource(LyshraOpenFlowStoreStrategy.class)
        @DisplayName("concurrent puts and gets of one key never fail and read a written value")
        void lastWriterWinsUnderContention(LyshraOpenFlowStoreStrategy strategy) {
            // Given
            int writes = 200;

            // When
            List<Object> reads = Flux.range(0, writes)
                    .flatMap(i -> store.put("k", i, strategy, null)
                            .then(store.get("k", strategy, null)), 16)
                    .collectList()
                    .block(Duration.ofSeconds(30));

            // Then
            assertNotNull(reads);
            assertEquals(writes, reads.size());
            for (Object read : reads) {
                Integer value = assertInstanceOf(Integer.class, read);
                assertTrue(value >= 0 && value < writes);
            }
            StepVerifier.create(store.list(strategy, null).collectList())
                    .expectNext(List.of("k"))
                    .verifyComplete();
        }
    }
}
