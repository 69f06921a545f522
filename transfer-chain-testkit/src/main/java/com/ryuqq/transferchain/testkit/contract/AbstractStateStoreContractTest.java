package com.ryuqq.transferchain.testkit.contract;

import com.ryuqq.transferchain.core.address.AddressScheme;
import com.ryuqq.transferchain.core.address.EntityKind;
import com.ryuqq.transferchain.core.config.NamespaceConfig;
import com.ryuqq.transferchain.core.spi.StateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract Tests every {@link StateStore} adapter must pass.
 *
 * <p><strong>Contract:</strong></p>
 * <ul>
 *   <li>Every requested address appears in the result; absent ones map to an empty array</li>
 *   <li>An empty value clears the address</li>
 *   <li>{@code set} confirms every address it wrote</li>
 *   <li>A batch is atomic: a concurrent reader never sees half of it</li>
 *   <li>Stored bytes are not affected by later mutation of the caller's arrays</li>
 * </ul>
 *
 * <p>Addresses used here lie in the default transfer-chain namespace, so adapters
 * restricted to that namespace pass as well.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyStateStoreContractTest extends AbstractStateStoreContractTest {
 *     {@literal @}Override
 *     protected StateStore createStore() {
 *         return new MyStateStore();
 *     }
 * }
 * </pre>
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public abstract class AbstractStateStoreContractTest {

    protected final AddressScheme addresses = new AddressScheme(new NamespaceConfig());

    protected StateStore store;

    /**
     * Creates a fresh, empty store for each test.
     *
     * @return the adapter under test
     */
    protected abstract StateStore createStore();

    @BeforeEach
    void setUpStore() {
        store = createStore();
    }

    @Test
    void get_UnknownAddress_ReturnsEmptyArray() {
        // Given
        String address = addresses.address(EntityKind.ASSET, "never-written");

        // When
        Map<String, byte[]> result = store.get(List.of(address));

        // Then
        assertThat(result).containsOnlyKeys(address);
        assertThat(result.get(address)).isEmpty();
    }

    @Test
    void set_ThenGet_ReturnsWrittenBytes() {
        // Given
        String address = addresses.address(EntityKind.ASSET, "widget");

        // When
        Set<String> confirmed = store.set(Map.of(address, bytes("{\"name\":\"widget\"}")));

        // Then
        assertThat(confirmed).containsExactly(address);
        assertThat(store.get(List.of(address)).get(address)).isEqualTo(bytes("{\"name\":\"widget\"}"));
    }

    @Test
    void set_Batch_ConfirmsEveryAddress() {
        // Given
        Map<String, byte[]> batch = new LinkedHashMap<>();
        batch.put(addresses.address(EntityKind.ASSET, "widget"), bytes("a"));
        batch.put(addresses.address(EntityKind.TRANSFER_ACKN, "widget"), bytes("b"));
        batch.put(addresses.address(EntityKind.TRANSFER_APPROVE, "widget"), new byte[0]);

        // When
        Set<String> confirmed = store.set(batch);

        // Then
        assertThat(confirmed).containsExactlyInAnyOrderElementsOf(batch.keySet());
    }

    @Test
    void set_EmptyValue_ClearsAddress() {
        // Given
        String address = addresses.address(EntityKind.TRANSFER_ACKN, "widget");
        store.set(Map.of(address, bytes("offer")));

        // When
        store.set(Map.of(address, new byte[0]));

        // Then
        assertThat(store.get(List.of(address)).get(address)).isEmpty();
    }

    @Test
    void set_CallerMutatesArrayAfterwards_StoredValueUnchanged() {
        // Given
        String address = addresses.address(EntityKind.ASSET, "widget");
        byte[] value = bytes("original");
        store.set(Map.of(address, value));

        // When
        value[0] = 'X';
        store.get(List.of(address)).get(address)[1] = 'Y';

        // Then
        assertThat(store.get(List.of(address)).get(address)).isEqualTo(bytes("original"));
    }

    @Test
    void set_ConcurrentReaders_NeverSeePartialBatch() throws Exception {
        // Given
        String first = addresses.address(EntityKind.ASSET, "widget");
        String second = addresses.address(EntityKind.TRANSFER_APPROVE, "widget");
        int rounds = 500;
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);

        try {
            Future<?> writer = executor.submit(() -> {
                await(start);
                for (int i = 1; i <= rounds; i++) {
                    Map<String, byte[]> batch = new LinkedHashMap<>();
                    batch.put(first, bytes(String.valueOf(i)));
                    batch.put(second, bytes(String.valueOf(i)));
                    store.set(batch);
                }
            });
            Future<List<String>> reader = executor.submit(() -> {
                await(start);
                List<String> torn = new ArrayList<>();
                for (int i = 0; i < rounds; i++) {
                    Map<String, byte[]> seen = store.get(List.of(first, second));
                    String a = new String(seen.get(first), StandardCharsets.UTF_8);
                    String b = new String(seen.get(second), StandardCharsets.UTF_8);
                    if (!a.equals(b)) {
                        torn.add(a + "/" + b);
                    }
                }
                return torn;
            });

            // When
            start.countDown();
            writer.get(10, TimeUnit.SECONDS);

            // Then
            assertThat(reader.get(10, TimeUnit.SECONDS)).isEmpty();
        } finally {
            executor.shutdownNow();
        }
    }

    protected static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting to start", e);
        }
    }
}
