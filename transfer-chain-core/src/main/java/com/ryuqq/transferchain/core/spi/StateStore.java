package com.ryuqq.transferchain.core.spi;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * Ledger state SPI: raw bytes addressed by 70-hex-char keys.
 *
 * <p>This interface is the only way the transition core touches ledger state.
 * The persistence engine behind it is supplied by the host runtime.</p>
 *
 * <p><strong>Value Semantics:</strong></p>
 * <ul>
 *   <li>A zero-length value means the address is absent or cleared</li>
 *   <li>A non-empty value means the address is present</li>
 * </ul>
 *
 * <p><strong>Processing Model:</strong></p>
 * <pre>
 * 1. get(addresses)   → rule reads exactly the addresses it needs
 * 2. rule computes the complete write-set (no writes yet)
 * 3. set(writeSet)    → host commits all entries as one atomic batch
 * 4. confirmed.size() &lt; writeSet.size() → write conflict
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Atomic batches: {@link #set(Map)} must apply all entries or none</li>
 *   <li>Snapshot reads: a single {@link #get(Collection)} must reflect one consistent instant</li>
 *   <li>Thread-safe: calls for disjoint address sets may arrive concurrently</li>
 * </ul>
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public interface StateStore {

    /**
     * Reads the values stored at the given addresses.
     *
     * <p>The returned map contains an entry for every requested address.
     * Absent addresses map to an empty array.</p>
     *
     * @param addresses the addresses to read
     * @return address → value (never null, values never null)
     * @throws IllegalArgumentException if addresses is null
     * @throws StateStoreException if the underlying store cannot be read
     */
    Map<String, byte[]> get(Collection<String> addresses);

    /**
     * Writes all entries as one atomic batch.
     *
     * <p>An empty value clears the address.</p>
     *
     * @param entries address → value to write
     * @return the addresses the store confirmed as written
     * @throws IllegalArgumentException if entries is null
     * @throws StateStoreException if the batch cannot be committed
     */
    Set<String> set(Map<String, byte[]> entries);
}
