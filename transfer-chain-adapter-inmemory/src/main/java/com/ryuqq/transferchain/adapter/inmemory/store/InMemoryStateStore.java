package com.ryuqq.transferchain.adapter.inmemory.store;

import com.ryuqq.transferchain.core.spi.StateStore;
import com.ryuqq.transferchain.core.spi.StateStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory implementation of the {@link StateStore} SPI for testing and embedding.
 *
 * <p>Values live in a {@link HashMap} guarded by a {@link ReentrantReadWriteLock}.
 * A whole batch passed to {@link #set(Map)} is applied under the write lock, so a
 * concurrent reader sees either none or all of it.</p>
 *
 * <p><strong>Semantics:</strong></p>
 * <ul>
 *   <li>Absent addresses read as an empty array</li>
 *   <li>Writing an empty array removes the address</li>
 *   <li>Values are copied on the way in and on the way out</li>
 *   <li>Optionally restricted to a set of namespace prefixes; any address outside
 *       them is refused with {@link StateStoreException}</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>No per-transaction snapshot: callers that need isolation run one transaction at a time</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryStateStore store = new InMemoryStateStore(List.of(addresses.prefix()));
 * store.set(enrollment.enroll(EntityKind.REGULATOR, "regulator1").entries());
 * Outcome outcome = handler.apply(new TransactionRequest(signer, payload), store);
 * </pre>
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public class InMemoryStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStateStore.class);

    private static final byte[] EMPTY = new byte[0];

    private final Map<String, byte[]> values = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<String> namespaces;

    /**
     * Creates an unrestricted store.
     */
    public InMemoryStateStore() {
        this.namespaces = List.of();
    }

    /**
     * Creates a store that only accepts addresses under the given prefixes.
     *
     * @param namespaces allowed address prefixes
     * @throws IllegalArgumentException if namespaces is null, empty or holds a blank prefix
     */
    public InMemoryStateStore(Collection<String> namespaces) {
        if (namespaces == null || namespaces.isEmpty()) {
            throw new IllegalArgumentException("namespaces cannot be null or empty");
        }
        for (String namespace : namespaces) {
            if (namespace == null || namespace.isBlank()) {
                throw new IllegalArgumentException("namespace cannot be null or blank");
            }
        }
        this.namespaces = List.copyOf(namespaces);
    }

    @Override
    public Map<String, byte[]> get(Collection<String> addresses) {
        if (addresses == null) {
            throw new IllegalArgumentException("addresses cannot be null");
        }
        addresses.forEach(this::checkNamespace);

        Map<String, byte[]> result = new LinkedHashMap<>();
        lock.readLock().lock();
        try {
            for (String address : addresses) {
                byte[] value = values.get(address);
                result.put(address, value == null ? EMPTY.clone() : value.clone());
            }
        } finally {
            lock.readLock().unlock();
        }
        return result;
    }

    @Override
    public Set<String> set(Map<String, byte[]> entries) {
        if (entries == null) {
            throw new IllegalArgumentException("entries cannot be null");
        }
        Map<String, byte[]> batch = new LinkedHashMap<>();
        entries.forEach((address, value) -> {
            checkNamespace(address);
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null for address: " + address);
            }
            batch.put(address, value.clone());
        });

        lock.writeLock().lock();
        try {
            batch.forEach((address, value) -> {
                if (value.length == 0) {
                    values.remove(address);
                } else {
                    values.put(address, value);
                }
            });
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Committed batch of {} address(es)", batch.size());
        return new LinkedHashSet<>(batch.keySet());
    }

    /**
     * Returns a copy of every stored entry.
     *
     * @return address → value (cleared addresses are not included)
     */
    public Map<String, byte[]> snapshot() {
        lock.readLock().lock();
        try {
            Map<String, byte[]> copy = new HashMap<>();
            values.forEach((address, value) -> copy.put(address, value.clone()));
            return copy;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the number of present addresses.
     *
     * @return entry count
     */
    public int size() {
        lock.readLock().lock();
        try {
            return values.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Removes all entries.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            values.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void checkNamespace(String address) {
        if (address == null || address.isEmpty()) {
            throw new IllegalArgumentException("address cannot be null or empty");
        }
        if (namespaces.isEmpty()) {
            return;
        }
        for (String namespace : namespaces) {
            if (address.startsWith(namespace)) {
                return;
            }
        }
        throw new StateStoreException("Address is outside the authorized namespaces: " + address);
    }
}
