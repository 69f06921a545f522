package com.ryuqq.transferchain.core.state;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 하나의 전이가 만들어내는 전체 쓰기 집합 (불변).
 *
 * <p>주소 → 바이트 매핑이며, 빈 바이트 배열은 해당 주소의 "삭제"를 의미합니다.
 * 항목은 주소 순으로 정렬되어 있어 모든 노드에서 순회 순서가 동일합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * WriteSet writeSet = WriteSet.builder()
 *     .clear(acknAddress)
 *     .put(approveAddress, codec.encode(approval))
 *     .build();
 * </pre>
 *
 * <p><strong>불변성:</strong> 입력과 출력 바이트 배열은 모두 방어적으로 복사됩니다.</p>
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public final class WriteSet {

    private static final byte[] CLEARED = new byte[0];

    private final TreeMap<String, byte[]> entries;

    private WriteSet(TreeMap<String, byte[]> entries) {
        this.entries = entries;
    }

    /**
     * 빌더 생성.
     *
     * @return 새 Builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * 커밋용 매핑 조회 (주소 순 정렬, 값은 복사본).
     *
     * @return 수정 불가능한 주소 → 바이트 매핑
     */
    public Map<String, byte[]> entries() {
        TreeMap<String, byte[]> copy = new TreeMap<>();
        entries.forEach((address, value) -> copy.put(address, value.clone()));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * 쓰기 대상 주소 목록.
     *
     * @return 정렬된 주소 집합
     */
    public Set<String> addresses() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    /**
     * 주소에 쓸 값 조회.
     *
     * @param address 주소
     * @return 값 복사본, 쓰기 대상이 아니면 null
     */
    public byte[] get(String address) {
        byte[] value = entries.get(address);
        return value == null ? null : value.clone();
    }

    /**
     * 주소가 이 write-set에서 삭제되는지 확인.
     *
     * @param address 주소
     * @return 빈 값이 기록되면 true
     */
    public boolean clears(String address) {
        byte[] value = entries.get(address);
        return value != null && value.length == 0;
    }

    /**
     * 항목 수.
     *
     * @return 쓰기 대상 주소 수
     */
    public int size() {
        return entries.size();
    }

    /**
     * 비어있는지 확인.
     *
     * @return 항목이 없으면 true
     */
    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WriteSet other = (WriteSet) o;
        if (!entries.keySet().equals(other.entries.keySet())) return false;
        for (Map.Entry<String, byte[]> entry : entries.entrySet()) {
            if (!Arrays.equals(entry.getValue(), other.entries.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = 1;
        for (Map.Entry<String, byte[]> entry : entries.entrySet()) {
            result = 31 * result + entry.getKey().hashCode();
            result = 31 * result + Arrays.hashCode(entry.getValue());
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("WriteSet{");
        boolean first = true;
        for (Map.Entry<String, byte[]> entry : entries.entrySet()) {
            if (!first) sb.append(", ");
            sb.append(entry.getKey(), 0, Math.min(12, entry.getKey().length())).append("…=")
                .append(entry.getValue().length == 0 ? "cleared" : entry.getValue().length + " bytes");
            first = false;
        }
        return sb.append('}').toString();
    }

    /**
     * WriteSet 빌더.
     *
     * <p>같은 주소를 두 번 쓰면 마지막 값이 남습니다.</p>
     */
    public static final class Builder {

        private final TreeMap<String, byte[]> entries = new TreeMap<>();

        private Builder() {
        }

        /**
         * 주소에 값 기록.
         *
         * @param address 주소
         * @param value 값 (비어있지 않아야 함, 삭제는 {@link #clear(String)} 사용)
         * @return this
         * @throws IllegalArgumentException address가 비어있거나 value가 null/빈 배열인 경우
         */
        public Builder put(String address, byte[] value) {
            requireAddress(address);
            if (value == null || value.length == 0) {
                throw new IllegalArgumentException("value cannot be null or empty, use clear() to remove " + address);
            }
            entries.put(address, value.clone());
            return this;
        }

        /**
         * 주소 삭제 (빈 값 기록).
         *
         * @param address 주소
         * @return this
         * @throws IllegalArgumentException address가 비어있는 경우
         */
        public Builder clear(String address) {
            requireAddress(address);
            entries.put(address, CLEARED);
            return this;
        }

        /**
         * WriteSet 생성.
         *
         * @return 불변 WriteSet
         */
        public WriteSet build() {
            return new WriteSet(new TreeMap<>(entries));
        }

        private static void requireAddress(String address) {
            if (address == null || address.isBlank()) {
                throw new IllegalArgumentException("address cannot be null or blank");
            }
        }
    }
}
