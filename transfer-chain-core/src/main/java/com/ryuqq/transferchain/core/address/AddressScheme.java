package com.ryuqq.transferchain.core.address;

import com.ryuqq.transferchain.core.config.NamespaceConfig;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * (엔티티 종류, 엔티티 키) → 고정 길이 원장 주소 변환.
 *
 * <p><strong>주소 형식 (70 hex chars):</strong></p>
 * <pre>
 * [ 6: SHA-512(familyName) ][ 2: kind code ][ 62: SHA-512(key) ]
 * </pre>
 *
 * <p>모든 노드가 동일한 주소를 계산해야 하므로 해시 입력은 항상 UTF-8 바이트이며
 * hex 출력은 소문자입니다.</p>
 *
 * <p><strong>Thread-safety:</strong> 불변 객체. MessageDigest는 호출마다 새로 생성합니다.</p>
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public final class AddressScheme {

    /**
     * 전체 주소 길이.
     */
    public static final int ADDRESS_LENGTH = 70;

    /**
     * 네임스페이스 prefix 길이.
     */
    public static final int PREFIX_LENGTH = 6;

    private static final int KEY_HASH_LENGTH = ADDRESS_LENGTH - PREFIX_LENGTH - 2;
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final NamespaceConfig config;
    private final String prefix;

    /**
     * 생성자.
     *
     * @param config 네임스페이스 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public AddressScheme(NamespaceConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.prefix = hash(config.familyName(), PREFIX_LENGTH);
    }

    /**
     * 엔티티 주소 계산.
     *
     * @param kind 엔티티 종류
     * @param key 엔티티 키 (자산 이름, 서명자 ID 등)
     * @return 70자리 소문자 hex 주소
     * @throws IllegalArgumentException kind 또는 key가 null인 경우
     */
    public String address(EntityKind kind, String key) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return prefix + kind.code() + hash(key, KEY_HASH_LENGTH);
    }

    /**
     * 이 애플리케이션의 6자리 네임스페이스 prefix.
     *
     * @return prefix
     */
    public String prefix() {
        return prefix;
    }

    /**
     * 주소가 이 네임스페이스에 속하는지 확인.
     *
     * @param address 검사할 주소
     * @return 길이와 prefix가 일치하면 true
     */
    public boolean isInNamespace(String address) {
        return address != null
            && address.length() == ADDRESS_LENGTH
            && address.startsWith(prefix);
    }

    /**
     * 주소 계산에 사용된 설정.
     *
     * @return 네임스페이스 설정
     */
    public NamespaceConfig config() {
        return config;
    }

    private static String hash(String input, int length) {
        byte[] digest = sha512().digest(input.getBytes(StandardCharsets.UTF_8));
        StringBuilder sb = new StringBuilder(digest.length * 2);
        for (byte b : digest) {
            sb.append(HEX[(b >> 4) & 0x0f]).append(HEX[b & 0x0f]);
        }
        return sb.substring(0, length);
    }

    private static MessageDigest sha512() {
        try {
            return MessageDigest.getInstance("SHA-512");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-512 not available", e);
        }
    }
}
