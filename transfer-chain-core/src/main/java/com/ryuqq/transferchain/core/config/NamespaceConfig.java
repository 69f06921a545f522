package com.ryuqq.transferchain.core.config;

/**
 * 애플리케이션 네임스페이스 설정 (불변 record).
 *
 * <p>주소 체계와 호스트 런타임 등록 정보가 공유하는 값을 담고 있습니다.
 * 프로세스 전역 상수 대신 이 record를 {@link com.ryuqq.transferchain.core.address.AddressScheme}
 * 생성 시 주입하므로 테스트에서 네임스페이스를 교체할 수 있습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>familyName: 네임스페이스 이름 (기본 "transfer-chain")</li>
 *   <li>familyVersion: 트랜잭션 패밀리 버전 (기본 "0.0")</li>
 *   <li>contentType: 수락하는 페이로드 형식 (기본 "application/json")</li>
 * </ul>
 *
 * <p><strong>주의:</strong> familyName을 바꾸면 모든 주소의 prefix가 바뀝니다.
 * 이미 운영 중인 원장에서는 변경하면 안 됩니다.</p>
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 * @param familyName 네임스페이스 이름 (공백 불가)
 * @param familyVersion 패밀리 버전 (공백 불가)
 * @param contentType 페이로드 content-type (공백 불가)
 */
public record NamespaceConfig(String familyName, String familyVersion, String contentType) {

    /**
     * 기본 네임스페이스 이름.
     */
    public static final String DEFAULT_FAMILY_NAME = "transfer-chain";

    /**
     * 기본 패밀리 버전.
     */
    public static final String DEFAULT_FAMILY_VERSION = "0.0";

    /**
     * 기본 페이로드 content-type.
     */
    public static final String DEFAULT_CONTENT_TYPE = "application/json";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: familyName="transfer-chain", familyVersion="0.0", contentType="application/json"</p>
     */
    public NamespaceConfig() {
        this(DEFAULT_FAMILY_NAME, DEFAULT_FAMILY_VERSION, DEFAULT_CONTENT_TYPE);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public NamespaceConfig {
        if (familyName == null || familyName.isBlank()) {
            throw new IllegalArgumentException("familyName cannot be null or blank");
        }
        if (familyVersion == null || familyVersion.isBlank()) {
            throw new IllegalArgumentException("familyVersion cannot be null or blank");
        }
        if (contentType == null || contentType.isBlank()) {
            throw new IllegalArgumentException("contentType cannot be null or blank");
        }
    }

    /**
     * familyName만 변경한 새 인스턴스 생성.
     *
     * @param familyName 새로운 네임스페이스 이름
     * @return 새 NamespaceConfig 인스턴스
     */
    public NamespaceConfig withFamilyName(String familyName) {
        return new NamespaceConfig(familyName, this.familyVersion, this.contentType);
    }

    /**
     * familyVersion만 변경한 새 인스턴스 생성.
     *
     * @param familyVersion 새로운 패밀리 버전
     * @return 새 NamespaceConfig 인스턴스
     */
    public NamespaceConfig withFamilyVersion(String familyVersion) {
        return new NamespaceConfig(this.familyName, familyVersion, this.contentType);
    }
}
