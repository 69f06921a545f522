package com.ryuqq.transferchain.application.handler;

import com.ryuqq.transferchain.core.address.AddressScheme;

import java.util.List;

/**
 * 호스트 원장에 핸들러를 등록할 때 알리는 메타데이터.
 *
 * <p>호스트는 이 정보로 어떤 트랜잭션을 이 핸들러에 보낼지,
 * 핸들러가 어떤 주소 공간에 접근할 수 있는지 결정합니다.</p>
 *
 * @param familyName 트랜잭션 패밀리 이름 (예: "transfer-chain")
 * @param familyVersion 패밀리 버전 (예: "0.0")
 * @param contentType 페이로드 콘텐츠 타입 (예: "application/json")
 * @param namespaces 접근 가능한 주소 prefix 목록
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public record HandlerRegistration(
    String familyName,
    String familyVersion,
    String contentType,
    List<String> namespaces
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 비어있는 경우
     */
    public HandlerRegistration {
        if (familyName == null || familyName.isBlank()) {
            throw new IllegalArgumentException("familyName cannot be null or blank");
        }
        if (familyVersion == null || familyVersion.isBlank()) {
            throw new IllegalArgumentException("familyVersion cannot be null or blank");
        }
        if (contentType == null || contentType.isBlank()) {
            throw new IllegalArgumentException("contentType cannot be null or blank");
        }
        if (namespaces == null || namespaces.isEmpty()) {
            throw new IllegalArgumentException("namespaces cannot be null or empty");
        }
        namespaces = List.copyOf(namespaces);
    }

    /**
     * 주소 체계로부터 등록 정보 생성.
     *
     * @param addresses 주소 체계 (설정과 prefix 제공)
     * @return 등록 정보
     * @throws IllegalArgumentException addresses가 null인 경우
     */
    public static HandlerRegistration of(AddressScheme addresses) {
        if (addresses == null) {
            throw new IllegalArgumentException("addresses cannot be null");
        }
        return new HandlerRegistration(
            addresses.config().familyName(),
            addresses.config().familyVersion(),
            addresses.config().contentType(),
            List.of(addresses.prefix())
        );
    }
}
