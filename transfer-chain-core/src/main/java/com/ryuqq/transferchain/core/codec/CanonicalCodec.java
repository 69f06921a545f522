package com.ryuqq.transferchain.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;

/**
 * 결정적(canonical) 상태 레코드 코덱.
 *
 * <p>레코드를 키 정렬된 compact UTF-8 JSON으로 직렬화합니다.
 * 독립된 두 노드가 같은 논리 레코드를 인코딩하면 바이트 단위로 동일한 결과를 얻습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * codec.encode(new Asset("widget", "alice"))
 *   → {"name":"widget","owner":"alice"}
 * </pre>
 *
 * <p><strong>디코딩 규칙:</strong></p>
 * <ul>
 *   <li>null 또는 빈 바이트열은 "부재"이므로 디코딩 불가 ({@link CodecException})</li>
 *   <li>알 수 없는 필드는 무시</li>
 *   <li>필수 필드 누락 시 레코드 생성자가 거부 → {@link CodecException}</li>
 *   <li>JSON 값 뒤에 남은 토큰이 있으면 → {@link CodecException}</li>
 * </ul>
 *
 * <p>ObjectMapper는 외부에 노출하지 않습니다. 설정이 바뀌면 노드 간 인코딩이 달라집니다.</p>
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public final class CanonicalCodec {

    private final ObjectMapper mapper;

    /**
     * 기본 canonical 설정으로 코덱 생성.
     */
    public CanonicalCodec() {
        this.mapper = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();
    }

    /**
     * 레코드 인코딩.
     *
     * @param record 인코딩할 레코드
     * @return canonical JSON 바이트 (UTF-8)
     * @throws IllegalArgumentException record가 null인 경우
     * @throws CodecException 직렬화 실패 시
     */
    public byte[] encode(Object record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        try {
            return mapper.writeValueAsBytes(record);
        } catch (JsonProcessingException e) {
            throw new CodecException("Failed to encode " + record.getClass().getSimpleName(), e);
        }
    }

    /**
     * 레코드 디코딩.
     *
     * <p>호출 전에 값의 존재 여부를 먼저 확인해야 합니다.</p>
     *
     * @param bytes 인코딩된 바이트
     * @param type 대상 레코드 타입
     * @param <T> 레코드 타입
     * @return 디코딩된 레코드
     * @throws CodecException bytes가 비어있거나 유효한 레코드가 아닌 경우
     */
    public <T> T decode(byte[] bytes, Class<T> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (bytes == null || bytes.length == 0) {
            throw new CodecException("Cannot decode " + type.getSimpleName() + " from empty state entry");
        }
        try {
            T value = mapper.readValue(bytes, type);
            if (value == null) {
                throw new CodecException("Decoded null " + type.getSimpleName());
            }
            return value;
        } catch (IOException e) {
            throw new CodecException("Failed to decode " + type.getSimpleName(), e);
        }
    }
}
