package com.ryuqq.transferchain.core.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.transferchain.core.model.Asset;
import com.ryuqq.transferchain.core.model.RoleRecord;
import com.ryuqq.transferchain.core.model.TransferApproval;
import com.ryuqq.transferchain.core.model.TransferOffer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CanonicalCodec 테스트.
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
class CanonicalCodecTest {

    private final CanonicalCodec codec = new CanonicalCodec();

    @Test
    void encode_Records_ProduceSortedCompactJson() {
        assertThat(utf8(codec.encode(new Asset("widget", "alice"))))
            .isEqualTo("{\"name\":\"widget\",\"owner\":\"alice\"}");
        assertThat(utf8(codec.encode(new TransferOffer("widget", "bob"))))
            .isEqualTo("{\"asset\":\"widget\",\"owner\":\"bob\"}");
        assertThat(utf8(codec.encode(new TransferApproval("widget", "bob"))))
            .isEqualTo("{\"name\":\"widget\",\"owner\":\"bob\"}");
        assertThat(utf8(codec.encode(new RoleRecord("regulator1"))))
            .isEqualTo("{\"identity\":\"regulator1\"}");
    }

    @Test
    void encode_MapInsertionOrder_DoesNotChangeBytes() {
        // Given
        Map<String, String> forward = new LinkedHashMap<>();
        forward.put("owner", "alice");
        forward.put("name", "widget");
        Map<String, String> reverse = new LinkedHashMap<>();
        reverse.put("name", "widget");
        reverse.put("owner", "alice");

        // When & Then
        assertThat(codec.encode(forward)).isEqualTo(codec.encode(reverse));
        assertThat(codec.encode(forward)).isEqualTo(codec.encode(new Asset("widget", "alice")));
    }

    static Stream<Object> storedRecords() {
        return Stream.of(
            new Asset("widget", "alice"),
            new TransferOffer("widget", "bob"),
            new TransferApproval("widget", "bob"),
            new RoleRecord("regulator1")
        );
    }

    @ParameterizedTest
    @MethodSource("storedRecords")
    void decode_EncodedRecord_RoundTrips(Object record) {
        // When
        byte[] encoded = codec.encode(record);
        Object decoded = codec.decode(encoded, record.getClass());

        // Then
        assertThat(decoded).isEqualTo(record);
        assertThat(codec.encode(decoded)).isEqualTo(encoded);
    }

    @Test
    void encode_IndependentCodecs_ProduceIdenticalBytes() {
        // Given
        CanonicalCodec other = new CanonicalCodec();
        byte[] pretty = "{\n  \"owner\" : \"alice\",\n  \"name\" : \"widget\"\n}".getBytes(StandardCharsets.UTF_8);

        // When
        Asset decoded = other.decode(pretty, Asset.class);

        // Then
        assertThat(other.encode(decoded)).isEqualTo(codec.encode(new Asset("widget", "alice")));
        assertThat(utf8(other.encode(decoded))).isEqualTo("{\"name\":\"widget\",\"owner\":\"alice\"}");
    }

    @Test
    void codec_DoesNotExposeItsObjectMapper() {
        assertThat(CanonicalCodec.class.getMethods())
            .noneMatch(method -> ObjectMapper.class.isAssignableFrom(method.getReturnType()));
    }

    @Test
    void decode_TrailingTokens_ThrowsCodecException() {
        byte[] bytes = "{\"name\":\"widget\",\"owner\":\"alice\"} garbage".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> codec.decode(bytes, Asset.class))
            .isInstanceOf(CodecException.class);
    }

    @Test
    void decode_FieldsInAnyOrder_ProducesSameRecord() {
        // Given
        byte[] unordered = "{\"owner\":\"bob\",\"asset\":\"widget\"}".getBytes(StandardCharsets.UTF_8);

        // When
        TransferOffer offer = codec.decode(unordered, TransferOffer.class);

        // Then
        assertThat(offer).isEqualTo(new TransferOffer("widget", "bob"));
        assertThat(utf8(codec.encode(offer))).isEqualTo("{\"asset\":\"widget\",\"owner\":\"bob\"}");
    }

    @Test
    void decode_UnknownField_IsIgnored() {
        byte[] bytes = "{\"name\":\"widget\",\"owner\":\"alice\",\"note\":\"x\"}".getBytes(StandardCharsets.UTF_8);

        assertThat(codec.decode(bytes, Asset.class)).isEqualTo(new Asset("widget", "alice"));
    }

    @Test
    void decode_EmptyBytes_ThrowsCodecException() {
        assertThatThrownBy(() -> codec.decode(new byte[0], Asset.class))
            .isInstanceOf(CodecException.class)
            .hasMessageContaining("empty");
        assertThatThrownBy(() -> codec.decode(null, Asset.class))
            .isInstanceOf(CodecException.class);
    }

    @Test
    void decode_MissingField_ThrowsCodecException() {
        byte[] bytes = "{\"name\":\"widget\"}".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> codec.decode(bytes, Asset.class))
            .isInstanceOf(CodecException.class);
    }

    @Test
    void decode_NotJson_ThrowsCodecException() {
        byte[] bytes = "not json".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> codec.decode(bytes, Asset.class))
            .isInstanceOf(CodecException.class)
            .hasMessageContaining("Asset");
    }

    @Test
    void decode_JsonNull_ThrowsCodecException() {
        byte[] bytes = "null".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> codec.decode(bytes, Asset.class))
            .isInstanceOf(CodecException.class);
    }

    @Test
    void encode_Null_ThrowsException() {
        assertThatThrownBy(() -> codec.encode(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static String utf8(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
