package com.ryuqq.transferchain.core.request;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.ryuqq.transferchain.core.outcome.RejectionCode;

import java.io.IOException;

/**
 * JSON 페이로드 {@code {action, asset, owner?}} → {@link ActionRequest} 디코더.
 *
 * <p><strong>디코딩 규칙:</strong></p>
 * <ul>
 *   <li>JSON object가 아님 → MALFORMED_PAYLOAD</li>
 *   <li>JSON 값 뒤에 남은 토큰 → MALFORMED_PAYLOAD</li>
 *   <li>action 누락 또는 알 수 없는 값 → INVALID_ACTION</li>
 *   <li>asset 누락/빈 문자열 → MALFORMED_PAYLOAD</li>
 *   <li>transfer인데 owner 누락/빈 문자열 → MALFORMED_PAYLOAD</li>
 *   <li>그 외 action의 owner 필드는 무시</li>
 * </ul>
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public final class ActionRequestDecoder {

    private static final String INVALID_ACTION_MESSAGE =
        "Action must be \"create\", \"transfer\", \"acknowledge\", \"accept\", or \"reject\"";

    private final ObjectMapper mapper;

    /**
     * 생성자.
     */
    public ActionRequestDecoder() {
        this.mapper = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();
    }

    /**
     * 페이로드 디코딩.
     *
     * @param payload 트랜잭션 페이로드 바이트
     * @return 디코딩된 요청
     * @throws InvalidRequestException 페이로드가 다섯 가지 action 형식 중 어느 것도 아닌 경우
     */
    public ActionRequest decode(byte[] payload) {
        JsonNode root = parse(payload);

        TransferAction action = TransferAction.fromWireName(text(root, "action"))
            .orElseThrow(() -> new InvalidRequestException(RejectionCode.INVALID_ACTION, INVALID_ACTION_MESSAGE));

        String asset = text(root, "asset");
        if (asset == null || asset.isBlank()) {
            throw new InvalidRequestException(RejectionCode.MALFORMED_PAYLOAD, "Asset name is required");
        }

        return switch (action) {
            case CREATE -> new CreateAssetRequest(asset);
            case TRANSFER -> {
                String owner = text(root, "owner");
                if (owner == null || owner.isBlank()) {
                    throw new InvalidRequestException(RejectionCode.MALFORMED_PAYLOAD, "New owner is required for transfer");
                }
                yield new OfferTransferRequest(asset, owner);
            }
            case ACKNOWLEDGE -> new AcknowledgeTransferRequest(asset);
            case ACCEPT -> new ApproveTransferRequest(asset);
            case REJECT -> new RejectTransferRequest(asset);
        };
    }

    private JsonNode parse(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new InvalidRequestException(RejectionCode.MALFORMED_PAYLOAD, "Payload is empty");
        }
        JsonNode root;
        try {
            root = mapper.readTree(payload);
        } catch (IOException e) {
            throw new InvalidRequestException(RejectionCode.MALFORMED_PAYLOAD, "Payload is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidRequestException(RejectionCode.MALFORMED_PAYLOAD, "Payload must be a JSON object");
        }
        return root;
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node != null && node.isTextual() ? node.asText() : null;
    }
}
