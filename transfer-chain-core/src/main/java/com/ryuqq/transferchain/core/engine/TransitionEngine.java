package com.ryuqq.transferchain.core.engine;

import com.ryuqq.transferchain.core.address.AddressScheme;
import com.ryuqq.transferchain.core.codec.CanonicalCodec;
import com.ryuqq.transferchain.core.codec.CodecException;
import com.ryuqq.transferchain.core.config.NamespaceConfig;
import com.ryuqq.transferchain.core.outcome.Fail;
import com.ryuqq.transferchain.core.outcome.Outcome;
import com.ryuqq.transferchain.core.outcome.RejectionCode;
import com.ryuqq.transferchain.core.request.AcknowledgeTransferRequest;
import com.ryuqq.transferchain.core.request.ActionRequest;
import com.ryuqq.transferchain.core.request.ApproveTransferRequest;
import com.ryuqq.transferchain.core.request.CreateAssetRequest;
import com.ryuqq.transferchain.core.request.OfferTransferRequest;
import com.ryuqq.transferchain.core.request.RejectTransferRequest;
import com.ryuqq.transferchain.core.rule.AcknowledgeTransferRule;
import com.ryuqq.transferchain.core.rule.ApproveTransferRule;
import com.ryuqq.transferchain.core.rule.CreateAssetRule;
import com.ryuqq.transferchain.core.rule.OfferTransferRule;
import com.ryuqq.transferchain.core.rule.RejectTransferRule;
import com.ryuqq.transferchain.core.spi.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 상태 전이 엔진.
 *
 * <p>(서명자, 요청, 상태 뷰) → Outcome 순수 함수입니다.
 * 요청의 action에 따라 다섯 규칙 중 하나를 선택하고 결과를 그대로 반환합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * apply(signer, request, state)
 *   ↓
 * switch (request.action())   ← enum 전체를 다루는 switch (action 추가 시 컴파일 오류)
 *   ├─ CREATE      → CreateAssetRule
 *   ├─ TRANSFER    → OfferTransferRule
 *   ├─ ACKNOWLEDGE → AcknowledgeTransferRule
 *   ├─ ACCEPT      → ApproveTransferRule
 *   └─ REJECT      → RejectTransferRule
 *   ↓
 * Ok(write-set) | Fail(code, message)
 * </pre>
 *
 * <p><strong>책임 범위:</strong></p>
 * <ul>
 *   <li>엔진 자신은 상태를 읽거나 쓰지 않음 (규칙이 필요한 주소만 읽음)</li>
 *   <li>write-set 커밋은 호출자 책임</li>
 *   <li>저장된 레코드 디코딩 실패 → DECODE_FAILURE</li>
 *   <li>StateStoreException은 거절로 바꾸지 않고 전파</li>
 * </ul>
 *
 * <p><strong>Thread-safety:</strong> 불변 객체. 여러 스레드에서 동시에 호출 가능합니다.</p>
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public final class TransitionEngine {

    private static final Logger log = LoggerFactory.getLogger(TransitionEngine.class);

    private final CreateAssetRule createAsset;
    private final OfferTransferRule offerTransfer;
    private final AcknowledgeTransferRule acknowledgeTransfer;
    private final ApproveTransferRule approveTransfer;
    private final RejectTransferRule rejectTransfer;

    /**
     * 생성자 (설정으로부터 주소 체계와 코덱 구성).
     *
     * @param config 네임스페이스 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public TransitionEngine(NamespaceConfig config) {
        this(new AddressScheme(config), new CanonicalCodec());
    }

    /**
     * 생성자.
     *
     * @param addresses 주소 체계
     * @param codec 레코드 코덱
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public TransitionEngine(AddressScheme addresses, CanonicalCodec codec) {
        this.createAsset = new CreateAssetRule(addresses, codec);
        this.offerTransfer = new OfferTransferRule(addresses, codec);
        this.acknowledgeTransfer = new AcknowledgeTransferRule(addresses, codec);
        this.approveTransfer = new ApproveTransferRule(addresses, codec);
        this.rejectTransfer = new RejectTransferRule(addresses, codec);
    }

    /**
     * 요청에 해당하는 규칙 적용.
     *
     * @param signer 인증된 서명자 ID
     * @param request 디코딩된 요청
     * @param state 상태 조회용 StateStore
     * @return Ok(write-set) 또는 Fail
     * @throws IllegalArgumentException 인자가 null이거나 signer가 빈 문자열인 경우
     * @throws com.ryuqq.transferchain.core.spi.StateStoreException 상태 조회 실패 시
     */
    public Outcome apply(String signer, ActionRequest request, StateStore state) {
        if (signer == null || signer.isBlank()) {
            throw new IllegalArgumentException("signer cannot be null or blank");
        }
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }

        try {
            Outcome outcome = switch (request.action()) {
                case CREATE -> createAsset.apply((CreateAssetRequest) request, signer, state);
                case TRANSFER -> offerTransfer.apply((OfferTransferRequest) request, signer, state);
                case ACKNOWLEDGE -> acknowledgeTransfer.apply((AcknowledgeTransferRequest) request, signer, state);
                case ACCEPT -> approveTransfer.apply((ApproveTransferRequest) request, signer, state);
                case REJECT -> rejectTransfer.apply((RejectTransferRequest) request, signer, state);
            };
            log.debug("{} {} by {} → {}", request.action(), request.asset(), signer, outcome);
            return outcome;
        } catch (CodecException e) {
            log.warn("Stored record for {} could not be decoded", request.asset(), e);
            return Fail.of(RejectionCode.DECODE_FAILURE, e.getMessage());
        }
    }
}
