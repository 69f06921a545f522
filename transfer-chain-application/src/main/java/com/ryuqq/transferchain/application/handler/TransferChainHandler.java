package com.ryuqq.transferchain.application.handler;

import com.ryuqq.transferchain.core.address.AddressScheme;
import com.ryuqq.transferchain.core.codec.CanonicalCodec;
import com.ryuqq.transferchain.core.config.NamespaceConfig;
import com.ryuqq.transferchain.core.engine.TransitionEngine;
import com.ryuqq.transferchain.core.outcome.Fail;
import com.ryuqq.transferchain.core.outcome.Ok;
import com.ryuqq.transferchain.core.outcome.Outcome;
import com.ryuqq.transferchain.core.request.ActionRequest;
import com.ryuqq.transferchain.core.request.ActionRequestDecoder;
import com.ryuqq.transferchain.core.request.InvalidRequestException;
import com.ryuqq.transferchain.core.request.OfferTransferRequest;
import com.ryuqq.transferchain.core.spi.StateStore;
import com.ryuqq.transferchain.core.spi.StateStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;

/**
 * transfer-chain 트랜잭션 처리기 기본 구현.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * apply(request, state)
 *   ↓
 * ActionRequestDecoder.decode(payload)  ── InvalidRequestException → Fail
 *   ↓
 * TransitionEngine.apply(signer, action, state)
 *   ↓
 * Ok   → state.set(write-set)  ── 확인된 주소 부족 → StateStoreException
 * Fail → 쓰기 없음
 * </pre>
 *
 * <p><strong>로그 정책:</strong></p>
 * <ul>
 *   <li>INFO: 처리 시작 ({@code action > asset > owner... :: signer...}), 거절</li>
 *   <li>ERROR: 커밋 실패</li>
 *   <li>DEBUG: 커밋된 write-set</li>
 * </ul>
 *
 * <p><strong>Thread-safety:</strong> 불변 객체. 트랜잭션마다 다른 StateStore를 넘기면
 * 여러 스레드에서 동시에 호출 가능합니다.</p>
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public final class TransferChainHandler implements TransactionHandler {

    private static final Logger log = LoggerFactory.getLogger(TransferChainHandler.class);

    private static final int ID_PREVIEW_LENGTH = 8;

    private final HandlerRegistration registration;
    private final ActionRequestDecoder decoder;
    private final TransitionEngine engine;

    /**
     * 생성자 (설정으로부터 전체 구성).
     *
     * @param config 네임스페이스 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public TransferChainHandler(NamespaceConfig config) {
        this(new AddressScheme(config), new CanonicalCodec());
    }

    /**
     * 생성자.
     *
     * @param addresses 주소 체계
     * @param codec 레코드 코덱
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public TransferChainHandler(AddressScheme addresses, CanonicalCodec codec) {
        if (addresses == null) {
            throw new IllegalArgumentException("addresses cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        this.registration = HandlerRegistration.of(addresses);
        this.decoder = new ActionRequestDecoder();
        this.engine = new TransitionEngine(addresses, codec);
    }

    @Override
    public HandlerRegistration registration() {
        return registration;
    }

    @Override
    public Outcome apply(TransactionRequest request, StateStore state) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }

        ActionRequest action;
        try {
            action = decoder.decode(request.payload());
        } catch (InvalidRequestException e) {
            log.info("Rejected payload from {}: {} ({})", preview(request.signer()), e.getMessage(), e.code());
            return e.toFail();
        }

        log.info("Handling transaction: {} > {} > {} :: {}",
            action.action().wireName(), action.asset(), preview(newOwner(action)), preview(request.signer()));

        Outcome outcome = engine.apply(request.signer(), action, state);
        if (outcome instanceof Fail fail) {
            log.info("Rejected {} > {}: {} ({})", action.action().wireName(), action.asset(), fail.message(), fail.code());
            return fail;
        }

        commit((Ok) outcome, state);
        return outcome;
    }

    private void commit(Ok ok, StateStore state) {
        Map<String, byte[]> entries = ok.writeSet().entries();
        Set<String> confirmed;
        try {
            confirmed = state.set(entries);
        } catch (StateStoreException e) {
            log.error("Failed to commit {} address(es)", entries.size(), e);
            throw e;
        }
        if (confirmed == null || !confirmed.containsAll(entries.keySet())) {
            int count = confirmed == null ? 0 : confirmed.size();
            log.error("Write conflict: requested {} address(es), confirmed {}", entries.size(), count);
            throw new StateStoreException(
                "Write conflict: requested " + entries.size() + " address(es), confirmed " + count);
        }
        log.debug("Committed {}", ok.writeSet());
    }

    private static String newOwner(ActionRequest action) {
        return action instanceof OfferTransferRequest offer ? offer.newOwner() : null;
    }

    private static String preview(String id) {
        if (id == null) {
            return "-";
        }
        return id.length() <= ID_PREVIEW_LENGTH ? id : id.substring(0, ID_PREVIEW_LENGTH) + "...";
    }
}
