package com.ryuqq.transferchain.application.handler;

import com.ryuqq.transferchain.adapter.inmemory.store.InMemoryStateStore;
import com.ryuqq.transferchain.core.address.AddressScheme;
import com.ryuqq.transferchain.core.address.EntityKind;
import com.ryuqq.transferchain.core.codec.CanonicalCodec;
import com.ryuqq.transferchain.core.config.NamespaceConfig;
import com.ryuqq.transferchain.core.model.Asset;
import com.ryuqq.transferchain.core.outcome.Fail;
import com.ryuqq.transferchain.core.outcome.Outcome;
import com.ryuqq.transferchain.core.outcome.RejectionCode;
import com.ryuqq.transferchain.core.state.RoleEnrollment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * TransferChainHandler + InMemoryStateStore 통합 테스트.
 *
 * <p>JSON 페이로드부터 커밋된 상태까지 전체 경로를 검증합니다.</p>
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
class TransferChainHandlerIntegrationTest {

    private final AddressScheme addresses = new AddressScheme(new NamespaceConfig());
    private final CanonicalCodec codec = new CanonicalCodec();
    private final TransferChainHandler handler = new TransferChainHandler(addresses, codec);

    private InMemoryStateStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryStateStore(handler.registration().namespaces());
        store.set(new RoleEnrollment(addresses, codec).enroll(EntityKind.REGULATOR, "regulator1").entries());
    }

    @Test
    void 생성_제안_수락_승인_후_구매자가_소유자() {
        // when
        assertThat(submit("alice", "{\"action\":\"create\",\"asset\":\"widget\"}").isOk()).isTrue();
        assertThat(submit("alice", "{\"action\":\"transfer\",\"asset\":\"widget\",\"owner\":\"bob\"}").isOk()).isTrue();
        assertThat(submit("bob", "{\"action\":\"acknowledge\",\"asset\":\"widget\"}").isOk()).isTrue();
        assertThat(submit("regulator1", "{\"action\":\"accept\",\"asset\":\"widget\"}").isOk()).isTrue();

        // then
        String assetAddress = addresses.address(EntityKind.ASSET, "widget");
        byte[] stored = store.get(List.of(assetAddress)).get(assetAddress);
        assertThat(new String(stored, StandardCharsets.UTF_8)).isEqualTo("{\"name\":\"widget\",\"owner\":\"bob\"}");
        assertThat(codec.decode(stored, Asset.class).owner()).isEqualTo("bob");
        // 자산 + 규제자 기록만 남음
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    void 거절된_트랜잭션은_상태를_바꾸지_않음() {
        // given
        submit("alice", "{\"action\":\"create\",\"asset\":\"widget\"}");
        Map<String, byte[]> before = store.snapshot();

        // when
        Outcome outcome = submit("mallory", "{\"action\":\"transfer\",\"asset\":\"widget\",\"owner\":\"mallory\"}");

        // then
        assertThat(((Fail) outcome).code()).isEqualTo(RejectionCode.NOT_OWNER);
        assertThat(((Fail) outcome).message()).isEqualTo("Only an Asset's owner may transfer it");
        assertThat(store.snapshot().keySet()).isEqualTo(before.keySet());
    }

    @Test
    void 수락_후_거절하면_원래_소유자_유지() {
        // given
        submit("alice", "{\"action\":\"create\",\"asset\":\"widget\"}");
        submit("alice", "{\"action\":\"transfer\",\"asset\":\"widget\",\"owner\":\"bob\"}");
        submit("bob", "{\"action\":\"acknowledge\",\"asset\":\"widget\"}");

        // when
        Outcome outcome = submit("bob", "{\"action\":\"reject\",\"asset\":\"widget\"}");

        // then
        assertThat(outcome.isOk()).isTrue();
        String assetAddress = addresses.address(EntityKind.ASSET, "widget");
        assertThat(codec.decode(store.get(List.of(assetAddress)).get(assetAddress), Asset.class).owner())
            .isEqualTo("alice");
        assertThat(store.size()).isEqualTo(2);
    }

    private Outcome submit(String signer, String json) {
        return handler.apply(new TransactionRequest(signer, json.getBytes(StandardCharsets.UTF_8)), store);
    }
}
