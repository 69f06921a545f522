package com.ryuqq.transferchain.core.rule;

import com.ryuqq.transferchain.core.address.AddressScheme;
import com.ryuqq.transferchain.core.address.EntityKind;
import com.ryuqq.transferchain.core.codec.CanonicalCodec;
import com.ryuqq.transferchain.core.model.TransferApproval;
import com.ryuqq.transferchain.core.outcome.Fail;
import com.ryuqq.transferchain.core.outcome.Ok;
import com.ryuqq.transferchain.core.outcome.Outcome;
import com.ryuqq.transferchain.core.outcome.RejectionCode;
import com.ryuqq.transferchain.core.request.RejectTransferRequest;
import com.ryuqq.transferchain.core.spi.StateStore;
import com.ryuqq.transferchain.core.state.WriteSet;

/**
 * 양도 거절 규칙 (예정 소유자).
 *
 * <pre>
 * read  : TRANSFER_APPROVE[asset]
 * fail  : 부재 → NO_PENDING_APPROVAL, owner ≠ signer → NOT_DESIGNATED_BUYER
 * write : TRANSFER_APPROVE[asset] = (cleared)
 * </pre>
 *
 * <p>거절은 승인 대기 상태에서만 가능하며 자산은 변경되지 않습니다
 * (pending-approval → created).</p>
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public final class RejectTransferRule extends AbstractTransitionRule<RejectTransferRequest> {

    public RejectTransferRule(AddressScheme addresses, CanonicalCodec codec) {
        super(addresses, codec);
    }

    @Override
    public Outcome apply(RejectTransferRequest request, String signer, StateStore state) {
        String approveAddress = addresses.address(EntityKind.TRANSFER_APPROVE, request.asset());

        byte[] entry = read(state, approveAddress).get(approveAddress);
        if (!isPresent(entry)) {
            return Fail.of(RejectionCode.NO_PENDING_APPROVAL, "Asset is not awaiting approval");
        }
        if (!signer.equals(codec.decode(entry, TransferApproval.class).owner())) {
            return Fail.of(RejectionCode.NOT_DESIGNATED_BUYER, "Transfers can only be rejected by the potential new owner");
        }

        return Ok.of(WriteSet.builder()
            .clear(approveAddress)
            .build());
    }
}
