package com.ryuqq.transferchain.core.rule;

import com.ryuqq.transferchain.core.address.AddressScheme;
import com.ryuqq.transferchain.core.address.EntityKind;
import com.ryuqq.transferchain.core.codec.CanonicalCodec;
import com.ryuqq.transferchain.core.model.TransferApproval;
import com.ryuqq.transferchain.core.model.TransferOffer;
import com.ryuqq.transferchain.core.outcome.Fail;
import com.ryuqq.transferchain.core.outcome.Ok;
import com.ryuqq.transferchain.core.outcome.Outcome;
import com.ryuqq.transferchain.core.outcome.RejectionCode;
import com.ryuqq.transferchain.core.request.AcknowledgeTransferRequest;
import com.ryuqq.transferchain.core.spi.StateStore;
import com.ryuqq.transferchain.core.state.WriteSet;

/**
 * 양도 확인 규칙 (지정 구매자).
 *
 * <pre>
 * read  : TRANSFER_ACKN[asset]
 * fail  : 부재 → NO_PENDING_TRANSFER, owner ≠ signer → NOT_DESIGNATED_BUYER
 * write : TRANSFER_ACKN[asset] = (cleared)
 *         TRANSFER_APPROVE[asset] = {name: asset, owner: signer}
 * </pre>
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public final class AcknowledgeTransferRule extends AbstractTransitionRule<AcknowledgeTransferRequest> {

    public AcknowledgeTransferRule(AddressScheme addresses, CanonicalCodec codec) {
        super(addresses, codec);
    }

    @Override
    public Outcome apply(AcknowledgeTransferRequest request, String signer, StateStore state) {
        String acknAddress = addresses.address(EntityKind.TRANSFER_ACKN, request.asset());

        byte[] entry = read(state, acknAddress).get(acknAddress);
        if (!isPresent(entry)) {
            return Fail.of(RejectionCode.NO_PENDING_TRANSFER, "Asset is not being transferred");
        }
        if (!signer.equals(codec.decode(entry, TransferOffer.class).owner())) {
            return Fail.of(RejectionCode.NOT_DESIGNATED_BUYER, "Transfers can only be acknowledged by the new buyer");
        }

        String approveAddress = addresses.address(EntityKind.TRANSFER_APPROVE, request.asset());
        return Ok.of(WriteSet.builder()
            .clear(acknAddress)
            .put(approveAddress, codec.encode(new TransferApproval(request.asset(), signer)))
            .build());
    }
}
