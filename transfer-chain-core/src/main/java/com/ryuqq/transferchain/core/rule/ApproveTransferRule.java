package com.ryuqq.transferchain.core.rule;

import com.ryuqq.transferchain.core.address.AddressScheme;
import com.ryuqq.transferchain.core.address.EntityKind;
import com.ryuqq.transferchain.core.codec.CanonicalCodec;
import com.ryuqq.transferchain.core.model.Asset;
import com.ryuqq.transferchain.core.model.TransferApproval;
import com.ryuqq.transferchain.core.outcome.Fail;
import com.ryuqq.transferchain.core.outcome.Ok;
import com.ryuqq.transferchain.core.outcome.Outcome;
import com.ryuqq.transferchain.core.outcome.RejectionCode;
import com.ryuqq.transferchain.core.request.ApproveTransferRequest;
import com.ryuqq.transferchain.core.spi.StateStore;
import com.ryuqq.transferchain.core.state.WriteSet;

import java.util.Map;

/**
 * 양도 승인 규칙 (규제자).
 *
 * <pre>
 * read  : TRANSFER_APPROVE[asset], REGULATOR[signer]
 * fail  : 승인 기록 부재 → NO_PENDING_APPROVAL, 규제자 기록 부재 → NOT_REGULATOR
 * write : Asset[asset] = {name: asset, owner: approval.owner}
 *         TRANSFER_APPROVE[asset] = (cleared)
 * </pre>
 *
 * <p>새 소유자는 승인 기록에 남은 구매자입니다. 규제자 본인이 아닙니다.</p>
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public final class ApproveTransferRule extends AbstractTransitionRule<ApproveTransferRequest> {

    public ApproveTransferRule(AddressScheme addresses, CanonicalCodec codec) {
        super(addresses, codec);
    }

    @Override
    public Outcome apply(ApproveTransferRequest request, String signer, StateStore state) {
        String approveAddress = addresses.address(EntityKind.TRANSFER_APPROVE, request.asset());
        String regulatorAddress = addresses.address(EntityKind.REGULATOR, signer);

        Map<String, byte[]> entries = read(state, approveAddress, regulatorAddress);
        byte[] approvalEntry = entries.get(approveAddress);
        if (!isPresent(approvalEntry)) {
            return Fail.of(RejectionCode.NO_PENDING_APPROVAL, "Asset is not awaiting approval");
        }
        if (!isPresent(entries.get(regulatorAddress))) {
            return Fail.of(RejectionCode.NOT_REGULATOR, "You are not a regulator");
        }

        TransferApproval approval = codec.decode(approvalEntry, TransferApproval.class);
        String assetAddress = addresses.address(EntityKind.ASSET, request.asset());
        return Ok.of(WriteSet.builder()
            .put(assetAddress, codec.encode(new Asset(request.asset(), approval.owner())))
            .clear(approveAddress)
            .build());
    }
}
