package com.ryuqq.transferchain.core.rule;

import com.ryuqq.transferchain.core.address.AddressScheme;
import com.ryuqq.transferchain.core.address.EntityKind;
import com.ryuqq.transferchain.core.codec.CanonicalCodec;
import com.ryuqq.transferchain.core.model.Asset;
import com.ryuqq.transferchain.core.model.TransferOffer;
import com.ryuqq.transferchain.core.outcome.Fail;
import com.ryuqq.transferchain.core.outcome.Ok;
import com.ryuqq.transferchain.core.outcome.Outcome;
import com.ryuqq.transferchain.core.outcome.RejectionCode;
import com.ryuqq.transferchain.core.request.OfferTransferRequest;
import com.ryuqq.transferchain.core.spi.StateStore;
import com.ryuqq.transferchain.core.state.WriteSet;

/**
 * 양도 제안 규칙.
 *
 * <pre>
 * read  : Asset[asset]
 * fail  : 부재 → ASSET_NOT_FOUND, owner ≠ signer → NOT_OWNER
 * write : TRANSFER_ACKN[asset] = {asset, owner: newOwner}
 * </pre>
 *
 * <p>제안은 바로 확인 슬롯에 기록됩니다. 이미 제안이 있으면 덮어씁니다
 * (자산당 살아있는 제안은 최대 하나).</p>
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public final class OfferTransferRule extends AbstractTransitionRule<OfferTransferRequest> {

    public OfferTransferRule(AddressScheme addresses, CanonicalCodec codec) {
        super(addresses, codec);
    }

    @Override
    public Outcome apply(OfferTransferRequest request, String signer, StateStore state) {
        String assetAddress = addresses.address(EntityKind.ASSET, request.asset());

        byte[] entry = read(state, assetAddress).get(assetAddress);
        if (!isPresent(entry)) {
            return Fail.of(RejectionCode.ASSET_NOT_FOUND, "Asset does not exist");
        }
        if (!signer.equals(codec.decode(entry, Asset.class).owner())) {
            return Fail.of(RejectionCode.NOT_OWNER, "Only an Asset's owner may transfer it");
        }

        String acknAddress = addresses.address(EntityKind.TRANSFER_ACKN, request.asset());
        return Ok.of(WriteSet.builder()
            .put(acknAddress, codec.encode(new TransferOffer(request.asset(), request.newOwner())))
            .build());
    }
}
