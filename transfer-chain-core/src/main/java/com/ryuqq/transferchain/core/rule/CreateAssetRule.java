package com.ryuqq.transferchain.core.rule;

import com.ryuqq.transferchain.core.address.AddressScheme;
import com.ryuqq.transferchain.core.address.EntityKind;
import com.ryuqq.transferchain.core.codec.CanonicalCodec;
import com.ryuqq.transferchain.core.model.Asset;
import com.ryuqq.transferchain.core.outcome.Fail;
import com.ryuqq.transferchain.core.outcome.Ok;
import com.ryuqq.transferchain.core.outcome.Outcome;
import com.ryuqq.transferchain.core.outcome.RejectionCode;
import com.ryuqq.transferchain.core.request.CreateAssetRequest;
import com.ryuqq.transferchain.core.spi.StateStore;
import com.ryuqq.transferchain.core.state.WriteSet;

/**
 * 자산 생성 규칙.
 *
 * <pre>
 * read  : Asset[name]
 * fail  : 존재 → ASSET_ALREADY_EXISTS
 * write : Asset[name] = {name, owner: signer}
 * </pre>
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public final class CreateAssetRule extends AbstractTransitionRule<CreateAssetRequest> {

    public CreateAssetRule(AddressScheme addresses, CanonicalCodec codec) {
        super(addresses, codec);
    }

    @Override
    public Outcome apply(CreateAssetRequest request, String signer, StateStore state) {
        String assetAddress = addresses.address(EntityKind.ASSET, request.asset());

        if (isPresent(read(state, assetAddress).get(assetAddress))) {
            return Fail.of(RejectionCode.ASSET_ALREADY_EXISTS, "Asset name in use");
        }

        return Ok.of(WriteSet.builder()
            .put(assetAddress, codec.encode(new Asset(request.asset(), signer)))
            .build());
    }
}
