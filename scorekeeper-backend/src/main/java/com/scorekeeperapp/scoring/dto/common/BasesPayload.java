package com.scorekeeperapp.scoring.dto.common;

import com.scorekeeperapp.scoring.domain.bases.Base;
import com.scorekeeperapp.scoring.domain.bases.BaserunnerState;

/**
 * Player ids on first, second and third; null for an empty base.
 */
public record BasesPayload(String first, String second, String third) {

    public static BasesPayload from(BaserunnerState state) {
        return new BasesPayload(
                state.occupant(Base.FIRST).orElse(null),
                state.occupant(Base.SECOND).orElse(null),
                state.occupant(Base.THIRD).orElse(null));
    }

    public static BaserunnerState toState(BasesPayload payload) {
        if (payload == null) return BaserunnerState.empty();
        return BaserunnerState.of(payload.first(), payload.second(), payload.third());
    }
}
