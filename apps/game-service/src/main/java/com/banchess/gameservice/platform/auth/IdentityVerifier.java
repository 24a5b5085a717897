package com.banchess.gameservice.platform.auth;

import com.banchess.gameservice.games.banchess.domain.model.Identity;

/**
 * 身份校验（外部身份提供方签发的凭证 → 稳定身份）。
 */
public interface IdentityVerifier {

    /**
     * @throws com.banchess.gameservice.common.GameException AUTH_FAILED
     */
    Identity verify(Credentials credentials);
}
