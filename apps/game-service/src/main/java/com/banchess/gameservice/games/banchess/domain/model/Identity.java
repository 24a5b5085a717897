package com.banchess.gameservice.games.banchess.domain.model;

/**
 * 已认证的参与者身份。
 *
 * @param userId      稳定用户ID（JWT subject 或访客ID）
 * @param displayName 展示名
 */
public record Identity(String userId, String displayName) {

    public Identity {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        if (displayName == null || displayName.isBlank()) {
            displayName = userId;
        }
    }
}
