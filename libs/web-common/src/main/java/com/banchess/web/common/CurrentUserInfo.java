package com.banchess.web.common;

import java.util.Collection;

/**
 * 从 JWT 中提取出的当前用户信息
 */
public record CurrentUserInfo(
    /** 用户ID（JWT subject） */
    String userId,

    /** 用户名（preferred_username，如果没有则使用 userId） */
    String username,

    /** 昵称（JWT 的 name 字段，可为空） */
    String nickname,

    /** Realm 角色列表 */
    Collection<String> realmRoles
) {
    /**
     * 对局中展示的名称
     * 优先级：nickname > username > userId
     */
    public String getDisplayName() {
        if (nickname != null && !nickname.isBlank()) {
            return nickname;
        }
        if (username != null && !username.isBlank()) {
            return username;
        }
        return userId;
    }

    public boolean hasRealmRole(String role) {
        return realmRoles != null && realmRoles.contains(role);
    }
}
