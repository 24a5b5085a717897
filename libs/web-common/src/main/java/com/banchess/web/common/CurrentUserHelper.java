package com.banchess.web.common;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jwt.Jwt;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * 当前用户信息提取工具类
 *
 * HTTP 接口（@AuthenticationPrincipal Jwt）与 WebSocket 认证共用同一套提取规则：
 * <pre>
 * {@code
 * CurrentUserInfo user = CurrentUserHelper.from(jwt);
 * String name = user.getDisplayName();
 * }
 * </pre>
 */
@Slf4j
public final class CurrentUserHelper {

    /** name 字段里 lastName 的占位值，展示时去掉 */
    private static final String LASTNAME_PLACEHOLDER = "-";

    private CurrentUserHelper() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * 从 JWT 中提取用户信息
     *
     * @return 用户信息；jwt 为 null 时返回 null
     */
    public static CurrentUserInfo from(Jwt jwt) {
        if (jwt == null) {
            return null;
        }
        String userId = jwt.getSubject();
        String username = Optional.ofNullable(jwt.getClaimAsString("preferred_username"))
                .filter(s -> !s.isBlank())
                .orElse(userId);
        String nickname = Optional.ofNullable(jwt.getClaimAsString("name"))
                .map(CurrentUserHelper::cleanName)
                .filter(s -> !s.isBlank())
                .orElse(null);
        return new CurrentUserInfo(userId, username, nickname, extractRealmRoles(jwt));
    }

    public static String getUserId(Jwt jwt) {
        return jwt != null ? jwt.getSubject() : null;
    }

    @SuppressWarnings("unchecked")
    private static Collection<String> extractRealmRoles(Jwt jwt) {
        try {
            Object realmAccess = jwt.getClaim("realm_access");
            if (realmAccess instanceof Map<?, ?> realm) {
                Object roles = realm.get("roles");
                if (roles instanceof Collection<?> r) {
                    return (Collection<String>) r;
                }
            }
        } catch (Exception e) {
            log.debug("提取 Realm 角色失败", e);
        }
        return Collections.emptyList();
    }

    /**
     * 去掉 name 末尾的 lastName 占位值，例如 "张三 -" → "张三"，名字中间的横线保留。
     */
    static String cleanName(String name) {
        if (name == null || name.isBlank()) {
            return name;
        }
        String result = name.trim();
        if (result.endsWith(" " + LASTNAME_PLACEHOLDER)) {
            result = result.substring(0, result.length() - 2);
        } else if (result.endsWith(LASTNAME_PLACEHOLDER)) {
            result = result.substring(0, result.length() - 1);
        }
        return result.trim();
    }
}
