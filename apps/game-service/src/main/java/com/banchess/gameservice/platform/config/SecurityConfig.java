package com.banchess.gameservice.platform.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;

/**
 * 最小化的安全配置（Resource Server）
 * -------------------------------------------------------
 * 关键点：
 *  - 只开启 JWT 资源服务器能力，JwtDecoder 由 JwtDecoderConfig 提供（HMAC 密钥）；
 *  - 放行 /actuator/** 与 /ws/**：WebSocket 握手本身不鉴权，
 *    身份在 STOMP CONNECT 帧或 authenticate 消息中校验；
 *  - 其余路径（/api/**）要求已认证；
 *  - 无状态：不创建 HttpSession，每个请求都带 Bearer token。
 */
@Configuration
public class SecurityConfig {

    @Bean
    SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/actuator/**", "/ws/**").permitAll()
                        .anyRequest().authenticated()
                )
                .oauth2ResourceServer(oauth -> oauth.jwt(Customizer.withDefaults()));
        return http.build();
    }
}
