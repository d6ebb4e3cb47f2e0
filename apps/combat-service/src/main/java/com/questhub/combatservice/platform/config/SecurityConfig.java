package com.questhub.combatservice.platform.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;

/**
 * 资源服务器安全配置
 * -------------------------------------------------------
 *  - REST 接口统一要求 Bearer JWT；
 *  - 战斗 WebSocket 握手放行，令牌随 query 携带，在连接建立后由准入流程校验
 *    （这样校验失败时还能把 invalid_token 事件回给客户端）；
 *  - 无状态，不创建 HttpSession。
 */
@Configuration
public class SecurityConfig {

    @Bean
    SecurityFilterChain securityFilterChain(HttpSecurity http, CombatProperties properties) throws Exception {
        String wsPath = properties.getWs().getPath();
        http
                .csrf(csrf -> csrf.disable())
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(wsPath, wsPath + "/**").permitAll()
                        .requestMatchers("/public/**").permitAll()
                        .anyRequest().authenticated()
                )
                .oauth2ResourceServer(oauth -> oauth.jwt(Customizer.withDefaults()));
        return http.build();
    }
}
