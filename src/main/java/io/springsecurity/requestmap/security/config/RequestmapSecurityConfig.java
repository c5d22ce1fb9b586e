package io.springsecurity.requestmap.security.config;

import io.springsecurity.requestmap.security.authz.manager.RequestmapAuthorizationManager;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.HeadersConfigurer;
import org.springframework.security.web.SecurityFilterChain;

@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class RequestmapSecurityConfig {

    private final RequestmapAuthorizationManager requestmapAuthorizationManager;

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        http
            .headers(headers -> headers.frameOptions(HeadersConfigurer.FrameOptionsConfig::sameOrigin))
            // 정적 리소스, 로그인, 에러 페이지 예외도 모두 규칙(staticRules)으로 표현한다
            .authorizeHttpRequests(authReq -> authReq.anyRequest().access(requestmapAuthorizationManager))
            .formLogin(Customizer.withDefaults())
            .logout(Customizer.withDefaults());
        return http.build();
    }
}
