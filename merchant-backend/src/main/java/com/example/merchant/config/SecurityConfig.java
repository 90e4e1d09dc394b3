package com.example.merchant.config;

import com.example.merchant.security.AgentSignatureFilter;
import com.example.merchant.security.SignatureVerifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.annotation.web.configurers.HeadersConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;

/**
 * Security configuration for the merchant.
 *
 * Browsing and cart endpoints are public. Agents authenticate per request with an HTTP message
 * signature, checked by {@link AgentSignatureFilter}; agent-only paths are configured under
 * {@code merchant.agent-trust.required-paths}.
 */
@Configuration
public class SecurityConfig {

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http,
                                                   SignatureVerifier signatureVerifier,
                                                   AgentTrustProperties agentTrustProperties) throws Exception {
        http
                .csrf(AbstractHttpConfigurer::disable)
                .httpBasic(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(auth -> auth.anyRequest().permitAll())
                .headers(headers -> headers
                        .frameOptions(HeadersConfigurer.FrameOptionsConfig::sameOrigin)
                )
                .addFilterBefore(new AgentSignatureFilter(signatureVerifier, agentTrustProperties),
                        AnonymousAuthenticationFilter.class);

        return http.build();
    }
}
