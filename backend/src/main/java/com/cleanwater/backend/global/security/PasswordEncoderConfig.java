package com.cleanwater.backend.global.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.password.PasswordEncoder;

// kept apart from SecurityConfig: AuthService needs the encoder and the filter chain needs AuthService
@Configuration
public class PasswordEncoderConfig {

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new TruncatingBCryptPasswordEncoder();
    }
}
