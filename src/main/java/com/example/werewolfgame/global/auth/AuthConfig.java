package com.example.werewolfgame.global.auth;

import java.time.Clock;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.werewolfgame.global.config.GameProperties;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Configuration
public class AuthConfig {

    @Bean
    public SessionAuthVerifier sessionAuthVerifier(ObjectProvider<ChainAuthClient> chainAuthClient,
                                                   GameProperties properties, Clock clock) {
        ChainAuthClient client = chainAuthClient.getIfAvailable();
        if (client == null) {
            if (properties.authRequired()) {
                throw new IllegalStateException("game.auth-required=true 이지만 ChainAuthClient 빈이 없습니다.");
            }
            log.warn("[인증] ChainAuthClient 없음, 참가 인증 없이 실행");
        }
        return new SessionAuthVerifier(client, clock);
    }
}
