package com.example.werewolfgame.global.config;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Configuration
@EnableConfigurationProperties(GameProperties.class)
public class GameConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 역할 배정, 동표 추첨에 쓰이는 난수원
     * randomSeed 지정 시 같은 입력에 대해 같은 결과를 재현한다.
     */
    @Bean
    public Random gameRandom(GameProperties properties) {
        if (properties.randomSeed() != null) {
            log.info("[설정] 고정 시드 난수 사용: seed={}", properties.randomSeed());
            return new Random(properties.randomSeed());
        }
        return new SecureRandom();
    }

    /**
     * 참가자 콜백 호출용 RestClient (연결/읽기 타임아웃 = sendTimeout)
     */
    @Bean
    public RestClient participantRestClient(GameProperties properties) {
        int timeoutMillis = (int) properties.sendTimeout().toMillis();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeoutMillis);
        requestFactory.setReadTimeout(timeoutMillis);

        return RestClient.builder()
                .requestFactory(requestFactory)
                .build();
    }
}
