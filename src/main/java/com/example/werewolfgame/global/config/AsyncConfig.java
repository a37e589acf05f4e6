package com.example.werewolfgame.global.config;

import java.util.concurrent.Executor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    /**
     * 팬아웃 전송용 (참가자별 send 를 병렬로 발행)
     */
    @Bean(name = "fanoutExecutor")
    public Executor fanoutExecutor() {
        return executor("Fanout-", 16);
    }

    /**
     * 참가자 핸들러 호출용 (전송 타임아웃 적용 대상)
     * 팬아웃 풀과 공유하면 팬아웃 작업이 핸들러 작업을 기다리며 풀이 고갈됨
     */
    @Bean(name = "transportExecutor")
    public Executor transportExecutor() {
        return executor("Transport-", 32);
    }

    /**
     * 게임 루프 전용 단일 스레드
     */
    @Bean(name = "engineExecutor")
    public Executor engineExecutor() {
        return executor("Engine-", 1);
    }

    private ThreadPoolTaskExecutor executor(String prefix, int poolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix(prefix);
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
