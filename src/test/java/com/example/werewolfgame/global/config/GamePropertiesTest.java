package com.example.werewolfgame.global.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledIfEnvironmentVariable;
import org.springframework.boot.test.context.ConfigDataApplicationContextInitializer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import com.example.werewolfgame.game.domain.PlayerRole;

class GamePropertiesTest {

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(GameProperties.class)
    static class PropertiesOnly {
    }

    // application.yml 을 그대로 읽는다
    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withInitializer(new ConfigDataApplicationContextInitializer())
            .withUserConfiguration(PropertiesOnly.class);

    @Test
    @DisabledIfEnvironmentVariable(named = "GAME_SESSION_ID", matches = ".+")
    @DisplayName("세션 ID 가 지정되지 않으면 기동에 실패한다")
    void missingSessionId_failsStartup() {
        runner.withPropertyValues("game.moderator-id=moderator")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasRootCauseInstanceOf(BindValidationException.class);
                });
    }

    @Test
    @DisplayName("세션 ID 와 사회자 ID 를 지정하면 나머지는 기본 설정으로 바인딩된다")
    void requiredValues_bindWithDefaults() {
        runner.withPropertyValues("game.session-id=task-42", "game.moderator-id=moderator")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    GameProperties properties = context.getBean(GameProperties.class);
                    assertThat(properties.sessionId()).isEqualTo("task-42");
                    assertThat(properties.autoStart()).isTrue();
                    assertThat(properties.roleSlots())
                            .containsEntry(PlayerRole.WOLF, 2)
                            .containsEntry(PlayerRole.VILLAGER, 2);
                });
    }
}
