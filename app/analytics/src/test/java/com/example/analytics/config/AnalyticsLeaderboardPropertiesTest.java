/*
 * どこで: Analytics 設定のバインド/バリデーションテスト
 * 何を: analytics.leaderboard.* の値が record へ入り、不正値が検出されることを検証する
 */
package com.example.analytics.config;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class AnalyticsLeaderboardPropertiesTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
          .withUserConfiguration(TestConfiguration.class);

  private Validator validator;

  @BeforeEach
  void setUp() {
    validator = Validation.buildDefaultValidatorFactory().getValidator();
  }

  @Test
  void bindsKebabCaseValues() {
    contextRunner
        .withPropertyValues(
            "analytics.leaderboard.min-shared-matches=5",
            "analytics.leaderboard.size=10",
            "analytics.leaderboard.min-total-matches=4")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final AnalyticsLeaderboardProperties properties =
                  context.getBean(AnalyticsLeaderboardProperties.class);
              assertThat(properties.minSharedMatches()).isEqualTo(5);
              assertThat(properties.size()).isEqualTo(10);
              assertThat(properties.minTotalMatches()).isEqualTo(4);
            });
  }

  @Test
  void contextFailsWhenSizeMissing() {
    contextRunner
        .withPropertyValues(
            "analytics.leaderboard.min-shared-matches=5",
            "analytics.leaderboard.min-total-matches=4")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void validationFailsWhenThresholdIsZero() {
    assertThat(validator.validate(new AnalyticsLeaderboardProperties(0, 10, 4))).isNotEmpty();
    assertThat(validator.validate(new AnalyticsLeaderboardProperties(5, 10, 4))).isEmpty();
  }

  @Configuration
  @EnableConfigurationProperties(AnalyticsLeaderboardProperties.class)
  static class TestConfiguration {}
}
