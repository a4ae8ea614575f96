package com.z254.sentinel.bootstrap;

import com.z254.sentinel.alerting.AlertRuleValidator;
import com.z254.sentinel.alerting.RuleEngine;
import com.z254.sentinel.detection.DetectorConfigValidator;
import com.z254.sentinel.detection.DetectorRegistry;
import com.z254.sentinel.domain.model.AlertRule;
import com.z254.sentinel.domain.model.DetectorConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class DefaultPolicyLoaderTest {

    @Mock
    private DetectorRegistry detectorRegistry;

    @Mock
    private RuleEngine ruleEngine;

    @InjectMocks
    private DefaultPolicyLoader loader;

    @Test
    void defaultPoliciesAreValid() {
        DetectorConfigValidator detectorValidator = new DetectorConfigValidator();
        AlertRuleValidator ruleValidator = new AlertRuleValidator();

        for (DetectorConfig detector : DefaultPolicyLoader.defaultDetectors()) {
            assertThatCode(() -> detectorValidator.validate(detector)).as(detector.getId()).doesNotThrowAnyException();
        }
        for (AlertRule rule : DefaultPolicyLoader.defaultRules()) {
            assertThatCode(() -> ruleValidator.validate(rule)).as(rule.getId()).doesNotThrowAnyException();
        }
        assertThat(DefaultPolicyLoader.defaultRules())
                .extracting(AlertRule::getId)
                .containsExactly("high_error_rate", "critical_memory_usage", "database_connection_failure",
                        "slow_response_time");
    }

    @Test
    void runRegistersEveryDefault() {
        loader.run(new DefaultApplicationArguments());

        verify(detectorRegistry, times(3)).addDetector(any());
        verify(ruleEngine, times(4)).addRule(any());
    }
}
