package com.caseflow.caseservice.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CaseServiceProperties")
class CaseServicePropertiesTest {

    @Test
    @DisplayName("accepts valid properties")
    void acceptsValidProperties() {
        var props = new CaseServiceProperties("case-service", "production", 4);
        assertThat(props.name()).isEqualTo("case-service");
        assertThat(props.environment()).isEqualTo("production");
        assertThat(props.notificationThreads()).isEqualTo(4);
    }

    @Test
    @DisplayName("defaults environment to 'development' when blank")
    void defaultsEnvironment() {
        assertThat(new CaseServiceProperties("case-service", null, 1).environment()).isEqualTo("development");
        assertThat(new CaseServiceProperties("case-service", " ", 1).environment()).isEqualTo("development");
    }

    @Test
    @DisplayName("defaults notification threads to 2 when zero or negative")
    void defaultsThreads() {
        assertThat(new CaseServiceProperties("case-service", "dev", 0).notificationThreads()).isEqualTo(2);
        assertThat(new CaseServiceProperties("case-service", "dev", -3).notificationThreads()).isEqualTo(2);
    }
}
