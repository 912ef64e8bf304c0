package com.acme.homelander.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class HomelanderConfigTest {

    @Test
    @DisplayName("defaults - should report transientError and online states")
    void testDefaults() {
        HomelanderConfig config = new HomelanderConfig("user-1");

        assertThat(config.getAgentUserId()).isEqualTo("user-1");
        assertThat(config.getSyncFailureErrorCode()).isEqualTo("transientError");
        assertThat(config.isReportOnlineInExecuteStates()).isTrue();
        assertThatCode(config::validate).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("validate - should reject a missing agent user id")
    void testValidateMissingAgentUserId() {
        assertThatThrownBy(() -> new HomelanderConfig().validate())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("agentUserId");
        assertThatThrownBy(() -> new HomelanderConfig("  ").validate())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("setters - should override defaults")
    void testSetters() {
        HomelanderConfig config = new HomelanderConfig("user-1");
        config.setSyncFailureErrorCode("hardError");
        config.setReportOnlineInExecuteStates(false);

        assertThat(config.getSyncFailureErrorCode()).isEqualTo("hardError");
        assertThat(config.isReportOnlineInExecuteStates()).isFalse();
    }
}
