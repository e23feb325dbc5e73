package com.example.draftarchiver.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LifecycleState Tests")
class LifecycleStateTest {

    @Test
    @DisplayName("✅ Linear pipeline transitions are allowed")
    void linearChainAllowed() {
        assertThat(LifecycleState.CREATED.canTransitionTo(LifecycleState.PROVISIONED)).isTrue();
        assertThat(LifecycleState.PROVISIONED.canTransitionTo(LifecycleState.ASSETS_FETCHING)).isTrue();
        assertThat(LifecycleState.ASSETS_FETCHING.canTransitionTo(LifecycleState.METADATA_FINALIZED)).isTrue();
        assertThat(LifecycleState.METADATA_FINALIZED.canTransitionTo(LifecycleState.ARCHIVED)).isTrue();
        assertThat(LifecycleState.ARCHIVED.canTransitionTo(LifecycleState.UPLOADED)).isTrue();
        assertThat(LifecycleState.UPLOADED.canTransitionTo(LifecycleState.CLEANED_UP)).isTrue();
    }

    @Test
    @DisplayName("❌ Skipping a stage is rejected")
    void skippingRejected() {
        assertThat(LifecycleState.CREATED.canTransitionTo(LifecycleState.ASSETS_FETCHING)).isFalse();
        assertThat(LifecycleState.PROVISIONED.canTransitionTo(LifecycleState.ARCHIVED)).isFalse();
        assertThat(LifecycleState.ASSETS_FETCHING.canTransitionTo(LifecycleState.UPLOADED)).isFalse();
        assertThat(LifecycleState.ARCHIVED.canTransitionTo(LifecycleState.CLEANED_UP)).isFalse();
    }

    @ParameterizedTest
    @EnumSource(value = LifecycleState.class, names = {"CREATED", "PROVISIONED", "ASSETS_FETCHING",
            "METADATA_FINALIZED", "ARCHIVED", "UPLOADED"})
    @DisplayName("✅ FAILED is reachable from every non-terminal state")
    void failedReachable(LifecycleState state) {
        assertThat(state.canTransitionTo(LifecycleState.FAILED)).isTrue();
        assertThat(state.isTerminal()).isFalse();
    }

    @Test
    @DisplayName("✅ FAILED only leads to CLEANED_UP")
    void failedLeadsToCleanup() {
        assertThat(LifecycleState.FAILED.canTransitionTo(LifecycleState.CLEANED_UP)).isTrue();
        assertThat(LifecycleState.FAILED.canTransitionTo(LifecycleState.FAILED)).isFalse();
        assertThat(LifecycleState.FAILED.canTransitionTo(LifecycleState.ARCHIVED)).isFalse();
    }

    @ParameterizedTest
    @EnumSource(LifecycleState.class)
    @DisplayName("❌ CLEANED_UP is terminal")
    void cleanedUpIsTerminal(LifecycleState next) {
        assertThat(LifecycleState.CLEANED_UP.isTerminal()).isTrue();
        assertThat(LifecycleState.CLEANED_UP.canTransitionTo(next)).isFalse();
    }
}
