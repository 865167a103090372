package com.example.sgkdocumentreader.service.pipeline;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineStageTest {

    @Test
    void shouldOnlyMoveForwardOneStepAtATime() {
        assertThat(PipelineStage.UPLOADED.canTransitionTo(PipelineStage.RECTIFYING)).isTrue();
        assertThat(PipelineStage.RECTIFYING.canTransitionTo(PipelineStage.EXTRACTING)).isTrue();
        assertThat(PipelineStage.PERSISTING.canTransitionTo(PipelineStage.DONE)).isTrue();
        assertThat(PipelineStage.UPLOADED.canTransitionTo(PipelineStage.EXTRACTING)).isFalse();
        assertThat(PipelineStage.RESOLVING.canTransitionTo(PipelineStage.EXTRACTING)).isFalse();
        assertThat(PipelineStage.DONE.canTransitionTo(PipelineStage.FAILED)).isFalse();
    }

    @Test
    void shouldFailOnlyFromValidationExtractionAndPersistence() {
        assertThat(PipelineStage.UPLOADED.canTransitionTo(PipelineStage.FAILED)).isTrue();
        assertThat(PipelineStage.EXTRACTING.canTransitionTo(PipelineStage.FAILED)).isTrue();
        assertThat(PipelineStage.PERSISTING.canTransitionTo(PipelineStage.FAILED)).isTrue();
        assertThat(PipelineStage.RECTIFYING.canTransitionTo(PipelineStage.FAILED)).isFalse();
        assertThat(PipelineStage.CLASSIFYING.canTransitionTo(PipelineStage.FAILED)).isFalse();
    }

    @Test
    void shouldRetryPersistenceOnlyFromFailed() {
        assertThat(PipelineStage.FAILED.canTransitionTo(PipelineStage.PERSISTING)).isTrue();
        assertThat(PipelineStage.PACKAGING.canTransitionTo(PipelineStage.PERSISTING)).isTrue();
        assertThat(PipelineStage.CANCELLED.canTransitionTo(PipelineStage.PERSISTING)).isFalse();
        assertThat(PipelineStage.FAILED.canTransitionTo(PipelineStage.DONE)).isFalse();
    }

    @ParameterizedTest
    @EnumSource(value = PipelineStage.class, names = {"DONE", "FAILED", "CANCELLED"})
    void terminalStagesCannotBeCancelled(PipelineStage stage) {
        assertThat(stage.isTerminal()).isTrue();
        assertThat(stage.canTransitionTo(PipelineStage.CANCELLED)).isFalse();
    }

    @ParameterizedTest
    @EnumSource(PipelineStage.class)
    void nothingReturnsToUploaded(PipelineStage stage) {
        assertThat(stage.canTransitionTo(PipelineStage.UPLOADED)).isFalse();
        assertThat(stage.canTransitionTo(null)).isFalse();
    }

    @Test
    void shouldNumberForwardStepsOneToEight() {
        assertThat(PipelineStage.UPLOADED.step()).isEqualTo(1);
        assertThat(PipelineStage.DONE.step()).isEqualTo(PipelineStage.TOTAL_STEPS);
    }
}
