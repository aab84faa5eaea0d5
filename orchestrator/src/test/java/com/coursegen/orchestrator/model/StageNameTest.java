package com.coursegen.orchestrator.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StageNameTest {

    @Test
    void progressOnEntry_startsAtOneIncrementAndStopsShortOfComplete() {
        assertThat(StageName.PLAN_CURRICULUM.progressOnEntry()).isEqualTo(9);
        assertThat(StageName.LESSON_CONTENT.progressOnEntry()).isEqualTo(18);
        assertThat(StageName.PACKAGE.progressOnEntry()).isEqualTo(90);
    }

    @Test
    void progressOnEntry_growsWithEveryStage() {
        int previous = 0;
        for (StageName stage : StageName.values()) {
            assertThat(stage.progressOnEntry()).isGreaterThan(previous).isLessThan(100);
            previous = stage.progressOnEntry();
        }
    }
}
