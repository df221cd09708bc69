package com.taskboard.backend.modules.assignee.infrastructure.persistence;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TaskAssigneeRepositoryImplTest {

    @Test
    void containsPatternLowercasesAndWrapsKeyword() {
        assertThat(TaskAssigneeRepositoryImpl.containsPattern("Car")).isEqualTo("%car%");
    }

    @Test
    void containsPatternEscapesLikeWildcards() {
        assertThat(TaskAssigneeRepositoryImpl.containsPattern("A_b%")).isEqualTo("%a\\_b\\%%");
    }

    @Test
    void containsPatternEscapesEscapeCharacterFirst() {
        assertThat(TaskAssigneeRepositoryImpl.containsPattern("a\\_")).isEqualTo("%a\\\\\\_%");
    }

    @Test
    void containsPatternKeepsSurroundingWhitespace() {
        assertThat(TaskAssigneeRepositoryImpl.containsPattern(" bob ")).isEqualTo("% bob %");
    }
}
