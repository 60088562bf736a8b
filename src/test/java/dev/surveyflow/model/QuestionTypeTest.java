package dev.surveyflow.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuestionTypeTest {

    @Test
    void onlySingleChoiceAndRatingBranchOnOptions() {
        assertThat(QuestionType.SINGLE_CHOICE.supportsBranching()).isTrue();
        assertThat(QuestionType.RATING.supportsBranching()).isTrue();
        assertThat(QuestionType.MULTIPLE_CHOICE.supportsBranching()).isFalse();
        assertThat(QuestionType.TEXT.supportsBranching()).isFalse();
    }

    @Test
    void parsesCommonSpellings() {
        assertThat(QuestionType.parse("singleChoice")).isEqualTo(QuestionType.SINGLE_CHOICE);
        assertThat(QuestionType.parse("multiple-choice")).isEqualTo(QuestionType.MULTIPLE_CHOICE);
        assertThat(QuestionType.parse("RATING")).isEqualTo(QuestionType.RATING);
    }

    @Test
    void rejectsUnknownType() {
        assertThatThrownBy(() -> QuestionType.parse("slider"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("slider");
    }
}
