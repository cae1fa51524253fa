package com.aerojob.survey.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Synonym tables for enum-like survey fields")
class SynonymTablesTest {

    @Nested
    @DisplayName("QuestionType")
    class QuestionTypes {

        @ParameterizedTest
        @CsvSource({
                "radio, MULTIPLE_CHOICE",
                "Single-Select, MULTIPLE_CHOICE",
                "multi select, CHECKBOX",
                "multi_select, CHECKBOX",
                "TEXTAREA, LONG_TEXT",
                "long_text, LONG_TEXT",
                "stars, RATING",
                "'  Short   Text ', SHORT_TEXT"
        })
        void foldsKnownSpellings(String raw, QuestionType expected) {
            assertThat(QuestionType.fold(raw)).isEqualTo(expected);
        }

        @ParameterizedTest
        @ValueSource(strings = {"dropdown", "", "matrix"})
        void unknownTypesFallBackToShortText(String raw) {
            assertThat(QuestionType.fold(raw)).isEqualTo(QuestionType.SHORT_TEXT);
        }

        @Test
        void nullFallsBackToShortText() {
            assertThat(QuestionType.fold(null)).isEqualTo(QuestionType.SHORT_TEXT);
        }

        @Test
        void onlyChoiceTypesCarryOptions() {
            assertThat(QuestionType.MULTIPLE_CHOICE.isChoice()).isTrue();
            assertThat(QuestionType.CHECKBOX.isChoice()).isTrue();
            assertThat(QuestionType.RATING.isChoice()).isFalse();
            assertThat(QuestionType.SHORT_TEXT.isChoice()).isFalse();
        }
    }

    @Nested
    @DisplayName("Audience")
    class Audiences {

        @ParameterizedTest
        @CsvSource({
                "alumnus, ALUMNI",
                "Alumnae, ALUMNI",
                "alumna, ALUMNI",
                "student, STUDENTS",
                "STUDENTS, STUDENTS",
                "all, ALL",
                "'', ALL"
        })
        void foldsToBucket(String raw, Audience expected) {
            assertThat(Audience.fold(raw)).contains(expected);
        }

        @Test
        void unknownAudienceIsRejected() {
            assertThat(Audience.fold("faculty")).isEmpty();
        }

        @Test
        void storedFormsIncludeLegacySynonyms() {
            assertThat(Audience.ALUMNI.storedForms()).contains("alumni", "alumnus", "alumnae", "alumna");
            assertThat(Audience.STUDENTS.storedForms()).contains("students", "student");
        }
    }

    @Nested
    @DisplayName("SurveyStatus")
    class Statuses {

        @Test
        void foldsCaseAndSynonyms() {
            assertThat(SurveyStatus.fold(" Active ")).contains(SurveyStatus.ACTIVE);
            assertThat(SurveyStatus.fold("published")).contains(SurveyStatus.ACTIVE);
            assertThat(SurveyStatus.fold("closed")).contains(SurveyStatus.ARCHIVED);
            assertThat(SurveyStatus.fold("pending")).isEmpty();
        }

        @Test
        void openedSurveysNeverReturnToDraft() {
            assertThat(SurveyStatus.DRAFT.canTransitionTo(SurveyStatus.ACTIVE)).isTrue();
            assertThat(SurveyStatus.ACTIVE.canTransitionTo(SurveyStatus.ARCHIVED)).isTrue();
            assertThat(SurveyStatus.ARCHIVED.canTransitionTo(SurveyStatus.ACTIVE)).isTrue();
            assertThat(SurveyStatus.ACTIVE.canTransitionTo(SurveyStatus.DRAFT)).isFalse();
            assertThat(SurveyStatus.ARCHIVED.canTransitionTo(SurveyStatus.DRAFT)).isFalse();
        }
    }

    @Nested
    @DisplayName("Role")
    class Roles {

        @Test
        void alumniSpellingsShareTheAlumniBucket() {
            assertThat(Role.fold("alumni").audience()).contains(Audience.ALUMNI);
            assertThat(Role.fold("Alumnus")).isEqualTo(Role.ALUMNI);
        }

        @Test
        void adminsAndUnknownRolesHaveNoBucket() {
            assertThat(Role.fold("admin").audience()).isEmpty();
            assertThat(Role.fold(null)).isEqualTo(Role.UNKNOWN);
            assertThat(Role.fold("recruiter").audience()).isEmpty();
        }
    }
}
