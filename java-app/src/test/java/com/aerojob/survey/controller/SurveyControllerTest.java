package com.aerojob.survey.controller;

import com.aerojob.survey.dto.SurveyFilter;
import com.aerojob.survey.dto.SurveyRequest;
import com.aerojob.survey.error.GlobalExceptionHandler;
import com.aerojob.survey.error.exception.NotFoundException;
import com.aerojob.survey.error.exception.UnauthenticatedException;
import com.aerojob.survey.model.Role;
import com.aerojob.survey.model.Survey;
import com.aerojob.survey.model.SurveyStatus;
import com.aerojob.survey.security.Caller;
import com.aerojob.survey.security.CallerArgumentResolver;
import com.aerojob.survey.security.PrincipalResolver;
import com.aerojob.survey.service.EligibilityResolver;
import com.aerojob.survey.service.SurveyRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Optional;

import static com.aerojob.survey.support.SurveyFixtures.ADMIN_ID;
import static com.aerojob.survey.support.SurveyFixtures.STUDENT_ID;
import static com.aerojob.survey.support.SurveyFixtures.SURVEY_ID;
import static com.aerojob.survey.support.SurveyFixtures.exitSurvey;
import static com.aerojob.survey.support.SurveyFixtures.survey;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("SurveyController")
class SurveyControllerTest {

    @Mock
    private SurveyRegistry surveyRegistry;

    @Mock
    private EligibilityResolver eligibilityResolver;

    @Mock
    private PrincipalResolver principalResolver;

    private MockMvc mockMvc;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private final Caller admin = Caller.of(ADMIN_ID, Role.ADMIN);
    private final Caller student = Caller.of(STUDENT_ID, Role.STUDENT);

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new SurveyController(surveyRegistry, eligibilityResolver))
                .setCustomArgumentResolvers(new CallerArgumentResolver(principalResolver))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private void signedInAs(Caller caller) {
        given(principalResolver.resolve(any())).willReturn(Optional.of(caller));
    }

    @Nested
    @DisplayName("admin endpoints")
    class AdminOnly {

        @Test
        void anonymousListIsUnauthorized() throws Exception {
            mockMvc.perform(get("/api/surveys"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.code").value("C009"));
            verifyNoInteractions(surveyRegistry);
        }

        @Test
        void studentListIsForbidden() throws Exception {
            signedInAs(student);

            mockMvc.perform(get("/api/surveys"))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.code").value("C011"));
        }

        @Test
        void adminListPassesFilters() throws Exception {
            signedInAs(admin);
            given(surveyRegistry.list(any())).willReturn(List.of(exitSurvey()));

            mockMvc.perform(get("/api/surveys").param("status", "active").param("q", "exit"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$[0].title").value("Exit Survey"))
                    .andExpect(jsonPath("$[0].questions[0].type").value("rating"));

            ArgumentCaptor<SurveyFilter> filter = ArgumentCaptor.forClass(SurveyFilter.class);
            verify(surveyRegistry).list(filter.capture());
            assertThat(filter.getValue().getStatus()).isEqualTo("active");
            assertThat(filter.getValue().getTitleQuery()).isEqualTo("exit");
        }

        @Test
        void createReturnsCreated() throws Exception {
            signedInAs(admin);
            given(surveyRegistry.create(any(SurveyRequest.class), eq(ADMIN_ID))).willReturn(exitSurvey());
            SurveyRequest request = SurveyRequest.builder().title("Exit Survey").audience("students").build();

            mockMvc.perform(post("/api/surveys")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(request)))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.id").value(SURVEY_ID))
                    .andExpect(jsonPath("$.audience").value("students"));
        }

        @Test
        void malformedBodyIsBadRequest() throws Exception {
            signedInAs(admin);

            mockMvc.perform(put("/api/surveys/" + SURVEY_ID)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"title\": "))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("C001"));
        }

        @Test
        void unsupportedMethodIsMethodNotAllowed() throws Exception {
            mockMvc.perform(patch("/api/surveys"))
                    .andExpect(status().isMethodNotAllowed())
                    .andExpect(jsonPath("$.code").value("C012"));
            verifyNoInteractions(surveyRegistry, principalResolver);
        }

        @Test
        void plainTextBodyIsUnsupportedMediaType() throws Exception {
            signedInAs(admin);

            mockMvc.perform(post("/api/surveys")
                            .contentType(MediaType.TEXT_PLAIN)
                            .content("title=Exit Survey"))
                    .andExpect(status().isUnsupportedMediaType())
                    .andExpect(jsonPath("$.code").value("C014"));
            verifyNoInteractions(surveyRegistry);
        }

        @Test
        void deleteAnswersOk() throws Exception {
            signedInAs(admin);

            mockMvc.perform(delete("/api/surveys/" + SURVEY_ID))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.ok").value(true));
            verify(surveyRegistry).delete(SURVEY_ID);
        }
    }

    @Nested
    @DisplayName("participant endpoints")
    class ParticipantFacing {

        @Test
        void eligibleListWorksWithoutToken() throws Exception {
            given(eligibilityResolver.eligibleSurveys(Caller.anonymous()))
                    .willReturn(List.of(survey(SURVEY_ID, "all", SurveyStatus.ACTIVE)));

            mockMvc.perform(get("/api/surveys/active/eligible"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$[0].id").value(SURVEY_ID))
                    .andExpect(jsonPath("$[0].active").doesNotExist());
        }

        @Test
        @DisplayName("an ineligible survey reads as 404")
        void ineligibleDetailIsNotFound() throws Exception {
            signedInAs(student);
            given(eligibilityResolver.visibleSurvey(SURVEY_ID, student)).willThrow(NotFoundException.notEligible());

            mockMvc.perform(get("/api/surveys/" + SURVEY_ID))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.code").value("C006"))
                    .andExpect(jsonPath("$.message").value("Survey not found or not eligible"));
        }

        @Test
        void invalidTokenIsUnauthorizedEvenWhereOptional() throws Exception {
            given(principalResolver.resolve(any()))
                    .willThrow(UnauthenticatedException.invalidCredential());

            mockMvc.perform(get("/api/surveys/active/eligible"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.code").value("C010"));
        }
    }
}
