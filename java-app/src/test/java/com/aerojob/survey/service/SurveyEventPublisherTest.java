package com.aerojob.survey.service;

import com.aerojob.survey.model.SurveyResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;

import java.util.List;
import java.util.Map;

import static com.aerojob.survey.support.SurveyFixtures.Q1;
import static com.aerojob.survey.support.SurveyFixtures.STUDENT_ID;
import static com.aerojob.survey.support.SurveyFixtures.SURVEY_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class SurveyEventPublisherTest {

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    private SurveyResponse response() {
        return SurveyResponse.builder()
                .id("64b7f0c2a1b2c3d4e5f6c001")
                .surveyId(SURVEY_ID)
                .participantId(STUDENT_ID)
                .answers(List.of(new SurveyResponse.Answer(Q1, 5)))
                .build();
    }

    @Test
    @SuppressWarnings("unchecked")
    void submittedEventIsKeyedBySurvey() {
        SurveyEventPublisher publisher = new SurveyEventPublisher(kafkaTemplate, "survey-events", true);

        publisher.publishResponseSubmitted(response());

        ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq("survey-events"), eq(SURVEY_ID), event.capture());
        assertThat((Map<String, Object>) event.getValue())
                .containsEntry("type", "SURVEY_RESPONSE_SUBMITTED")
                .containsEntry("participantId", STUDENT_ID)
                .containsEntry("answerCount", 1);
    }

    @Test
    void brokerFailureDoesNotPropagate() {
        given(kafkaTemplate.send(anyString(), anyString(), any())).willThrow(new KafkaException("broker down"));
        SurveyEventPublisher publisher = new SurveyEventPublisher(kafkaTemplate, "survey-events", true);

        assertThatCode(() -> publisher.publishSurveyDeleted(SURVEY_ID, 2)).doesNotThrowAnyException();
    }

    @Test
    void disabledPublisherSendsNothing() {
        SurveyEventPublisher publisher = new SurveyEventPublisher(kafkaTemplate, "survey-events", false);

        publisher.publishResponseSubmitted(response());

        verifyNoInteractions(kafkaTemplate);
    }
}
