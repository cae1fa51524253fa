package com.aerojob.survey.service;

import com.aerojob.survey.model.SurveyResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;

/**
 * Publishes survey lifecycle events, keyed by survey id. Delivery is best-effort:
 * a broker failure is logged and never fails the request that triggered it.
 */
@Slf4j
@Service
public class SurveyEventPublisher {

    static final String RESPONSE_SUBMITTED = "SURVEY_RESPONSE_SUBMITTED";
    static final String SURVEY_DELETED = "SURVEY_DELETED";

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final String topic;
    private final boolean enabled;

    public SurveyEventPublisher(
            KafkaTemplate<String, Object> kafkaTemplate,
            @Value("${survey.events.topic:survey-events}") String topic,
            @Value("${survey.events.enabled:true}") boolean enabled) {
        this.kafkaTemplate = kafkaTemplate;
        this.topic = topic;
        this.enabled = enabled;
    }

    public void publishResponseSubmitted(SurveyResponse response) {
        Map<String, Object> event = new HashMap<>();
        event.put("type", RESPONSE_SUBMITTED);
        event.put("surveyId", response.getSurveyId());
        event.put("participantId", response.getParticipantId());
        event.put("responseId", response.getId());
        event.put("answerCount", response.getAnswers().size());
        event.put("timestamp", System.currentTimeMillis());
        send(response.getSurveyId(), event);
    }

    public void publishSurveyDeleted(String surveyId, long removedResponses) {
        Map<String, Object> event = new HashMap<>();
        event.put("type", SURVEY_DELETED);
        event.put("surveyId", surveyId);
        event.put("removedResponses", removedResponses);
        event.put("timestamp", System.currentTimeMillis());
        send(surveyId, event);
    }

    private void send(String key, Map<String, Object> event) {
        if (!enabled) {
            log.debug("Survey events disabled, skipping {}", event.get("type"));
            return;
        }
        try {
            kafkaTemplate.send(topic, key, event);
            log.info("Sent {} to Kafka: surveyId={}", event.get("type"), key);
        } catch (Exception e) {
            log.error("Error sending {} to Kafka: surveyId={}", event.get("type"), key, e);
        }
    }
}
