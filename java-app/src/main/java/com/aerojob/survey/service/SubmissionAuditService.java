package com.aerojob.survey.service;

import com.aerojob.survey.model.SurveyResponse;
import com.aerojob.survey.security.Caller;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.Map;

/**
 * Indexes an audit document per stored response in Elasticsearch. Telemetry only:
 * failures are logged and dropped.
 */
@Slf4j
@Service
public class SubmissionAuditService {

    private static final String AUDIT_INDEX_PATH = "/survey-audit/_doc";

    private final RestTemplate restTemplate;
    private final String elasticsearchUrl;
    private final boolean enabled;

    public SubmissionAuditService(
            RestTemplate restTemplate,
            @Value("${survey.audit.elasticsearch-url:http://elasticsearch:9200}") String elasticsearchUrl,
            @Value("${survey.audit.enabled:false}") boolean enabled) {
        this.restTemplate = restTemplate;
        this.elasticsearchUrl = elasticsearchUrl;
        this.enabled = enabled;
    }

    public void recordSubmission(SurveyResponse response, Caller caller) {
        if (!enabled) {
            return;
        }

        Map<String, Object> entry = new HashMap<>();
        entry.put("@timestamp", System.currentTimeMillis());
        entry.put("level", "INFO");
        entry.put("logger", "SurveyResponseService");
        entry.put("message", "Survey response submitted: " + response.getSurveyId());
        entry.put("surveyId", response.getSurveyId());
        entry.put("responseId", response.getId());
        entry.put("participantId", response.getParticipantId());
        entry.put("role", caller.role().name());
        entry.put("answerCount", response.getAnswers().size());
        entry.put("source", "survey-app");

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        try {
            ResponseEntity<String> result = restTemplate.postForEntity(
                    elasticsearchUrl + AUDIT_INDEX_PATH,
                    new HttpEntity<>(entry, headers),
                    String.class);
            if (result.getStatusCode().is2xxSuccessful()) {
                log.debug("Audit entry sent to Elasticsearch: responseId={}", response.getId());
            }
        } catch (RestClientException e) {
            log.debug("Elasticsearch unavailable, audit entry for response {} dropped: {}", response.getId(), e.getMessage());
        }
    }
}
