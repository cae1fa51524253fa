package com.aerojob.survey.controller;

import com.aerojob.survey.dto.SurveyFilter;
import com.aerojob.survey.dto.SurveyRequest;
import com.aerojob.survey.model.Survey;
import com.aerojob.survey.security.Caller;
import com.aerojob.survey.security.CurrentCaller;
import com.aerojob.survey.service.EligibilityResolver;
import com.aerojob.survey.service.SurveyRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/surveys")
@RequiredArgsConstructor
public class SurveyController {

    private final SurveyRegistry surveyRegistry;
    private final EligibilityResolver eligibilityResolver;

    @GetMapping
    public ResponseEntity<List<Survey>> listSurveys(
            @CurrentCaller Caller caller,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String q) {
        caller.requireAdmin();
        return ResponseEntity.ok(surveyRegistry.list(SurveyFilter.builder().status(status).titleQuery(q).build()));
    }

    @PostMapping
    public ResponseEntity<Survey> createSurvey(@CurrentCaller Caller caller, @RequestBody SurveyRequest request) {
        caller.requireAdmin();
        return ResponseEntity.status(HttpStatus.CREATED).body(surveyRegistry.create(request, caller.participantId()));
    }

    /**
     * Active surveys the caller may still answer, newest first. Works without a token.
     */
    @GetMapping("/active/eligible")
    public ResponseEntity<List<Survey>> eligibleSurveys(@CurrentCaller(required = false) Caller caller) {
        return ResponseEntity.ok(eligibilityResolver.eligibleSurveys(caller));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Survey> getSurvey(@CurrentCaller(required = false) Caller caller, @PathVariable String id) {
        return ResponseEntity.ok(eligibilityResolver.visibleSurvey(id, caller));
    }

    @PutMapping("/{id}")
    public ResponseEntity<Survey> updateSurvey(
            @CurrentCaller Caller caller,
            @PathVariable String id,
            @RequestBody SurveyRequest request) {
        caller.requireAdmin();
        return ResponseEntity.ok(surveyRegistry.update(id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> deleteSurvey(@CurrentCaller Caller caller, @PathVariable String id) {
        caller.requireAdmin();
        surveyRegistry.delete(id);
        return ResponseEntity.ok(Map.of("ok", true));
    }
}
