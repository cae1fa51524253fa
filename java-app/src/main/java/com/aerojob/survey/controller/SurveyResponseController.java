package com.aerojob.survey.controller;

import com.aerojob.survey.dto.ResponseFilter;
import com.aerojob.survey.dto.ResponseView;
import com.aerojob.survey.dto.SubmitResponseRequest;
import com.aerojob.survey.model.SurveyResponse;
import com.aerojob.survey.security.Caller;
import com.aerojob.survey.security.CurrentCaller;
import com.aerojob.survey.service.SurveyResponseService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SurveyResponseController {

    private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final SurveyResponseService responseService;

    @PostMapping("/surveys/{id}/responses")
    public ResponseEntity<SurveyResponse> submitResponse(
            @CurrentCaller Caller caller,
            @PathVariable String id,
            @RequestBody(required = false) SubmitResponseRequest request) {
        SurveyResponse saved = responseService.submit(id, caller, request);
        log.info("Survey response submitted: surveyId={}, responseId={}", id, saved.getId());
        return ResponseEntity.status(HttpStatus.CREATED).body(saved);
    }

    /**
     * Admin listing. {@code userId} is accepted as the older name of {@code participantId}.
     */
    @GetMapping("/surveys/{id}/responses")
    public ResponseEntity<List<ResponseView>> listResponses(
            @CurrentCaller Caller caller,
            @PathVariable String id,
            @RequestParam(required = false) String role,
            @RequestParam(required = false) String participantId,
            @RequestParam(required = false) String userId) {
        caller.requireAdmin();
        ResponseFilter filter = ResponseFilter.builder()
                .role(role)
                .participantId(participantId != null ? participantId : userId)
                .build();
        return ResponseEntity.ok(responseService.responsesFor(id, filter));
    }

    @GetMapping("/surveys/{id}/responses/export")
    public ResponseEntity<byte[]> exportResponses(@CurrentCaller Caller caller, @PathVariable String id) {
        caller.requireAdmin();
        byte[] csv = responseService.exportCsv(id);
        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename("responses.csv").build().toString())
                .body(csv);
    }

    /**
     * The caller's own response, or an empty body when there is none.
     */
    @GetMapping("/surveys/{id}/my-response")
    public ResponseEntity<SurveyResponse> myResponse(@CurrentCaller Caller caller, @PathVariable String id) {
        return ResponseEntity.ok(responseService.myResponse(id, caller).orElse(null));
    }

    @DeleteMapping("/survey-responses/{id}")
    public ResponseEntity<Map<String, Object>> deleteResponse(@CurrentCaller Caller caller, @PathVariable String id) {
        caller.requireAdmin();
        responseService.deleteResponse(id);
        return ResponseEntity.ok(Map.of("deleted", true));
    }
}
