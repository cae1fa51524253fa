package com.aerojob.survey.service;

import com.aerojob.survey.dto.ParticipantSummary;
import com.aerojob.survey.dto.ResponseView;
import com.aerojob.survey.error.exception.ExportException;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One quoted CSV row per response; the answers go into a single JSON-encoded column.
 */
@Component
public class ResponseCsvExporter {

    private final CsvMapper csvMapper = CsvMapper.builder()
            .enable(CsvGenerator.Feature.ALWAYS_QUOTE_STRINGS)
            .build();
    private final CsvSchema schema = csvMapper.schemaFor(CsvRow.class).withHeader();
    private final ObjectMapper objectMapper = new ObjectMapper();

    public byte[] export(String surveyId, List<ResponseView> responses) {
        try {
            List<CsvRow> rows = responses.stream().map(this::toRow).collect(Collectors.toList());
            return csvMapper.writer(schema).writeValueAsBytes(rows);
        } catch (JsonProcessingException e) {
            throw new ExportException(surveyId, e);
        }
    }

    private CsvRow toRow(ResponseView view) {
        ParticipantSummary participant = view.getParticipant();
        String answers;
        try {
            answers = objectMapper.writeValueAsString(view.getAnswers() == null ? List.of() : view.getAnswers());
        } catch (JsonProcessingException e) {
            throw new ExportException(view.getSurveyId(), e);
        }
        return new CsvRow(
                view.getId(),
                view.getCreatedAt() == null ? "" : view.getCreatedAt().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME),
                participant == null || participant.getEmail() == null ? "" : participant.getEmail(),
                participant == null ? "" : participant.getName(),
                participant == null || participant.getRole() == null ? "" : participant.getRole(),
                answers);
    }

    @Value
    @JsonPropertyOrder({"_id", "createdAt", "userEmail", "userName", "role", "answers"})
    static class CsvRow {
        @JsonProperty("_id")
        String id;
        @JsonProperty("createdAt")
        String createdAt;
        @JsonProperty("userEmail")
        String userEmail;
        @JsonProperty("userName")
        String userName;
        @JsonProperty("role")
        String role;
        @JsonProperty("answers")
        String answers;
    }
}
