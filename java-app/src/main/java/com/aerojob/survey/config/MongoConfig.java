package com.aerojob.survey.config;

import com.aerojob.survey.model.Survey;
import com.aerojob.survey.model.SurveyResponse;
import com.aerojob.survey.repository.SurveyResponseRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.index.PartialIndexFilter;
import org.springframework.data.mongodb.core.query.Criteria;

import javax.annotation.PostConstruct;

/**
 * Startup housekeeping for the survey collections.
 *
 * <p>Legacy response links are migrated before the unique {@code (surveyId, participantId)} index is
 * ensured, so that responses written by older releases are covered by it. The index is partial on
 * {@code participantId} because anonymous legacy documents carry no participant.
 */
@Slf4j
@Configuration
public class MongoConfig {

    static final String RESPONSE_UNIQUE_INDEX = "survey_participant_unique";

    private final MongoTemplate mongoTemplate;
    private final SurveyResponseRepository responseRepository;
    private final boolean migrateLegacyReferences;

    public MongoConfig(
            MongoTemplate mongoTemplate,
            SurveyResponseRepository responseRepository,
            @Value("${survey.migration.legacy-references:true}") boolean migrateLegacyReferences) {
        this.mongoTemplate = mongoTemplate;
        this.responseRepository = responseRepository;
        this.migrateLegacyReferences = migrateLegacyReferences;
    }

    @PostConstruct
    public void prepareCollections() {
        if (migrateLegacyReferences) {
            responseRepository.migrateLegacyReferences();
        }
        ensureIndexes();
    }

    void ensureIndexes() {
        try {
            IndexOperations responseIndexes = mongoTemplate.indexOps(SurveyResponse.class);
            responseIndexes.ensureIndex(new Index()
                    .on("surveyId", Sort.Direction.ASC)
                    .on("participantId", Sort.Direction.ASC)
                    .unique()
                    .partial(PartialIndexFilter.of(Criteria.where("participantId").exists(true)))
                    .named(RESPONSE_UNIQUE_INDEX));
            responseIndexes.ensureIndex(new Index()
                    .on("participantId", Sort.Direction.ASC)
                    .named("participant_idx"));

            IndexOperations surveyIndexes = mongoTemplate.indexOps(Survey.class);
            surveyIndexes.ensureIndex(new Index()
                    .on("status", Sort.Direction.ASC)
                    .on("audience", Sort.Direction.ASC)
                    .on("createdAt", Sort.Direction.DESC)
                    .named("status_audience_created_idx"));

            log.info("[MongoDB] Indexes ensured on surveys and surveyresponses");
        } catch (Exception e) {
            log.error("[MongoDB] Failed to ensure survey indexes", e);
            throw new IllegalStateException("Failed to create MongoDB indexes for surveys", e);
        }
    }
}
