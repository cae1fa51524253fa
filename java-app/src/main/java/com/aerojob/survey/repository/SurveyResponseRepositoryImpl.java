package com.aerojob.survey.repository;

import com.aerojob.survey.model.SurveyResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.types.ObjectId;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Slf4j
@RequiredArgsConstructor
public class SurveyResponseRepositoryImpl implements SurveyResponseRepositoryCustom {

    // stored field names; legacy documents hold ObjectIds under these keys
    static final String SURVEY_ID = "surveyId";
    static final String PARTICIPANT_ID = "participantId";
    static final String LEGACY_SURVEY = "survey";
    static final String LEGACY_USER = "user";
    static final String LEGACY_USER_ID = "userId";

    private final MongoTemplate mongoTemplate;

    @Override
    public List<SurveyResponse> findForSurvey(String surveyId, String participantId) {
        Criteria criteria = participantId == null
                ? surveyLink(surveyId)
                : new Criteria().andOperator(surveyLink(surveyId), participantLink(participantId));
        Query query = Query.query(criteria).with(Sort.by(Sort.Direction.DESC, "createdAt"));
        return mongoTemplate.find(query, SurveyResponse.class);
    }

    @Override
    public Optional<SurveyResponse> findForSurveyAndParticipant(String surveyId, String participantId) {
        Query query = Query.query(new Criteria().andOperator(surveyLink(surveyId), participantLink(participantId)));
        return Optional.ofNullable(mongoTemplate.findOne(query, SurveyResponse.class));
    }

    @Override
    public Set<String> findAnsweredSurveyIds(String participantId) {
        Query query = Query.query(participantLink(participantId));
        query.fields().include(SURVEY_ID).include(LEGACY_SURVEY);

        Set<String> answered = new LinkedHashSet<>();
        for (SurveyResponse response : mongoTemplate.find(query, SurveyResponse.class)) {
            if (response.getSurveyId() != null) {
                answered.add(response.getSurveyId());
            }
            if (response.getLegacySurvey() != null) {
                answered.add(response.getLegacySurvey());
            }
        }
        return answered;
    }

    @Override
    public long deleteAllForSurvey(String surveyId) {
        return mongoTemplate.remove(Query.query(surveyLink(surveyId)), SurveyResponse.class).getDeletedCount();
    }

    @Override
    public long migrateLegacyReferences() {
        Criteria missingSurvey = new Criteria().andOperator(
                Criteria.where(SURVEY_ID).exists(false),
                Criteria.where(LEGACY_SURVEY).exists(true));
        Criteria missingParticipant = new Criteria().andOperator(
                Criteria.where(PARTICIPANT_ID).exists(false),
                new Criteria().orOperator(
                        Criteria.where(LEGACY_USER).exists(true),
                        Criteria.where(LEGACY_USER_ID).exists(true)));

        List<SurveyResponse> pending = mongoTemplate.find(
                Query.query(new Criteria().orOperator(missingSurvey, missingParticipant)), SurveyResponse.class);

        long migrated = 0;
        for (SurveyResponse response : pending) {
            Update update = new Update();
            if (response.getSurveyId() == null && response.resolvedSurveyId() != null) {
                update.set(SURVEY_ID, new ObjectId(response.resolvedSurveyId()));
            }
            if (response.getParticipantId() == null && response.resolvedParticipantId() != null) {
                update.set(PARTICIPANT_ID, new ObjectId(response.resolvedParticipantId()));
            }
            if (update.getUpdateObject().isEmpty()) {
                continue;
            }
            mongoTemplate.updateFirst(Query.query(Criteria.where("_id").is(new ObjectId(response.getId()))),
                    update, SurveyResponse.class);
            migrated++;
        }
        log.info("[MongoDB] Legacy response links migrated: {} of {} candidates", migrated, pending.size());
        return migrated;
    }

    private static Criteria surveyLink(String surveyId) {
        ObjectId id = new ObjectId(surveyId);
        return new Criteria().orOperator(
                Criteria.where(SURVEY_ID).is(id),
                Criteria.where(LEGACY_SURVEY).is(id));
    }

    private static Criteria participantLink(String participantId) {
        ObjectId id = new ObjectId(participantId);
        return new Criteria().orOperator(
                Criteria.where(PARTICIPANT_ID).is(id),
                Criteria.where(LEGACY_USER).is(id),
                Criteria.where(LEGACY_USER_ID).is(id));
    }
}
