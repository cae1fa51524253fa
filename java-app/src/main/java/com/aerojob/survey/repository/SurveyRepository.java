package com.aerojob.survey.repository;

import com.aerojob.survey.model.Survey;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SurveyRepository extends MongoRepository<Survey, String>, SurveyRepositoryCustom {

    /**
     * Surveys whose status and audience match the given case-insensitive patterns.
     * A survey without an audience field is open to everyone.
     */
    @Query("{'status': {$regex: ?0, $options: 'i'}, "
            + "$or: [{'audience': {$regex: ?1, $options: 'i'}}, {'audience': null}]}")
    List<Survey> findByStatusAndAudienceMatching(String statusPattern, String audiencePattern, Sort sort);
}
