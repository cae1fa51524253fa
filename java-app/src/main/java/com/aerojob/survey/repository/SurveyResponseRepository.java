package com.aerojob.survey.repository;

import com.aerojob.survey.model.SurveyResponse;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SurveyResponseRepository
        extends MongoRepository<SurveyResponse, String>, SurveyResponseRepositoryCustom {
}
