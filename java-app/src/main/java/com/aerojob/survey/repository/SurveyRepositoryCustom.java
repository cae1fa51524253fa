package com.aerojob.survey.repository;

import com.aerojob.survey.dto.SurveyFilter;
import com.aerojob.survey.model.Survey;

import java.util.List;

public interface SurveyRepositoryCustom {

    /** Newest first. */
    List<Survey> search(SurveyFilter filter);
}
