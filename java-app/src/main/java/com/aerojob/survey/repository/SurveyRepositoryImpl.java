package com.aerojob.survey.repository;

import com.aerojob.survey.dto.SurveyFilter;
import com.aerojob.survey.model.Survey;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.regex.Pattern;

@RequiredArgsConstructor
public class SurveyRepositoryImpl implements SurveyRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public List<Survey> search(SurveyFilter filter) {
        Query query = new Query();
        if (StringUtils.hasText(filter.getStatus())) {
            query.addCriteria(Criteria.where("status")
                    .regex("^" + Pattern.quote(filter.getStatus().trim()) + "$", "i"));
        }
        if (StringUtils.hasText(filter.getTitleQuery())) {
            query.addCriteria(Criteria.where("title")
                    .regex(Pattern.quote(filter.getTitleQuery().trim()), "i"));
        }
        query.with(Sort.by(Sort.Direction.DESC, "createdAt"));
        return mongoTemplate.find(query, Survey.class);
    }
}
