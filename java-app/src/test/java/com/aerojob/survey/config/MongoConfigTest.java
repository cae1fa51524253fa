package com.aerojob.survey.config;

import com.aerojob.survey.model.Survey;
import com.aerojob.survey.model.SurveyResponse;
import com.aerojob.survey.repository.SurveyResponseRepository;
import org.bson.Document;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.IndexDefinition;
import org.springframework.data.mongodb.core.index.IndexOperations;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("MongoConfig")
class MongoConfigTest {

    @Mock
    private MongoTemplate mongoTemplate;

    @Mock
    private SurveyResponseRepository responseRepository;

    @Mock
    private IndexOperations responseIndexOps;

    @Mock
    private IndexOperations surveyIndexOps;

    private void indexOperationsAvailable() {
        given(mongoTemplate.indexOps(SurveyResponse.class)).willReturn(responseIndexOps);
        given(mongoTemplate.indexOps(Survey.class)).willReturn(surveyIndexOps);
    }

    private List<IndexDefinition> responseIndexes() {
        ArgumentCaptor<IndexDefinition> index = ArgumentCaptor.forClass(IndexDefinition.class);
        verify(responseIndexOps, times(2)).ensureIndex(index.capture());
        return index.getAllValues();
    }

    @Test
    @DisplayName("one response per participant, ignoring documents without a participant")
    void responseIndexIsUniqueAndPartial() {
        indexOperationsAvailable();

        new MongoConfig(mongoTemplate, responseRepository, true).prepareCollections();

        IndexDefinition unique = responseIndexes().get(0);
        Document options = unique.getIndexOptions();
        assertThat(unique.getIndexKeys()).isEqualTo(new Document("surveyId", 1).append("participantId", 1));
        assertThat(options.get("unique")).isEqualTo(true);
        assertThat(options.get("name")).isEqualTo(MongoConfig.RESPONSE_UNIQUE_INDEX);
        assertThat(options.get("partialFilterExpression"))
                .isEqualTo(new Document("participantId", new Document("$exists", true)));
    }

    @Test
    void participantAndSurveyListingIndexes() {
        indexOperationsAvailable();

        new MongoConfig(mongoTemplate, responseRepository, true).prepareCollections();

        assertThat(responseIndexes().get(1).getIndexKeys()).isEqualTo(new Document("participantId", 1));
        ArgumentCaptor<IndexDefinition> surveyIndex = ArgumentCaptor.forClass(IndexDefinition.class);
        verify(surveyIndexOps).ensureIndex(surveyIndex.capture());
        assertThat(surveyIndex.getValue().getIndexKeys())
                .isEqualTo(new Document("status", 1).append("audience", 1).append("createdAt", -1));
    }

    @Test
    @DisplayName("legacy links are migrated before the unique index is built")
    void migrationRunsBeforeIndexes() {
        indexOperationsAvailable();

        new MongoConfig(mongoTemplate, responseRepository, true).prepareCollections();

        InOrder order = inOrder(responseRepository, responseIndexOps);
        order.verify(responseRepository).migrateLegacyReferences();
        order.verify(responseIndexOps, times(2)).ensureIndex(any(IndexDefinition.class));
    }

    @Test
    void migrationCanBeSwitchedOff() {
        indexOperationsAvailable();

        new MongoConfig(mongoTemplate, responseRepository, false).prepareCollections();

        verify(responseRepository, never()).migrateLegacyReferences();
        verify(responseIndexOps, times(2)).ensureIndex(any(IndexDefinition.class));
    }

    @Test
    @DisplayName("an index that cannot be built stops startup")
    void indexFailureIsFatal() {
        given(mongoTemplate.indexOps(SurveyResponse.class)).willReturn(responseIndexOps);
        given(responseIndexOps.ensureIndex(any(IndexDefinition.class)))
                .willThrow(new IllegalArgumentException("E11000 duplicate key error"));
        MongoConfig config = new MongoConfig(mongoTemplate, responseRepository, true);

        assertThatThrownBy(config::prepareCollections)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Failed to create MongoDB indexes for surveys")
                .hasCauseInstanceOf(IllegalArgumentException.class);
        verify(responseRepository).migrateLegacyReferences();
    }
}
