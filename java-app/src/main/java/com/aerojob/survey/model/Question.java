package com.aerojob.survey.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Field;
import org.springframework.data.mongodb.core.mapping.FieldType;

import java.util.ArrayList;
import java.util.List;

/**
 * Question embedded in a {@link Survey}. The id is assigned once and kept across edits,
 * since stored answers reference it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Question {

    @Id
    @Field(targetType = FieldType.OBJECT_ID)
    private String id;

    private String text;

    /** Stored in its wire form, e.g. {@code multiple_choice}. */
    private String type;

    private boolean required;

    @Builder.Default
    private List<String> options = new ArrayList<>();

    public QuestionType questionType() {
        return QuestionType.fold(type);
    }
}
