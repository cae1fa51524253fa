package com.aerojob.survey.dto;

import com.aerojob.survey.model.Participant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ParticipantSummary {
    String id;
    String firstName;
    String lastName;
    String name;
    String email;
    String role;

    public static ParticipantSummary from(Participant participant) {
        return ParticipantSummary.builder()
                .id(participant.getId())
                .firstName(participant.getFirstName())
                .lastName(participant.getLastName())
                .name(participant.displayName())
                .email(participant.getEmail())
                .role(participant.roleName())
                .build();
    }
}
