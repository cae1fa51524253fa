package com.aerojob.survey.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Read-only view of the account collection, used to label responses.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "users")
public class Participant {

    @Id
    private String id;

    private String firstName;
    private String lastName;
    private String email;
    private String userType;

    /** Legacy accounts store the role here instead of {@code userType}. */
    private String role;

    public String displayName() {
        StringBuilder name = new StringBuilder();
        if (firstName != null && !firstName.isBlank()) {
            name.append(firstName.trim());
        }
        if (lastName != null && !lastName.isBlank()) {
            if (name.length() > 0) {
                name.append(' ');
            }
            name.append(lastName.trim());
        }
        return name.toString();
    }

    public String roleName() {
        if (userType != null && !userType.isBlank()) {
            return userType;
        }
        return role != null ? role : "";
    }
}
