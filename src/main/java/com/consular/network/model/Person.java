package com.consular.network.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A registered person (consular profile)")
public class Person {

    @Schema(description = "Unique person identifier", example = "PER-0001")
    private String personId;

    @Schema(description = "First name", example = "Marie")
    private String firstName;

    @Schema(description = "Last name", example = "Nguema")
    private String lastName;

    @Schema(description = "Contact address city, if known", example = "Paris")
    private String city;

    @Schema(description = "Creation timestamp in epoch milliseconds", example = "1739886764000")
    private long createdAt;

    /**
     * "Lastname Firstname", falling back to the person id when both names are blank.
     */
    public String getDisplayName() {
        String last = lastName != null ? lastName.trim() : "";
        String first = firstName != null ? firstName.trim() : "";
        String name = (last + " " + first).trim();
        return name.isEmpty() ? personId : name;
    }
}
