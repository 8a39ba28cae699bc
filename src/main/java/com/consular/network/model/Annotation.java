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
@Schema(description = "Timestamped intelligence note attached to a person. Only its existence and priority are analysed.")
public class Annotation {

    @Schema(description = "Unique annotation identifier", example = "ANN-0001")
    private String annotationId;

    @Schema(description = "Subject person id", example = "PER-0001")
    private String personId;

    @Schema(description = "Priority", example = "HIGH")
    @Builder.Default
    private AnnotationPriority priority = AnnotationPriority.LOW;

    @Schema(description = "Creation timestamp in epoch milliseconds", example = "1739886764000")
    private long createdAt;
}
