package com.ledgerlens.backend.services.statements.categorization;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ledgerlens.backend.entities.Category;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * One element of the model's categorization answer. {@code sub_category} must be present
 * but may be empty for categories without children. Names longer than the category
 * column are rejected so the batch is retried rather than failing at save time.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CategoryAssignment(
        @NotBlank @Size(max = Category.NAME_MAX_LENGTH) @JsonProperty("category") String category,
        @NotNull @Size(max = Category.NAME_MAX_LENGTH) @JsonProperty("sub_category") String subCategory
) {
}
