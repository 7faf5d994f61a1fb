package com.eyelevel.jobrelay.dto.rules.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@Schema(description = "A DTO for adding items to one category of a tool's worker rules.")
public class AddRuleRequest {

    @NotBlank(message = "The 'category' must not be blank.")
    @Schema(description = "The rule category to extend. It must already exist and hold a list of plain values.", example = "titles_remove")
    private String category;

    @NotEmpty(message = "At least one item must be provided.")
    @Schema(description = "Items to append. Items already in the category are skipped.", example = "[\"m.\", \"j.\"]")
    private List<String> items;

    @Schema(description = "Free-text reason for the change, kept in the logs.", example = "Drop single-letter initials", nullable = true)
    private String description;
}
