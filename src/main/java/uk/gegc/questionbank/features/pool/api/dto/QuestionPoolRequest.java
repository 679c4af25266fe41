package uk.gegc.questionbank.features.pool.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import uk.gegc.questionbank.features.scope.domain.model.FilterMode;
import uk.gegc.questionbank.features.scope.domain.model.ScopeSelection;

import java.util.List;

@Schema(description = "Taxonomy selection and filter applied to the question pool")
public record QuestionPoolRequest(
        @Schema(description = "Selected theme ids")
        @Size(max = 200, message = "At most 200 themes can be selected")
        List<String> themeIds,

        @Schema(description = "Selected subtheme ids")
        @Size(max = 500, message = "At most 500 subthemes can be selected")
        List<String> subthemeIds,

        @Schema(description = "Selected group ids")
        @Size(max = 1000, message = "At most 1000 groups can be selected")
        List<String> groupIds,

        @Schema(description = "History filter; defaults to ALL", example = "UNANSWERED")
        FilterMode filter,

        @Schema(description = "Number of questions to sample (sample endpoint only)", example = "20",
                minimum = "1", maximum = "500")
        @Min(value = 1, message = "Count must be at least 1")
        @Max(value = 500, message = "Count must be at most 500")
        Integer count
) {

    public ScopeSelection toSelection() {
        return ScopeSelection.of(themeIds, subthemeIds, groupIds);
    }

    public FilterMode filterOrDefault() {
        return filter == null ? FilterMode.ALL : filter;
    }
}
