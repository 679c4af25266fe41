package uk.gegc.questionbank.features.monitoring.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateName;

@Schema(description = "Index count of an aggregate compared with a recount from the primary store")
public record CountCheckDto(
        AggregateName aggregate,
        @Schema(description = "Namespace checked, or the user id when all namespaces of a user are summed")
        String scope,
        long indexed,
        long stored,
        boolean match
) {

    public static CountCheckDto of(AggregateName aggregate, String scope, long indexed, long stored) {
        return new CountCheckDto(aggregate, scope, indexed, stored, indexed == stored);
    }
}
