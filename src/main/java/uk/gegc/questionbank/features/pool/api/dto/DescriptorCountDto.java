package uk.gegc.questionbank.features.pool.api.dto;

import uk.gegc.questionbank.features.aggregate.domain.model.TaxonomyLevel;
import uk.gegc.questionbank.features.pool.domain.model.DescriptorCount;

public record DescriptorCountDto(TaxonomyLevel level, String taxonomyId, long count) {

    public static DescriptorCountDto from(DescriptorCount descriptorCount) {
        return new DescriptorCountDto(
                descriptorCount.descriptor().node().level(),
                descriptorCount.descriptor().node().taxonomyId(),
                descriptorCount.count());
    }
}
