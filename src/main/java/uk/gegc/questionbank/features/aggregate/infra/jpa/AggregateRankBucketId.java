package uk.gegc.questionbank.features.aggregate.infra.jpa;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateName;

import java.io.Serializable;

@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
public class AggregateRankBucketId implements Serializable {

    @Enumerated(EnumType.STRING)
    @Column(name = "aggregate_name", length = 64)
    private AggregateName aggregate;

    @Column(name = "namespace", length = 191)
    private String namespace;

    @Column(name = "bucket", length = 8)
    private String bucket;
}
