package uk.gegc.questionbank.features.repair.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Entries a repair run has written into one namespace. A rebuild page only touches the counters
 * of the namespaces its rows map to.
 */
@Entity
@Table(name = "aggregate_repair_counters")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class RepairCounter {

    @EmbeddedId
    private RepairCounterId id;

    @Column(name = "expected_count", nullable = false)
    private long expectedCount;
}
