package uk.gegc.questionbank.features.repair.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateName;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Durable handle of one repair run. Every committed page advances the cursors stored here and
 * the run's {@link RepairCounter} rows, so a run can be resumed from the last page it committed.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "aggregate_repair_runs", indexes = @Index(name = "idx_repair_runs_state", columnList = "state"))
public class RepairRun {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "target", nullable = false, length = 20)
    private RepairTarget target;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 20)
    private RepairState state;

    /** Owner of the aggregates a {@link RepairTarget#USER} run rebuilds; null for other targets. */
    @Column(name = "user_id", length = 128)
    private String userId;

    /** Aggregate being cleared; null once clearing is over. */
    @Enumerated(EnumType.STRING)
    @Column(name = "clear_aggregate", length = 64)
    private AggregateName clearAggregate;

    /** Last namespace cleared in {@link #clearAggregate}. */
    @Column(name = "clear_cursor", length = 191)
    private String clearCursor;

    @Enumerated(EnumType.STRING)
    @Column(name = "current_table", length = 20)
    private RepairTable currentTable;

    /** Id of the last row rebuilt from {@link #currentTable}. */
    @Column(name = "last_cursor", length = 64)
    private String lastCursor;

    @Column(name = "pages_processed", nullable = false)
    private long pagesProcessed;

    @Column(name = "rows_processed", nullable = false)
    private long rowsProcessed;

    @Column(name = "mismatch_count", nullable = false)
    private long mismatchCount;

    @Lob
    @Convert(converter = RepairMismatchesConverter.class)
    @Column(name = "mismatches")
    private List<RepairMismatch> mismatches = new ArrayList<>();

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "cancel_requested", nullable = false)
    private boolean cancelRequested;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Version
    @Column(name = "version")
    private Long version;

    public void fail(String message, Instant at) {
        this.state = RepairState.FAILED;
        this.errorMessage = message == null ? null : message.substring(0, Math.min(message.length(), 2000));
        this.completedAt = at;
        this.updatedAt = at;
    }
}
