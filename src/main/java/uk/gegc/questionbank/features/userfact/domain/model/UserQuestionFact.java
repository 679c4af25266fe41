package uk.gegc.questionbank.features.userfact.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import uk.gegc.questionbank.features.aggregate.domain.model.IndexedRecord;

import java.time.Instant;
import java.util.UUID;

/**
 * A single fact about a user and a question. The question's taxonomy is copied onto the fact so
 * that user-scoped aggregates can be keyed without a join.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "user_question_facts",
        uniqueConstraints = @UniqueConstraint(name = "uq_user_question_fact",
                columnNames = {"user_id", "question_id", "kind"}),
        indexes = {
                @Index(name = "idx_user_question_facts_question", columnList = "question_id"),
                @Index(name = "idx_user_question_facts_user", columnList = "user_id, id")
        })
public class UserQuestionFact {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, length = 128)
    private String userId;

    @Column(name = "question_id", nullable = false)
    private UUID questionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 20)
    private FactKind kind;

    @Column(name = "theme_id", nullable = false)
    private UUID themeId;

    @Column(name = "subtheme_id")
    private UUID subthemeId;

    @Column(name = "group_id")
    private UUID groupId;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false, nullable = false)
    private Instant createdAt;

    public IndexedRecord toIndexedRecord() {
        return IndexedRecord.fact(kind.getSource(), userId, questionId.toString(),
                asString(themeId), asString(subthemeId), asString(groupId));
    }

    private static String asString(UUID id) {
        return id == null ? null : id.toString();
    }
}
