package uk.gegc.questionbank.features.question.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import uk.gegc.questionbank.features.aggregate.domain.model.IndexedRecord;

import java.time.Instant;
import java.util.UUID;

@Entity
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "questions", indexes = {
        @Index(name = "idx_questions_theme", columnList = "theme_id"),
        @Index(name = "idx_questions_subtheme", columnList = "subtheme_id"),
        @Index(name = "idx_questions_group", columnList = "group_id")
})
public class Question {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "question", nullable = false, length = 1000)
    private String questionText;

    @Column(name = "theme_id", nullable = false)
    private UUID themeId;

    @Column(name = "subtheme_id")
    private UUID subthemeId;

    @Column(name = "group_id")
    private UUID groupId;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false, nullable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public IndexedRecord toIndexedRecord() {
        return IndexedRecord.question(id.toString(), asString(themeId), asString(subthemeId), asString(groupId));
    }

    private static String asString(UUID id) {
        return id == null ? null : id.toString();
    }
}
