package uk.gegc.questionbank.features.taxonomy.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

/**
 * Finest taxonomy level. A group always belongs to a subtheme.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "question_groups", indexes = @Index(name = "idx_question_groups_subtheme", columnList = "subtheme_id"))
public class QuestionGroup {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "group_id")
    private UUID id;

    @Column(name = "group_name", nullable = false)
    private String name;

    @Column(name = "subtheme_id", nullable = false)
    private UUID subthemeId;
}
