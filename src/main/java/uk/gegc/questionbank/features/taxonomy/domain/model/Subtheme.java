package uk.gegc.questionbank.features.taxonomy.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

@Entity
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "subthemes", indexes = @Index(name = "idx_subthemes_theme", columnList = "theme_id"))
public class Subtheme {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "subtheme_id")
    private UUID id;

    @Column(name = "subtheme_name", nullable = false)
    private String name;

    @Column(name = "theme_id", nullable = false)
    private UUID themeId;
}
