package uk.gegc.questionbank.features.scope.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import uk.gegc.questionbank.features.aggregate.application.NamespaceRegistry;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateName;
import uk.gegc.questionbank.features.aggregate.domain.model.TaxonomyLevel;
import uk.gegc.questionbank.features.scope.domain.model.AggregateTarget;
import uk.gegc.questionbank.features.scope.domain.model.FilterMode;
import uk.gegc.questionbank.features.scope.domain.model.ResolvedScope;
import uk.gegc.questionbank.features.scope.domain.model.ScopeDescriptor;
import uk.gegc.questionbank.features.scope.domain.model.ScopeNode;
import uk.gegc.questionbank.features.scope.domain.model.ScopeSelection;
import uk.gegc.questionbank.shared.exception.ValidationException;
import uk.gegc.questionbank.testsupport.InMemoryTaxonomy;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ScopeResolverImpl")
class ScopeResolverImplTest {

    private ScopeResolverImpl resolver;

    @BeforeEach
    void setUp() {
        InMemoryTaxonomy taxonomy = new InMemoryTaxonomy()
                .subtheme("S1", "T1")
                .subtheme("S2", "T1")
                .subtheme("S3", "T2")
                .group("G1", "S1")
                .group("G2", "S1")
                .group("G3", "S2");
        resolver = new ScopeResolverImpl(taxonomy, new NamespaceRegistry());
    }

    @Nested
    @DisplayName("resolveNodes")
    class ResolveNodes {

        @Test
        @DisplayName("empty selection resolves to the global node")
        void emptySelection_isGlobal() {
            assertThat(resolver.resolveNodes(ScopeSelection.everything())).containsExactly(ScopeNode.GLOBAL);
            assertThat(resolver.resolveNodes(null)).containsExactly(ScopeNode.GLOBAL);
        }

        @Test
        @DisplayName("a theme alone resolves to its theme node")
        void themeOnly() {
            List<ScopeNode> nodes = resolver.resolveNodes(ScopeSelection.of(List.of("T1"), null, null));

            assertThat(nodes).containsExactly(new ScopeNode(TaxonomyLevel.THEME, "T1"));
        }

        @Test
        @DisplayName("selecting a theme and one of its subthemes suppresses the theme")
        void themeAndSubtheme_subthemeOverridesTheme() {
            List<ScopeNode> nodes = resolver.resolveNodes(ScopeSelection.of(List.of("T1"), List.of("S1"), null));

            assertThat(nodes).containsExactly(new ScopeNode(TaxonomyLevel.SUBTHEME, "S1"));
        }

        @Test
        @DisplayName("upper-case UUIDs resolve like the stored lower-case form")
        void upperCaseUuids_matchStoredIds() {
            String themeId = "f4cd8fdf-2d0a-4b8e-9a51-3c1f0e6f7a10";
            String subthemeId = "41670e92-8b3c-4f62-a7d4-0b9e5c2d1f33";
            ScopeResolverImpl uuidResolver = new ScopeResolverImpl(
                    new InMemoryTaxonomy().subtheme(subthemeId, themeId), new NamespaceRegistry());

            List<ScopeNode> nodes = uuidResolver.resolveNodes(ScopeSelection.of(
                    List.of(themeId.toUpperCase()), List.of(subthemeId.toUpperCase()), null));

            assertThat(nodes).containsExactly(new ScopeNode(TaxonomyLevel.SUBTHEME, subthemeId));
        }

        @Test
        @DisplayName("explicit subtheme with a selected group splits into group plus ungrouped remainder")
        void subthemeAndGroup_splitsIntoGroupAndRemainder() {
            List<ScopeNode> nodes = resolver.resolveNodes(ScopeSelection.of(null, List.of("S1"), List.of("G1")));

            assertThat(nodes).containsExactly(
                    new ScopeNode(TaxonomyLevel.GROUP, "G1"),
                    new ScopeNode(TaxonomyLevel.SUBTHEME_UNGROUPED, "S1"));
        }

        @Test
        @DisplayName("a group alone implies its subtheme but never the ungrouped remainder")
        void groupOnly_noRemainder() {
            List<ScopeNode> nodes = resolver.resolveNodes(ScopeSelection.of(null, null, List.of("G1")));

            assertThat(nodes).containsExactly(new ScopeNode(TaxonomyLevel.GROUP, "G1"));
        }

        @Test
        @DisplayName("a group implies its subtheme, which suppresses the selected theme")
        void themeAndGroup_impliedSubthemeSuppressesTheme() {
            List<ScopeNode> nodes = resolver.resolveNodes(ScopeSelection.of(List.of("T1", "T2"), null, List.of("G3")));

            assertThat(nodes).containsExactly(
                    new ScopeNode(TaxonomyLevel.GROUP, "G3"),
                    new ScopeNode(TaxonomyLevel.THEME, "T2"));
        }

        @Test
        @DisplayName("unknown ids still resolve and never suppress anything")
        void unknownIds_resolveToOwnNodes() {
            List<ScopeNode> nodes = resolver.resolveNodes(
                    ScopeSelection.of(List.of("T1"), List.of("nope"), List.of("ghost")));

            assertThat(nodes).containsExactly(
                    new ScopeNode(TaxonomyLevel.SUBTHEME, "nope"),
                    new ScopeNode(TaxonomyLevel.GROUP, "ghost"),
                    new ScopeNode(TaxonomyLevel.THEME, "T1"));
        }

        @Test
        @DisplayName("nodes never repeat when ids are supplied twice")
        void duplicates_areCollapsed() {
            List<ScopeNode> nodes = resolver.resolveNodes(
                    ScopeSelection.of(List.of("T2", "T2"), List.of("S1", " S1 "), List.of("G1", "G2", "G1")));

            assertThat(nodes).doesNotHaveDuplicates();
            assertThat(nodes).containsExactly(
                    new ScopeNode(TaxonomyLevel.GROUP, "G1"),
                    new ScopeNode(TaxonomyLevel.GROUP, "G2"),
                    new ScopeNode(TaxonomyLevel.SUBTHEME_UNGROUPED, "S1"),
                    new ScopeNode(TaxonomyLevel.THEME, "T2"));
        }
    }

    @Nested
    @DisplayName("resolve")
    class Resolve {

        @Test
        @DisplayName("ALL reads question aggregates without a user")
        void all_readsQuestionAggregates() {
            ResolvedScope scope = resolver.resolve(ScopeSelection.of(null, List.of("S1"), List.of("G1")),
                    FilterMode.ALL, null);

            assertThat(scope.descriptors()).extracting(ScopeDescriptor::target).containsExactly(
                    new AggregateTarget(AggregateName.QUESTIONS_BY_GROUP, "G1"),
                    new AggregateTarget(AggregateName.QUESTIONS_BY_SUBTHEME_UNGROUPED, "S1"));
            assertThat(scope.descriptors()).noneMatch(ScopeDescriptor::hasExclusion);
        }

        @Test
        @DisplayName("UNANSWERED pairs each question namespace with the user's answered namespace")
        void unanswered_addsExclusion() {
            ResolvedScope scope = resolver.resolve(ScopeSelection.of(List.of("T1"), null, null),
                    FilterMode.UNANSWERED, "u1");

            ScopeDescriptor descriptor = scope.descriptors().get(0);
            assertThat(descriptor.target()).isEqualTo(new AggregateTarget(AggregateName.QUESTIONS_BY_THEME, "T1"));
            assertThat(descriptor.exclusion())
                    .isEqualTo(new AggregateTarget(AggregateName.ANSWERED_BY_THEME_BY_USER, "u1_T1"));
        }

        @Test
        @DisplayName("INCORRECT over everything reads the user's global namespace")
        void incorrect_global() {
            ResolvedScope scope = resolver.resolve(ScopeSelection.everything(), FilterMode.INCORRECT, "u1");

            assertThat(scope.descriptors()).extracting(ScopeDescriptor::target)
                    .containsExactly(new AggregateTarget(AggregateName.INCORRECT_BY_USER, "u1"));
        }

        @Test
        @DisplayName("BOOKMARKED over a group reads the composite namespace")
        void bookmarked_group() {
            ResolvedScope scope = resolver.resolve(ScopeSelection.of(null, null, List.of("G2")),
                    FilterMode.BOOKMARKED, "u1");

            assertThat(scope.descriptors()).extracting(ScopeDescriptor::target)
                    .containsExactly(new AggregateTarget(AggregateName.BOOKMARKED_BY_GROUP_BY_USER, "u1_G2"));
        }

        @Test
        @DisplayName("user-scoped modes without a user are rejected")
        void userModeWithoutUser_throws() {
            assertThatThrownBy(() -> resolver.resolve(ScopeSelection.everything(), FilterMode.UNANSWERED, null))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> resolver.resolve(ScopeSelection.everything(), FilterMode.BOOKMARKED, " "))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("taxonomy ids containing the namespace delimiter are rejected for user modes")
        void delimiterInTaxonomyId_throws() {
            assertThatThrownBy(() -> resolver.resolve(ScopeSelection.of(List.of("bad_id"), null, null),
                    FilterMode.INCORRECT, "u1"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("bad_id");
        }
    }
}
