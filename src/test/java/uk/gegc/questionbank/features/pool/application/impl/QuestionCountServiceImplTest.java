package uk.gegc.questionbank.features.pool.application.impl;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.questionbank.features.aggregate.application.AggregateMetrics;
import uk.gegc.questionbank.features.aggregate.application.NamespaceRegistry;
import uk.gegc.questionbank.features.aggregate.application.impl.AggregateSyncServiceImpl;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateSource;
import uk.gegc.questionbank.features.aggregate.domain.model.IndexedRecord;
import uk.gegc.questionbank.features.aggregate.infra.memory.InMemoryOrderedAggregateIndex;
import uk.gegc.questionbank.features.pool.domain.model.DescriptorCount;
import uk.gegc.questionbank.features.scope.application.impl.ScopeResolverImpl;
import uk.gegc.questionbank.features.scope.domain.model.FilterMode;
import uk.gegc.questionbank.features.scope.domain.model.ResolvedScope;
import uk.gegc.questionbank.features.scope.domain.model.ScopeSelection;
import uk.gegc.questionbank.testsupport.InMemoryTaxonomy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("QuestionCountServiceImpl")
class QuestionCountServiceImplTest {

    private final List<IndexedRecord> questions = new ArrayList<>();
    private AggregateSyncServiceImpl syncService;
    private ScopeResolverImpl resolver;
    private QuestionCountServiceImpl countService;

    /**
     * Theme T: 6 questions outside any subtheme, subtheme S with 2 ungrouped and group G with 2.
     * Theme U: subtheme V with 3 questions in group H.
     */
    @BeforeEach
    void setUp() {
        InMemoryOrderedAggregateIndex index = new InMemoryOrderedAggregateIndex();
        NamespaceRegistry namespaceRegistry = new NamespaceRegistry();
        syncService = new AggregateSyncServiceImpl(index, namespaceRegistry,
                new AggregateMetrics(new SimpleMeterRegistry()));
        InMemoryTaxonomy taxonomy = new InMemoryTaxonomy()
                .subtheme("S", "T")
                .subtheme("V", "U")
                .group("G", "S")
                .group("H", "V");
        resolver = new ScopeResolverImpl(taxonomy, namespaceRegistry);
        countService = new QuestionCountServiceImpl(index, resolver);

        addQuestions("t", 6, "T", null, null);
        addQuestions("s", 2, "T", "S", null);
        addQuestions("g", 2, "T", "S", "G");
        addQuestions("h", 3, "U", "V", "H");
    }

    @Test
    @DisplayName("theme selection counts every question of the theme")
    void themeSelection_countsWholeTheme() {
        assertThat(count(ScopeSelection.of(List.of("T"), null, null), FilterMode.ALL, null)).isEqualTo(10);
    }

    @Test
    @DisplayName("subtheme plus its group counts group members and the ungrouped remainder once")
    void subthemeAndGroup_countsEachQuestionOnce() {
        assertThat(count(ScopeSelection.of(null, List.of("S"), List.of("G")), FilterMode.ALL, null)).isEqualTo(4);
    }

    @Test
    @DisplayName("theme with one of its subthemes counts only the subtheme")
    void themeAndSubtheme_countsSubthemeOnly() {
        assertThat(count(ScopeSelection.of(List.of("T"), List.of("S"), null), FilterMode.ALL, null)).isEqualTo(4);
    }

    @Test
    @DisplayName("empty selection counts the whole bank and unknown groups count zero")
    void globalAndUnknown() {
        assertThat(count(ScopeSelection.everything(), FilterMode.ALL, null)).isEqualTo(13);
        assertThat(count(ScopeSelection.of(null, null, List.of("nonexistent-group")), FilterMode.ALL, null)).isZero();
    }

    @Test
    @DisplayName("descriptor counts sum to a recount of the covered questions")
    void breakdown_sumsToRecount() {
        ScopeSelection selection = ScopeSelection.of(List.of("T", "U"), List.of("S"), List.of("G", "H"));
        ResolvedScope scope = resolver.resolve(selection, FilterMode.ALL, null);

        List<DescriptorCount> breakdown = countService.breakdown(scope);
        long sum = breakdown.stream().mapToLong(DescriptorCount::count).sum();

        // T is replaced by S (G plus remainder), U by V's implied group H
        long recount = questions.stream()
                .filter(q -> "S".equals(q.subthemeId()) || "H".equals(q.groupId()))
                .count();
        assertThat(sum).isEqualTo(recount).isEqualTo(7);
        assertThat(countService.count(scope)).isEqualTo(sum);
    }

    @Test
    @DisplayName("countAllModes derives unanswered from total minus answered")
    void countAllModes_forUser() {
        answer("u1", "t0", "T", null, null);
        answer("u1", "g0", "T", "S", "G");
        fact(AggregateSource.INCORRECT, "u1", "g0", "T", "S", "G");
        fact(AggregateSource.BOOKMARKED, "u1", "h0", "U", "V", "H");
        fact(AggregateSource.BOOKMARKED, "u2", "t1", "T", null, null);

        Map<FilterMode, Long> theme = countService.countAllModes(ScopeSelection.of(List.of("T"), null, null), "u1");

        assertThat(theme).containsEntry(FilterMode.ALL, 10L)
                .containsEntry(FilterMode.UNANSWERED, 8L)
                .containsEntry(FilterMode.INCORRECT, 1L)
                .containsEntry(FilterMode.BOOKMARKED, 0L);
        assertThat(countService.countAllModes(ScopeSelection.everything(), "u1"))
                .containsEntry(FilterMode.BOOKMARKED, 1L)
                .containsEntry(FilterMode.UNANSWERED, 11L);
    }

    @Test
    @DisplayName("anonymous callers only get the ALL count")
    void countAllModes_anonymous() {
        Map<FilterMode, Long> counts = countService.countAllModes(ScopeSelection.everything(), null);

        assertThat(counts).containsOnlyKeys(FilterMode.ALL);
        assertThat(counts.get(FilterMode.ALL)).isEqualTo(13L);
    }

    private long count(ScopeSelection selection, FilterMode mode, String userId) {
        return countService.count(resolver.resolve(selection, mode, userId));
    }

    private void addQuestions(String prefix, int n, String theme, String subtheme, String group) {
        for (int i = 0; i < n; i++) {
            IndexedRecord record = IndexedRecord.question(prefix + i, theme, subtheme, group);
            questions.add(record);
            syncService.onCreated(record);
        }
    }

    private void answer(String userId, String questionId, String theme, String subtheme, String group) {
        fact(AggregateSource.ANSWERED, userId, questionId, theme, subtheme, group);
    }

    private void fact(AggregateSource source, String userId, String questionId,
                      String theme, String subtheme, String group) {
        syncService.onCreated(IndexedRecord.fact(source, userId, questionId, theme, subtheme, group));
    }
}
