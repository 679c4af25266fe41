package uk.gegc.questionbank.features.aggregate.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateEntry;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateName;
import uk.gegc.questionbank.features.aggregate.infra.memory.InMemoryOrderedAggregateIndex;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("UserNamespaces")
class UserNamespacesTest {

    private static final AggregateName BY_THEME = AggregateName.ANSWERED_BY_THEME_BY_USER;

    private InMemoryOrderedAggregateIndex index;
    private UserNamespaces userNamespaces;

    @BeforeEach
    void setUp() {
        index = new InMemoryOrderedAggregateIndex();
        userNamespaces = new UserNamespaces(index);
        for (String namespace : List.of("a_t1", "a_t2", "a_b_t1", "a_t3", "ab_t1", "a_t4", "z_t1")) {
            index.insert(new AggregateEntry(BY_THEME, namespace, "q1", "q1"));
        }
    }

    @Test
    @DisplayName("all returns only the user's own namespaces across pages")
    void all_skipsOtherUsers() {
        assertThat(userNamespaces.all(BY_THEME, "a", 2)).containsExactly("a_t1", "a_t2", "a_t3", "a_t4");
    }

    @Test
    @DisplayName("a user whose id extends another's keeps only its own namespaces")
    void all_longerUserId() {
        assertThat(userNamespaces.all(BY_THEME, "a_b", 10)).containsExactly("a_b_t1");
        assertThat(userNamespaces.all(BY_THEME, "ab", 10)).containsExactly("ab_t1");
    }

    @Test
    @DisplayName("a page stops at the first namespace past the user's prefix")
    void page_stopsAfterPrefix() {
        UserNamespaces.Page first = userNamespaces.page(BY_THEME, "a", null, 3);

        assertThat(first.namespaces()).containsExactly("a_t1", "a_t2");
        assertThat(first.nextCursor()).isEqualTo("a_t2");
        assertThat(first.done()).isFalse();

        UserNamespaces.Page second = userNamespaces.page(BY_THEME, "a", first.nextCursor(), 3);

        assertThat(second.namespaces()).containsExactly("a_t3", "a_t4");
        assertThat(second.done()).isTrue();
    }

    @Test
    @DisplayName("a user with no entries has no namespaces")
    void all_unknownUser() {
        assertThat(userNamespaces.all(BY_THEME, "nobody", 5)).isEmpty();
    }

    @Test
    @DisplayName("the per-user level is the user id itself")
    void page_globalLevel() {
        UserNamespaces.Page page = userNamespaces.page(AggregateName.ANSWERED_BY_USER, "a", null, 5);

        assertThat(page.namespaces()).containsExactly("a");
        assertThat(page.done()).isTrue();
    }

    @Test
    @DisplayName("question aggregates are rejected")
    void page_questionAggregate() {
        assertThatThrownBy(() -> userNamespaces.page(AggregateName.QUESTIONS_BY_THEME, "a", null, 5))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
