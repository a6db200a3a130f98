package com.tessera.search.rules;

import com.tessera.search.api.exceptions.ErrorCode;
import com.tessera.search.api.exceptions.UserErrorException;
import com.tessera.search.api.index.InMemoryIndex;
import com.tessera.search.api.model.SortCriterion;
import com.tessera.search.api.model.TermsMatchingStrategy;
import com.tessera.search.filter.FilterCompiler;
import com.tessera.search.query.QueryGraph;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RankingRuleFactoryTest {

    private final RankingRuleFactory factory = new RankingRuleFactory(new FilterCompiler());

    private static InMemoryIndex index(String... rules) {
        return InMemoryIndex.builder()
            .searchableFields("title")
            .filterableFields("genre")
            .sortableFields("year", "rank")
            .rankingRules(rules)
            .addDocument(1, Map.of("title", "a", "year", 2000, "rank", 1, "genre", "horror"))
            .build();
    }

    @Test
    @DisplayName("Should insert words before the first graph rule and ignore repeated settings")
    void shouldInsertWordsAndDeduplicate() {
        InMemoryIndex index = index("typo", "proximity", "typo", "exactness");

        List<RankingRule<QueryGraph>> rules =
            factory.queryRules(index, List.of(), TermsMatchingStrategy.LAST);

        assertThat(rules).extracting(RankingRule::id)
            .containsExactly("words", "typo", "proximity", "exactness");
    }

    @Test
    @DisplayName("Should expand the sort setting into one rule per sort criterion")
    void shouldExpandSortSetting() {
        InMemoryIndex index = index("words", "sort", "attribute");

        var rules = factory.queryRules(index,
            List.of(SortCriterion.parse("year:desc"), SortCriterion.parse("rank:asc")), TermsMatchingStrategy.ALL);

        assertThat(rules).extracting(RankingRule::id)
            .containsExactly("words", "desc(year)", "asc(rank)", "attribute");
    }

    @Test
    @DisplayName("Should keep only query-independent rules for placeholder searches")
    void shouldKeepQueryIndependentRulesForPlaceholder() {
        InMemoryIndex index = index("words", "boost:genre = horror", "typo", "sort", "desc(rank)", "proximity");

        var rules = factory.placeholderRules(index, List.of(SortCriterion.parse("year:asc")));

        assertThat(rules).extracting(RankingRule::id)
            .containsExactly("boost:genre = horror", "asc(year)", "desc(rank)");
    }

    @Test
    @DisplayName("Should reject a sort request when the settings have no sort rule")
    void shouldRejectSortWithoutSortRule() {
        InMemoryIndex index = index("words", "typo");

        assertThatThrownBy(() -> factory.queryRules(index, List.of(SortCriterion.parse("year:asc")),
            TermsMatchingStrategy.LAST))
            .isInstanceOf(UserErrorException.class)
            .extracting(e -> ((UserErrorException) e).code())
            .isEqualTo(ErrorCode.SORT_RANKING_RULE_MISSING);
    }

    @Test
    @DisplayName("Should reject sorting on a field that is not sortable")
    void shouldRejectUnsortableField() {
        InMemoryIndex index = index("words", "sort");

        assertThatThrownBy(() -> factory.placeholderRules(index, List.of(SortCriterion.parse("title:asc"))))
            .isInstanceOf(UserErrorException.class)
            .hasMessageContaining("title")
            .extracting(e -> ((UserErrorException) e).code())
            .isEqualTo(ErrorCode.ATTRIBUTE_NOT_SORTABLE);
    }

    @Test
    @DisplayName("Should reject an asc setting on a field that is not sortable")
    void shouldRejectUnsortableSetting() {
        InMemoryIndex index = index("words", "asc(genre)");

        assertThatThrownBy(() -> factory.queryRules(index, List.of(), TermsMatchingStrategy.LAST))
            .isInstanceOf(UserErrorException.class)
            .extracting(e -> ((UserErrorException) e).code())
            .isEqualTo(ErrorCode.ATTRIBUTE_NOT_SORTABLE);
    }
}
