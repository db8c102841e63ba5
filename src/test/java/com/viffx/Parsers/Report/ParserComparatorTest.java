package com.viffx.Parsers.Report;

import com.viffx.Parsers.Compiler.ParserKind;
import com.viffx.Parsers.Grammars;
import com.viffx.Parsers.Utils.ParserSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ParserComparator")
class ParserComparatorTest {
    private final ParserComparator comparator = new ParserComparator(ParserSettings.defaults());

    @Nested
    @DisplayName("recommendation")
    class Recommendation {

        @Test
        @DisplayName("prefers LL(1) once the expression grammar is transformed")
        void transformed() {
            ComparisonReport report = comparator.compare(Grammars.expression(), true);

            assertThat(report.transformation()).isNotNull();
            assertThat(report.transformation().changed()).isTrue();
            assertThat(report.conflictFree()).containsExactly(ParserKind.LL1, ParserKind.SLR1, ParserKind.LALR1, ParserKind.CLR1);
            assertThat(report.best()).isEqualTo(ParserKind.LL1);
            assertThat(report.recommendation())
                    .startsWith("Use LL(1) predictive parser.")
                    .endsWith("(Also works: SLR(1), LALR(1), CLR(1))");
        }

        @Test
        @DisplayName("falls back to SLR(1) when the grammar stays left recursive")
        void untransformed() {
            ComparisonReport report = comparator.compare(Grammars.expression(), false);

            assertThat(report.transformation()).isNull();
            assertThat(report.summary(ParserKind.LL1).conflictFree()).isFalse();
            assertThat(report.conflictReports().get(ParserKind.LL1).hasConflicts()).isTrue();
            assertThat(report.best()).isEqualTo(ParserKind.SLR1);
            assertThat(report.recommendation())
                    .startsWith("Use SLR(1) parser.")
                    .endsWith("(Also works: LALR(1), CLR(1))");
        }

        @Test
        @DisplayName("recommends nothing for the dangling else")
        void danglingElse() {
            ComparisonReport report = comparator.compare(Grammars.danglingElse(), true);

            assertThat(report.conflictFree()).isEmpty();
            assertThat(report.best()).isNull();
            assertThat(report.recommendation()).isEqualTo(ParserComparator.NO_PARSER);
        }

        @Test
        @DisplayName("names no alternatives when only one parser works")
        void single() {
            assertThat(ParserComparator.recommend(ParserKind.CLR1, List.of(ParserKind.CLR1)))
                    .isEqualTo("Use CLR(1) parser. Grammar needs canonical LR parsing (most powerful but more states).");
        }
    }

    @Test
    @DisplayName("a table over the state limit fails without stopping the comparison")
    void stateLimit() {
        ComparisonReport report = new ParserComparator(ParserSettings.defaults().withMaxStates(15))
                .compare(Grammars.expression(), false);

        assertThat(report.summary(ParserKind.CLR1).built()).isFalse();
        assertThat(report.summary(ParserKind.CLR1).error()).contains("exceeded 15 states");
        assertThat(report.summary(ParserKind.LALR1).built()).isFalse();
        assertThat(report.table(ParserKind.CLR1)).isNull();
        assertThat(report.summary(ParserKind.SLR1).built()).isTrue();
        assertThat(report.best()).isEqualTo(ParserKind.SLR1);
        assertThat(report.recommendation()).doesNotContain("Also works");
    }

    @Test
    @DisplayName("summarizes table sizes")
    void summaries() {
        ComparisonReport report = comparator.compare(Grammars.expression(), false);
        ParserSummary slr = report.summary(ParserKind.SLR1);

        assertThat(slr.states()).isEqualTo(12);
        assertThat(slr.totalCells()).isEqualTo(12 * 9);
        assertThat(slr.coverage()).isBetween(0.0, 100.0);
        assertThat(report.summary(ParserKind.CLR1).states()).isGreaterThan(slr.states());
        assertThat(report.summary(ParserKind.LALR1).states()).isEqualTo(slr.states());
    }
}
