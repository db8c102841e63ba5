package com.viffx.Parsers.Analysis;

import com.viffx.Parsers.Grammar.Symbols;
import com.viffx.Parsers.Grammars;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FirstFollowAnalyzer")
class FirstFollowAnalyzerTest {

    @Nested
    @DisplayName("on the expression grammar")
    class Expression {
        private final FirstFollowAnalyzer analyzer = new FirstFollowAnalyzer(Grammars.expression());

        @Test
        @DisplayName("FIRST of every non-terminal is { (, id }")
        void firstSets() {
            assertThat(analyzer.first("F")).containsExactlyInAnyOrder("(", "id");
            assertThat(analyzer.first("T")).isEqualTo(analyzer.first("F"));
            assertThat(analyzer.first("E")).isEqualTo(analyzer.first("F"));
        }

        @Test
        @DisplayName("FOLLOW(E) is { +, ), $ }")
        void followSets() {
            assertThat(analyzer.follow("E")).containsExactlyInAnyOrder("+", ")", Symbols.EOF);
            assertThat(analyzer.follow("T")).containsExactlyInAnyOrder("+", "*", ")", Symbols.EOF);
            assertThat(analyzer.follow("F")).isEqualTo(analyzer.follow("T"));
        }

        @Test
        @DisplayName("terminals and the end marker are their own FIRST set")
        void firstOfTerminals() {
            assertThat(analyzer.first("id")).containsExactly("id");
            assertThat(analyzer.first(Symbols.EOF)).containsExactly(Symbols.EOF);
            assertThat(analyzer.isNullable("E")).isFalse();
        }

        @Test
        @DisplayName("exposes unmodifiable copies")
        void copiesAreUnmodifiable() {
            assertThat(analyzer.followSets()).containsOnlyKeys("E", "T", "F");
            assertThatThrownBy(() -> analyzer.firstSets().get("E").add("x"))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("with nullable symbols")
    class Nullable {
        private final FirstFollowAnalyzer analyzer = new FirstFollowAnalyzer(Grammars.parse("""
                S -> A B
                A -> a | ε
                B -> b | ε
                """));

        @Test
        @DisplayName("FIRST carries ε when everything can vanish")
        void firstWithEpsilon() {
            assertThat(analyzer.first("S")).containsExactlyInAnyOrder("a", "b", Symbols.EPSILON);
            assertThat(analyzer.isNullable("S")).isTrue();
        }

        @Test
        @DisplayName("FOLLOW looks through nullable suffixes")
        void followThroughNullable() {
            assertThat(analyzer.follow("A")).containsExactlyInAnyOrder("b", Symbols.EOF);
            assertThat(analyzer.follow("B")).containsExactly(Symbols.EOF);
        }

        @Test
        @DisplayName("FIRST of a sequence stops at the first symbol that cannot vanish")
        void firstOfSequence() {
            assertThat(analyzer.first(List.of())).containsExactly(Symbols.EPSILON);
            assertThat(analyzer.first(List.of("A", "B"))).containsExactlyInAnyOrder("a", "b", Symbols.EPSILON);
            assertThat(analyzer.first(List.of("A", "c", "B"))).containsExactlyInAnyOrder("a", "c");
            assertThat(analyzer.isNullable(List.of("A", "c"))).isFalse();
        }
    }
}
