package com.viffx.Parsers.Predictive;

import com.viffx.Parsers.Analysis.FirstFollowAnalyzer;
import com.viffx.Parsers.Grammar.Grammar;
import com.viffx.Parsers.Grammar.Production;
import com.viffx.Parsers.Grammars;
import com.viffx.Parsers.Runtime.ParseResult;
import com.viffx.Parsers.Runtime.ParseStep;
import com.viffx.Parsers.Transform.GrammarTransformer;
import com.viffx.Parsers.Utils.ParserSettings;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LL(1) tables and the predictive parser")
class PredictiveParserTest {
    private static Grammar transformed;
    private static LL1ParseTable table;
    private final PredictiveParser parser = new PredictiveParser(ParserSettings.defaults());

    @BeforeAll
    static void buildTable() {
        transformed = new GrammarTransformer(Grammars.expression()).transformForLL1().transformed();
        table = new LL1ParseTableGenerator().build(transformed);
    }

    @Nested
    @DisplayName("table construction")
    class Construction {

        @Test
        @DisplayName("the transformed expression grammar is LL(1)")
        void conflictFree() {
            assertThat(table.isConflictFree()).isTrue();
            assertThat(table.filledCells()).isEqualTo(13);
            assertThat(table.totalCells()).isEqualTo(30);
            assertThat(table.production("E", "id")).isEqualTo(new Production("E", List.of("T", "E'")));
            assertThat(table.production("E'", ")")).isEqualTo(new Production("E'", List.of()));
            assertThat(table.entry("E", "+")).isNull();
            assertThat(table.row("T'")).containsOnlyKeys("*", "+", ")", "$");
        }

        @Test
        @DisplayName("an empty production is predicted on FOLLOW of its left hand side")
        void firstPlusOfEmpty() {
            FirstFollowAnalyzer analyzer = new FirstFollowAnalyzer(transformed);

            assertThat(LL1ParseTableGenerator.firstPlus(analyzer, new Production("E'", List.of())))
                    .containsExactlyInAnyOrder("$", ")");
            assertThat(LL1ParseTableGenerator.firstPlus(analyzer, new Production("T", List.of("(", "E", ")", "T'"))))
                    .containsExactly("(");
        }

        @Test
        @DisplayName("shared prefixes collide and the first production is kept")
        void conflict() {
            LL1ParseTable ambiguous = new LL1ParseTableGenerator().build(Grammars.parse("S -> a | a b"));

            assertThat(ambiguous.conflicts()).containsExactly(new LL1Conflict("S", "a",
                    new Production("S", List.of("a")), new Production("S", List.of("a", "b"))));
            assertThat(ambiguous.entry("S", "a")).isZero();
        }

        @Test
        @DisplayName("the untransformed expression grammar is left recursive and conflicts")
        void leftRecursive() {
            assertThat(new LL1ParseTableGenerator().build(Grammars.expression()).isConflictFree()).isFalse();
        }
    }

    @Nested
    @DisplayName("parsing")
    class Parsing {

        @Test
        @DisplayName("accepts id + id * id")
        void accepts() {
            ParseResult result = parser.parse(table, "id + id * id");

            assertThat(result.accepted()).isTrue();
            assertThat(result.steps().get(0)).isEqualTo(new ParseStep("$ E", "id + id * id $", "output E -> T E'"));
            assertThat(result.steps().get(1)).isEqualTo(new ParseStep("$ E' T", "id + id * id $", "output T -> id T'"));
            assertThat(result.steps().get(2)).isEqualTo(new ParseStep("$ E' T' id", "id + id * id $", "match 'id'"));
            assertThat(result.lastStep()).isEqualTo(new ParseStep("$", "$", "accept"));
            assertThat(result.root().leaves()).containsExactly("id", "+", "id", "*", "id");
        }

        @Test
        @DisplayName("rebuilds the tree from the leftmost derivation")
        void tree() {
            ParseResult result = parser.parse(table, "id");

            assertThat(result.root()).hasToString("E(T(id T'(ε)) E'(ε))");
        }

        @Test
        @DisplayName("reports a missing closing parenthesis")
        void unclosed() {
            ParseResult result = parser.parse(table, "( id");

            assertThat(result.accepted()).isFalse();
            assertThat(result.lastStep().action()).isEqualTo("error: expected ')', got '$'");
        }

        @Test
        @DisplayName("reports an empty table cell")
        void emptyInput() {
            ParseResult result = parser.parse(table, "");

            assertThat(result.steps()).containsExactly(ParseStep.error("$ E", "$", "no table entry for (E, $)"));
        }

        @Test
        @DisplayName("reports trailing input")
        void trailing() {
            ParseResult result = parser.parse(table, "id )");

            assertThat(result.lastStep()).isEqualTo(ParseStep.error("$", ") $", "unexpected input ')'"));
            assertThat(result.accepted()).isFalse();
        }

        @Test
        @DisplayName("refuses an end marker typed before trailing tokens")
        void typedEndMarker() {
            ParseResult result = parser.parse(table, "id $ garbage");

            assertThat(result.accepted()).isFalse();
            assertThat(result.steps()).containsExactly(ParseStep.error("$ E", "id $ garbage $",
                    "end marker '$' is not allowed in the input (token 2)"));
        }

        @Test
        @DisplayName("refuses a table with conflicts")
        void refusesConflicts() {
            LL1ParseTable ambiguous = new LL1ParseTableGenerator().build(Grammars.parse("S -> a | a b"));

            ParseResult result = parser.parse(ambiguous, "a");

            assertThat(result.accepted()).isFalse();
            assertThat(result.steps()).hasSize(1);
            assertThat(result.lastStep().action()).isEqualTo("error: grammar is not LL(1), table has 1 conflicts");
        }
    }
}
