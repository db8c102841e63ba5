package com.viffx.Parsers.Compiler;

import com.viffx.Parsers.Automata.Automaton;
import com.viffx.Parsers.Automata.AutomatonBuilder;
import com.viffx.Parsers.Grammar.Grammar;
import com.viffx.Parsers.Grammar.Symbols;
import com.viffx.Parsers.Grammars;
import com.viffx.Parsers.Utils.ParserSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LR parse table generators")
class ParseTableGeneratorTest {
    private static final ParserSettings SETTINGS = ParserSettings.defaults();

    private static ParseTable build(ParserKind kind, Grammar grammar) {
        return ParseTableGenerators.forKind(kind, SETTINGS).build(grammar);
    }

    @Nested
    @DisplayName("on the expression grammar")
    class Expression {
        private final Grammar grammar = Grammars.expression();

        @ParameterizedTest
        @EnumSource(value = ParserKind.class, names = {"SLR1", "CLR1", "LALR1"})
        @DisplayName("every LR table is conflict free")
        void conflictFree(ParserKind kind) {
            ParseTable table = build(kind, grammar);

            assertThat(table.kind()).isEqualTo(kind);
            assertThat(table.conflicts()).isEmpty();
            assertThat(table.isConflictFree()).isTrue();
        }

        @Test
        @DisplayName("SLR(1) holds the textbook entries")
        void slrEntries() {
            ParseTable table = build(ParserKind.SLR1, grammar);

            assertThat(table.action(0, "id")).isEqualTo(Action.shift(5));
            assertThat(table.action(1, Symbols.EOF)).isEqualTo(Action.ACCEPT);
            assertThat(table.action(2, "+")).isEqualTo(Action.reduce(2));
            assertThat(table.action(2, "*")).isEqualTo(Action.shift(7));
            assertThat(table.action(5, ")")).isEqualTo(Action.reduce(6));
            assertThat(table.action(0, "+")).isNull();
            assertThat(table.goTo(0, "E")).isEqualTo(1);
            assertThat(table.goTo(4, "E")).isEqualTo(8);
            assertThat(table.goTo(0, "+")).isNull();
        }

        @Test
        @DisplayName("LALR(1) has as many states as LR(0) and no more than CLR(1)")
        void lalrStateCount() {
            ParseTable slr = build(ParserKind.SLR1, grammar);
            ParseTable lalr = build(ParserKind.LALR1, grammar);
            ParseTable clr = build(ParserKind.CLR1, grammar);

            assertThat(lalr.stateCount()).isEqualTo(slr.stateCount()).isEqualTo(12);
            assertThat(lalr.stateCount()).isLessThan(clr.stateCount());
        }

        @ParameterizedTest
        @EnumSource(value = ParserKind.class, names = {"SLR1", "CLR1", "LALR1"})
        @DisplayName("building twice gives the same table")
        void deterministic(ParserKind kind) {
            assertThat(build(kind, grammar)).isEqualTo(build(kind, grammar));
        }
    }

    @Nested
    @DisplayName("on the dangling else grammar")
    class DanglingElse {
        private final Grammar grammar = Grammars.danglingElse();

        @ParameterizedTest
        @EnumSource(value = ParserKind.class, names = {"SLR1", "CLR1", "LALR1"})
        @DisplayName("every LR table reports a shift-reduce conflict on 'else'")
        void shiftReduceOnElse(ParserKind kind) {
            ParseTable table = build(kind, grammar);

            assertThat(table.isConflictFree()).isFalse();
            assertThat(table.conflicts())
                    .anyMatch(conflict -> conflict.type() == ConflictType.SHIFT_REDUCE && conflict.symbol().equals("else"));
        }

        @Test
        @DisplayName("the table keeps the first action written to a contested cell")
        void firstWriterWins() {
            ParseTable table = build(ParserKind.SLR1, grammar);

            for (Conflict conflict : table.conflicts()) {
                assertThat(table.action(conflict.state(), conflict.symbol())).isEqualTo(conflict.existing());
                assertThat(conflict.rejected()).isNotEqualTo(conflict.existing());
            }
        }

        @ParameterizedTest
        @EnumSource(value = ParserKind.class, names = {"SLR1", "CLR1", "LALR1"})
        @DisplayName("conflict lists are identical across builds")
        void deterministicConflicts(ParserKind kind) {
            assertThat(build(kind, grammar).conflicts()).isEqualTo(build(kind, grammar).conflicts());
        }
    }

    @Nested
    @DisplayName("LALR(1) state merging")
    class Merging {

        @Test
        @DisplayName("can introduce reduce-reduce conflicts the canonical table does not have")
        void mergeIntroducesReduceReduce() {
            Grammar grammar = Grammars.parse(Grammars.LR1_NOT_LALR);

            ParseTable clr = build(ParserKind.CLR1, grammar);
            ParseTable lalr = build(ParserKind.LALR1, grammar);

            assertThat(clr.isConflictFree()).isTrue();
            assertThat(lalr.conflicts()).isNotEmpty()
                    .allMatch(conflict -> conflict.type() == ConflictType.REDUCE_REDUCE);
        }

        @Test
        @DisplayName("merges states with equal cores and keeps state 0 first")
        void mergeByCore() {
            Automaton canonical = new AutomatonBuilder(SETTINGS).lr1(Grammars.expression());
            Automaton merged = LALR1ParseTableGenerator.merge(canonical);

            assertThat(merged.size()).isEqualTo(12);
            assertThat(merged.state(0)).containsAll(canonical.state(0));
            assertThat(merged.hasLookaheads()).isTrue();
            assertThat(merged.transition(0, "id")).isNotNull();
        }
    }

    @Nested
    @DisplayName("generator lookup")
    class Lookup {

        @Test
        @DisplayName("accepts short and (1) names in any case")
        void forName() {
            assertThat(ParseTableGenerators.forName("slr", SETTINGS)).isInstanceOf(SLR1ParseTableGenerator.class);
            assertThat(ParseTableGenerators.forName("SLR(1)", SETTINGS).kind()).isEqualTo(ParserKind.SLR1);
            assertThat(ParseTableGenerators.forName("CLR", SETTINGS)).isInstanceOf(CLR1ParseTableGenerator.class);
            assertThat(ParseTableGenerators.forName("lalr(1)", SETTINGS)).isInstanceOf(LALR1ParseTableGenerator.class);
        }

        @Test
        @DisplayName("rejects unknown names and LL(1)")
        void rejectsUnknown() {
            assertThatThrownBy(() -> ParseTableGenerators.forName("GLR", SETTINGS))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Unknown parser type");
            assertThatThrownBy(() -> ParseTableGenerators.forName("LL(1)", SETTINGS))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
