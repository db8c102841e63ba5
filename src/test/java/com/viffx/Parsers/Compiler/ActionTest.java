package com.viffx.Parsers.Compiler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Actions and conflicts")
class ActionTest {

    @Test
    @DisplayName("render as shift, reduce and accept")
    void rendering() {
        assertThat(Action.shift(5)).hasToString("shift 5");
        assertThat(Action.reduce(2)).hasToString("reduce 2");
        assertThat(Action.ACCEPT).hasToString("accept");
        assertThatThrownBy(() -> new Action(ActionType.ACCEPT, 3)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("classify shift against reduce in either order as shift-reduce")
    void classification() {
        assertThat(ConflictType.classify(Action.shift(1), Action.reduce(2))).isEqualTo(ConflictType.SHIFT_REDUCE);
        assertThat(ConflictType.classify(Action.reduce(2), Action.shift(1))).isEqualTo(ConflictType.SHIFT_REDUCE);
        assertThat(ConflictType.classify(Action.reduce(2), Action.reduce(3))).isEqualTo(ConflictType.REDUCE_REDUCE);
        assertThat(ConflictType.classify(Action.ACCEPT, Action.reduce(3))).isEqualTo(ConflictType.OTHER);
    }

    @Test
    @DisplayName("parser kinds are found by display or short name")
    void parserKinds() {
        assertThat(ParserKind.of("LL(1)")).isEqualTo(ParserKind.LL1);
        assertThat(ParserKind.of(" lalr ")).isEqualTo(ParserKind.LALR1);
        assertThat(ParserKind.CLR1).hasToString("CLR(1)");
        assertThat(ParserKind.LL1.isLR()).isFalse();
    }
}
