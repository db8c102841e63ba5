package com.viffx.Parsers.Report;

import com.viffx.Parsers.Compiler.ParserKind;
import com.viffx.Parsers.Runtime.ParseStep;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * The outcome of one parse, with its steps numbered from 1.
 */
public record ParseReport(@NotNull ParserKind kind, boolean accepted, @NotNull List<Row> rows) {
    public ParseReport {
        Objects.requireNonNull(kind, "kind cannot be null");
        rows = List.copyOf(rows);
    }

    public int stepCount() {
        return rows.size();
    }

    public record Row(int step, @NotNull ParseStep snapshot) {}
}
