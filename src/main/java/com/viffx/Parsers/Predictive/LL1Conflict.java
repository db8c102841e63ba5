package com.viffx.Parsers.Predictive;

import com.viffx.Parsers.Grammar.Production;
import org.jetbrains.annotations.NotNull;

/**
 * Two productions predicted by the same LL(1) table cell.
 *
 * @param nonTerminal the row of the cell
 * @param terminal the column of the cell
 * @param retained the production the table kept
 * @param rejected the production that was discarded
 */
public record LL1Conflict(@NotNull String nonTerminal, @NotNull String terminal,
                          @NotNull Production retained, @NotNull Production rejected) {
    @Override
    public String toString() {
        return "LL(1) conflict at (" + nonTerminal + ", " + terminal + "): " + retained + " vs " + rejected;
    }
}
