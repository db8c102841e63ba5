package com.viffx.Parsers.Compiler;

public enum ActionType {
    SHIFT,
    REDUCE,
    ACCEPT
}
