package com.company.fermentation.domain.enums;

public enum CursorState {
    IDLE,
    STREAMING,
    EXHAUSTED;

    public boolean isTerminal() {
        return this == EXHAUSTED;
    }
}
