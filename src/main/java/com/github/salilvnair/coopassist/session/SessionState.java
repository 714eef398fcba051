package com.github.salilvnair.coopassist.session;

public enum SessionState {
    IDLE,
    AWAITING_SELECTION
}
