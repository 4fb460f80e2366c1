package com.baykanat.cardflow.domain.exception;

import com.baykanat.cardflow.domain.model.EffectiveState;

import java.util.Set;
import java.util.stream.Collectors;

/** Eylem kartın mevcut efektif durumundan yapılamaz. */
public class InvalidTransitionException extends CardflowException {

    private final String action;
    private final EffectiveState currentState;

    public InvalidTransitionException(String cardId, String action, EffectiveState currentState,
                                      Set<EffectiveState> allowedFrom) {
        super(String.format("Cannot %s card %s: effective state is %s, expected one of [%s]",
                action, cardId, currentState.getValue(),
                allowedFrom.stream().map(EffectiveState::getValue).sorted().collect(Collectors.joining(", "))));
        this.action = action;
        this.currentState = currentState;
    }

    public InvalidTransitionException(String message, String action, EffectiveState currentState) {
        super(message);
        this.action = action;
        this.currentState = currentState;
    }

    public String getAction() {
        return action;
    }

    public EffectiveState getCurrentState() {
        return currentState;
    }
}
