package com.baykanat.cardflow.domain.model;

import lombok.Value;

import java.util.Map;

/** Geçiş parametreleri; şimdilik yalnızca triageInto hedef kolonu ve event payload eki. */
@Value
public class TransitionParams {

    private static final TransitionParams NONE = new TransitionParams(null, Map.of());

    String columnId;
    Map<String, Object> eventPayload;

    public static TransitionParams none() {
        return NONE;
    }

    public static TransitionParams toColumn(String columnId) {
        return new TransitionParams(columnId, Map.of());
    }

    public static TransitionParams withPayload(Map<String, Object> payload) {
        return new TransitionParams(null, Map.copyOf(payload));
    }
}
