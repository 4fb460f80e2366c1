package com.baykanat.cardflow.domain.model;

import lombok.NonNull;
import lombok.Value;

/** {type, id} etiketli referans; okuma tarafında type üzerinden ayrıştırılır. */
@Value
public class EventTarget {

    @NonNull
    TargetType type;
    @NonNull
    String id;

    public static EventTarget card(String cardId) {
        return new EventTarget(TargetType.CARD, cardId);
    }

    public static EventTarget comment(String commentId) {
        return new EventTarget(TargetType.COMMENT, commentId);
    }

    public static EventTarget board(String boardId) {
        return new EventTarget(TargetType.BOARD, boardId);
    }
}
