package com.baykanat.cardflow.domain.mapper;

import com.baykanat.cardflow.api.dto.BoardResponse;
import com.baykanat.cardflow.api.dto.CardResponse;
import com.baykanat.cardflow.api.dto.ColumnResponse;
import com.baykanat.cardflow.api.dto.CommentResponse;
import com.baykanat.cardflow.api.dto.EntropyConfigResponse;
import com.baykanat.cardflow.api.dto.EventResponse;
import com.baykanat.cardflow.api.dto.ExpiryWarningResponse;
import com.baykanat.cardflow.domain.model.Board;
import com.baykanat.cardflow.domain.model.BoardColumn;
import com.baykanat.cardflow.domain.model.Card;
import com.baykanat.cardflow.domain.model.Comment;
import com.baykanat.cardflow.domain.model.EntropyConfig;
import com.baykanat.cardflow.domain.model.Event;
import com.baykanat.cardflow.domain.model.ExpiryWarning;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.util.List;

/** Domain → response DTO dönüşümleri (MapStruct). */
@Mapper(componentModel = "spring")
public interface CardflowMapper {

    /** effectiveState saklanmaz, her dönüşümde karttan türetilir. */
    @Mapping(target = "effectiveState", expression = "java(card.effectiveState())")
    CardResponse toResponse(Card card);

    BoardResponse toResponse(Board board);

    ColumnResponse toResponse(BoardColumn column);

    CommentResponse toResponse(Comment comment);

    List<CommentResponse> toCommentResponses(List<Comment> comments);

    @Mapping(target = "targetType", source = "target.type")
    @Mapping(target = "targetId", source = "target.id")
    EventResponse toResponse(Event event);

    List<EventResponse> toEventResponses(List<Event> events);

    @Mapping(target = "scope", expression = "java(config.getScope().getKind().getDbValue())")
    @Mapping(target = "scopeId", source = "scope.id")
    EntropyConfigResponse toResponse(EntropyConfig config);

    ExpiryWarningResponse toResponse(ExpiryWarning warning);

    List<ExpiryWarningResponse> toWarningResponses(List<ExpiryWarning> warnings);
}
