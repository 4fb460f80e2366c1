package com.baykanat.cardflow.domain.service;

import com.baykanat.cardflow.domain.exception.NotFoundException;
import com.baykanat.cardflow.domain.exception.ValidationException;
import com.baykanat.cardflow.domain.model.AccessContext;
import com.baykanat.cardflow.domain.model.Board;
import com.baykanat.cardflow.domain.model.BoardColumn;
import com.baykanat.cardflow.infrastructure.persistence.BoardJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;

/** Kolon referanslarının doğrulanabilmesi için asgari board/kolon kaydı. */
@Slf4j
@Service
@RequiredArgsConstructor
public class BoardService {

    private final BoardJdbcRepository boardRepository;
    private final Clock clock;

    @Transactional
    public Board createBoard(AccessContext ctx, String name) {
        requireName(name);
        Board board = Board.builder()
                .id(UUID.randomUUID().toString())
                .tenantId(ctx.getTenantId())
                .name(name.trim())
                .createdAt(clock.instant())
                .build();
        boardRepository.insertBoard(board);
        log.info("Board {} created in tenant {}", board.getId(), ctx.getTenantId());
        return board;
    }

    @Transactional
    public BoardColumn addColumn(AccessContext ctx, String boardId, String name) {
        requireName(name);
        boardRepository.findBoard(ctx.getTenantId(), boardId)
                .orElseThrow(() -> new NotFoundException("Board", boardId));
        BoardColumn column = BoardColumn.builder()
                .id(UUID.randomUUID().toString())
                .tenantId(ctx.getTenantId())
                .boardId(boardId)
                .name(name.trim())
                .position(boardRepository.nextColumnPosition(ctx.getTenantId(), boardId))
                .createdAt(clock.instant())
                .build();
        boardRepository.insertColumn(column);
        return column;
    }

    private void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("name must not be blank");
        }
    }
}
