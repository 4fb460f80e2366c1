package com.baykanat.cardflow.api.controller;

import com.baykanat.cardflow.api.dto.BoardResponse;
import com.baykanat.cardflow.api.dto.ColumnResponse;
import com.baykanat.cardflow.api.dto.CreateBoardRequest;
import com.baykanat.cardflow.api.dto.CreateColumnRequest;
import com.baykanat.cardflow.domain.mapper.CardflowMapper;
import com.baykanat.cardflow.domain.model.AccessContext;
import com.baykanat.cardflow.domain.service.BoardService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** POST /boards ve POST /boards/{boardId}/columns. */
@RestController
@RequestMapping("/boards")
@RequiredArgsConstructor
@Tag(name = "Boards", description = "Boards and their columns")
public class BoardController {

    private final BoardService boardService;
    private final CardflowMapper mapper;

    @PostMapping
    @Operation(summary = "Create a board")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Board created"),
            @ApiResponse(responseCode = "400", description = "Invalid payload"),
            @ApiResponse(responseCode = "403", description = "Missing access context")
    })
    public ResponseEntity<BoardResponse> createBoard(@Parameter(hidden = true) AccessContext ctx,
                                                     @Valid @RequestBody CreateBoardRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(mapper.toResponse(boardService.createBoard(ctx, request.getName())));
    }

    @PostMapping("/{boardId}/columns")
    @Operation(summary = "Add a column to a board", description = "Columns are appended after the existing ones")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Column created"),
            @ApiResponse(responseCode = "400", description = "Invalid payload"),
            @ApiResponse(responseCode = "404", description = "Board not found")
    })
    public ResponseEntity<ColumnResponse> addColumn(@Parameter(hidden = true) AccessContext ctx,
                                                    @PathVariable String boardId,
                                                    @Valid @RequestBody CreateColumnRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(mapper.toResponse(boardService.addColumn(ctx, boardId, request.getName())));
    }
}
