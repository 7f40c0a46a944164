package org.nowstart.lending.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.nowstart.lending.data.dto.LeverageRequest;
import org.nowstart.lending.data.dto.LeverageResultDto;
import org.nowstart.lending.service.leverage.LeverageLoopService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/leverage")
@Tag(name = "Leverage", description = "대출-스왑-재예치 반복으로 레버리지 포지션을 구성하는 API")
public class LeverageController {

    private final LeverageLoopService leverageLoopService;

    public LeverageController(LeverageLoopService leverageLoopService) {
        this.leverageLoopService = leverageLoopService;
    }

    @PostMapping
    @Operation(summary = "레버리지 포지션 구성", description = "leverage 횟수만큼 대출하고 마지막 회차를 제외한 대출금을 담보로 스왑해 재예치합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "구성 성공"),
            @ApiResponse(responseCode = "400", description = "요청 검증 실패"),
            @ApiResponse(responseCode = "422", description = "레버리지 한도 초과, 대출 여력 없음 또는 스왑 실패")
    })
    public ResponseEntity<LeverageResultDto> leveragePosition(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @RequestBody @Valid LeverageRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(leverageLoopService.leveragePosition(
                        caller,
                        request.collateralAmount(),
                        request.leverage(),
                        request.minAmountOut(),
                        request.swapRoute()
                ));
    }
}
