package org.nowstart.lending.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.math.BigInteger;
import java.util.List;
import org.nowstart.lending.data.dto.AmountRequest;
import org.nowstart.lending.data.dto.BorrowForRequest;
import org.nowstart.lending.data.dto.LiquidationResultDto;
import org.nowstart.lending.data.dto.OpenPositionRequest;
import org.nowstart.lending.data.dto.PositionDto;
import org.nowstart.lending.data.dto.PositionHealthDto;
import org.nowstart.lending.data.dto.UserBalanceDto;
import org.nowstart.lending.service.ledger.PositionLedgerService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@Tag(name = "Positions", description = "담보 포지션 개설/조회, 담보 입출금, 대출/상환, 청산 API")
public class PositionController {

    private final PositionLedgerService positionLedgerService;

    public PositionController(PositionLedgerService positionLedgerService) {
        this.positionLedgerService = positionLedgerService;
    }

    @PostMapping("/positions")
    @Operation(summary = "포지션 개설", description = "담보를 예치하고 LTV 한도 내에서 대출을 실행합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "개설 성공"),
            @ApiResponse(responseCode = "400", description = "요청 검증 실패"),
            @ApiResponse(responseCode = "422", description = "LTV 한도 초과 또는 잔고 부족"),
            @ApiResponse(responseCode = "503", description = "오래된 가격")
    })
    public ResponseEntity<PositionDto> openPosition(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @RequestBody @Valid OpenPositionRequest request
    ) {
        PositionDto position = positionLedgerService.toDto(positionLedgerService.openPosition(
                caller,
                request.collateralAsset(),
                request.collateralAmount(),
                request.debtAmount(),
                request.leverage()
        ));
        return ResponseEntity.status(HttpStatus.CREATED).body(position);
    }

    @GetMapping("/positions/{positionId}")
    @Operation(summary = "포지션 조회", description = "포지션 id로 담보/부채/상태를 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "404", description = "포지션 없음")
    })
    public PositionDto getPosition(@PathVariable Long positionId) {
        return positionLedgerService.toDto(positionLedgerService.getPosition(positionId));
    }

    @GetMapping("/positions")
    @Operation(summary = "소유자별 포지션 목록", description = "owner가 소유한 모든 포지션을 id 순으로 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공")
    })
    public List<PositionDto> getPositions(@RequestParam("owner") String owner) {
        return positionLedgerService.getPositionsByOwner(owner)
                .stream()
                .map(positionLedgerService::toDto)
                .toList();
    }

    @PostMapping("/positions/{positionId}/collateral/add")
    @Operation(summary = "담보 추가", description = "포지션 소유자 또는 레버리지 위임자가 담보를 추가합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "추가 성공"),
            @ApiResponse(responseCode = "403", description = "권한 없음"),
            @ApiResponse(responseCode = "409", description = "열려 있지 않은 포지션")
    })
    public PositionDto addCollateral(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @PathVariable Long positionId,
            @RequestBody @Valid AmountRequest request
    ) {
        return positionLedgerService.toDto(positionLedgerService.addCollateral(caller, positionId, request.amount()));
    }

    @PostMapping("/positions/{positionId}/collateral/remove")
    @Operation(summary = "담보 인출", description = "남은 담보가 현재 부채의 LTV 한도를 충족할 때만 인출합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "인출 성공"),
            @ApiResponse(responseCode = "403", description = "소유자 아님"),
            @ApiResponse(responseCode = "422", description = "인출 후 담보 부족")
    })
    public PositionDto removeCollateral(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @PathVariable Long positionId,
            @RequestBody @Valid AmountRequest request
    ) {
        return positionLedgerService.toDto(positionLedgerService.removeCollateral(caller, positionId, request.amount()));
    }

    @PostMapping("/positions/{positionId}/borrow")
    @Operation(summary = "추가 대출", description = "누적 이자를 먼저 부채에 반영한 뒤 LTV 한도 내에서 대출합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "대출 성공"),
            @ApiResponse(responseCode = "422", description = "LTV 한도 초과")
    })
    public PositionDto borrow(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @PathVariable Long positionId,
            @RequestBody @Valid AmountRequest request
    ) {
        return positionLedgerService.toDto(positionLedgerService.borrow(caller, positionId, request.amount()));
    }

    @PostMapping("/positions/{positionId}/borrow-for")
    @Operation(summary = "수혜자 지정 대출", description = "대출금을 beneficiary 계정으로 발행합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "대출 성공"),
            @ApiResponse(responseCode = "403", description = "권한 없음"),
            @ApiResponse(responseCode = "422", description = "LTV 한도 초과")
    })
    public PositionDto borrowFor(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @PathVariable Long positionId,
            @RequestBody @Valid BorrowForRequest request
    ) {
        return positionLedgerService.toDto(
                positionLedgerService.borrowFor(caller, positionId, request.beneficiary(), request.amount())
        );
    }

    @PostMapping("/positions/{positionId}/repay")
    @Operation(summary = "상환", description = "호출자의 부채 자산을 소각하여 부채를 줄입니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "상환 성공"),
            @ApiResponse(responseCode = "422", description = "부채 초과 상환")
    })
    public PositionDto repay(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @PathVariable Long positionId,
            @RequestBody @Valid AmountRequest request
    ) {
        return positionLedgerService.toDto(positionLedgerService.repay(caller, positionId, request.amount()));
    }

    @PostMapping("/positions/{positionId}/close")
    @Operation(summary = "포지션 종료", description = "남은 부채를 전액 상환하고 담보를 돌려받습니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "종료 성공"),
            @ApiResponse(responseCode = "403", description = "소유자 아님")
    })
    public PositionDto closePosition(@RequestHeader(ApiHeaders.CALLER) String caller, @PathVariable Long positionId) {
        return positionLedgerService.toDto(positionLedgerService.closePosition(caller, positionId));
    }

    @PostMapping("/positions/{positionId}/liquidate")
    @Operation(summary = "청산", description = "건전성이 청산 임계값 아래인 포지션의 담보를 전부 압류합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "청산 성공"),
            @ApiResponse(responseCode = "422", description = "건전한 포지션")
    })
    public LiquidationResultDto liquidate(@RequestHeader(ApiHeaders.CALLER) String caller, @PathVariable Long positionId) {
        return positionLedgerService.liquidate(caller, positionId);
    }

    @GetMapping("/positions/{positionId}/health")
    @Operation(summary = "건전성 조회", description = "현재 가격과 미징수 이자를 반영한 건전성 비율과 대출 여력을 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "404", description = "포지션 없음")
    })
    public PositionHealthDto getPositionHealth(@PathVariable Long positionId) {
        return positionLedgerService.getPositionHealth(positionId);
    }

    @GetMapping("/positions/{positionId}/max-borrowable")
    @Operation(summary = "추가 대출 가능액", description = "LTV 한도까지 남은 부채 자산 수량을 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공")
    })
    public BigInteger getMaxBorrowable(@PathVariable Long positionId) {
        return positionLedgerService.getMaxBorrowable(positionId);
    }

    @GetMapping("/balances/{account}")
    @Operation(summary = "계정별 합계", description = "계정이 소유한 포지션들의 담보/부채 합계를 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공")
    })
    public UserBalanceDto getUserBalance(@PathVariable String account) {
        return positionLedgerService.getUserBalance(account);
    }
}
