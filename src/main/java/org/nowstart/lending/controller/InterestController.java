package org.nowstart.lending.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.nowstart.lending.data.dto.InterestDueDto;
import org.nowstart.lending.data.dto.PositionDto;
import org.nowstart.lending.data.dto.RegisterVaultRequest;
import org.nowstart.lending.data.dto.TreasuryPoolDto;
import org.nowstart.lending.data.entity.LoanPosition;
import org.nowstart.lending.service.interest.InterestAccrualService;
import org.nowstart.lending.service.ledger.PositionLedgerService;
import org.nowstart.lending.service.vault.TreasuryService;
import org.nowstart.lending.service.vault.VaultSettingsService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/interest")
@Tag(name = "Interest", description = "이자 조회, 즉시 정산, 볼트 등록, 트레저리 조회 API")
public class InterestController {

    private final InterestAccrualService interestAccrualService;
    private final PositionLedgerService positionLedgerService;
    private final VaultSettingsService vaultSettingsService;
    private final TreasuryService treasuryService;

    public InterestController(
            InterestAccrualService interestAccrualService,
            PositionLedgerService positionLedgerService,
            VaultSettingsService vaultSettingsService,
            TreasuryService treasuryService
    ) {
        this.interestAccrualService = interestAccrualService;
        this.positionLedgerService = positionLedgerService;
        this.vaultSettingsService = vaultSettingsService;
        this.treasuryService = treasuryService;
    }

    @GetMapping("/positions/{positionId}")
    @Operation(summary = "미징수 이자 조회", description = "마지막 정산 이후 경과한 완전한 기간 수 기준으로 이자를 계산합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "404", description = "포지션 없음")
    })
    public InterestDueDto getInterestDue(@PathVariable Long positionId) {
        LoanPosition position = positionLedgerService.getPosition(positionId);
        return interestAccrualService.describe(
                vaultSettingsService.current().getVaultAddress(),
                position.getId(),
                position.getDebtAmount()
        );
    }

    @PostMapping("/positions/{positionId}/collect")
    @Operation(summary = "이자 즉시 정산", description = "정산 가능한 이자를 포지션 부채에 반영합니다. 기간이 차지 않았으면 아무것도 바뀌지 않습니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "정산 성공"),
            @ApiResponse(responseCode = "404", description = "포지션 없음")
    })
    public PositionDto collectInterest(@PathVariable Long positionId) {
        positionLedgerService.chargeInterest(positionId);
        return positionLedgerService.toDto(positionLedgerService.getPosition(positionId));
    }

    @PostMapping("/vaults")
    @Operation(summary = "볼트 등록", description = "볼트의 연 이자율(bips)을 1회 등록합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "등록 성공"),
            @ApiResponse(responseCode = "403", description = "관리자 권한 없음"),
            @ApiResponse(responseCode = "409", description = "이미 등록된 볼트")
    })
    public ResponseEntity<Void> registerVault(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @RequestBody @Valid RegisterVaultRequest request
    ) {
        interestAccrualService.registerVault(caller, request.vault(), request.annualRateBips());
        return ResponseEntity.status(HttpStatus.CREATED).build();
    }

    @GetMapping("/treasury/{token}")
    @Operation(summary = "트레저리 조회", description = "징수 대기 이자, 인출된 이자, 청산 손실 누계를 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공")
    })
    public TreasuryPoolDto getTreasury(@PathVariable String token) {
        return treasuryService.get(token);
    }
}
