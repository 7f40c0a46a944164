package org.nowstart.lending.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.math.BigInteger;
import org.nowstart.lending.data.dto.EmergencyWithdrawRequest;
import org.nowstart.lending.data.dto.InterestRateRequest;
import org.nowstart.lending.data.dto.LiquidatorRewardRequest;
import org.nowstart.lending.data.dto.LtvUpdateRequest;
import org.nowstart.lending.data.dto.PeriodBlocksRequest;
import org.nowstart.lending.data.dto.PriceFeedUpdateRequest;
import org.nowstart.lending.data.dto.RoleRequest;
import org.nowstart.lending.data.dto.TreasuryUpdateRequest;
import org.nowstart.lending.data.dto.VaultSettingsDto;
import org.nowstart.lending.service.admin.VaultAdminService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin")
@Tag(name = "Admin", description = "볼트 설정 변경, 긴급 인출, 권한 관리 API (관리자 전용)")
public class AdminController {

    private final VaultAdminService vaultAdminService;

    public AdminController(VaultAdminService vaultAdminService) {
        this.vaultAdminService = vaultAdminService;
    }

    @GetMapping("/settings")
    @Operation(summary = "볼트 설정 조회", description = "자산, LTV, 청산 임계값, 보상률, 트레저리, 가격 피드를 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공")
    })
    public VaultSettingsDto getSettings() {
        return vaultAdminService.getSettings();
    }

    @PutMapping("/price-feed")
    @Operation(summary = "가격 피드 변경", description = "담보 또는 부채 자산의 가격 피드 id를 변경합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "변경 성공"),
            @ApiResponse(responseCode = "403", description = "관리자 권한 없음"),
            @ApiResponse(responseCode = "422", description = "볼트가 다루지 않는 자산")
    })
    public VaultSettingsDto updatePriceFeed(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @RequestBody @Valid PriceFeedUpdateRequest request
    ) {
        return vaultAdminService.updatePriceFeed(caller, request.asset(), request.feedId());
    }

    @PutMapping("/ltv")
    @Operation(summary = "LTV 변경", description = "LTV 비율과 청산 임계값을 함께 변경합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "변경 성공"),
            @ApiResponse(responseCode = "403", description = "관리자 권한 없음"),
            @ApiResponse(responseCode = "422", description = "잘못된 설정")
    })
    public VaultSettingsDto updateLtv(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @RequestBody @Valid LtvUpdateRequest request
    ) {
        return vaultAdminService.updateLtv(caller, request.ltvRatio(), request.liquidationThreshold());
    }

    @PutMapping("/liquidator-reward")
    @Operation(summary = "청산 보상률 변경", description = "압류 담보 중 청산인에게 지급되는 비율(bips)을 변경합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "변경 성공"),
            @ApiResponse(responseCode = "403", description = "관리자 권한 없음")
    })
    public VaultSettingsDto updateLiquidatorReward(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @RequestBody @Valid LiquidatorRewardRequest request
    ) {
        return vaultAdminService.updateLiquidatorReward(caller, request.liquidatorRewardBips());
    }

    @PutMapping("/treasury")
    @Operation(summary = "트레저리 주소 변경", description = "청산 잔여 담보와 이자가 지급되는 계정을 변경합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "변경 성공"),
            @ApiResponse(responseCode = "403", description = "관리자 권한 없음")
    })
    public VaultSettingsDto updateTreasury(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @RequestBody @Valid TreasuryUpdateRequest request
    ) {
        return vaultAdminService.updateTreasury(caller, request.treasury());
    }

    @PutMapping("/period-blocks")
    @Operation(summary = "이자 기간 변경", description = "이자가 부과되는 블록 단위를 변경하고 기간 비율을 다시 계산합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "변경 성공"),
            @ApiResponse(responseCode = "403", description = "관리자 권한 없음")
    })
    public ResponseEntity<Void> updatePeriodBlocks(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @RequestBody @Valid PeriodBlocksRequest request
    ) {
        vaultAdminService.updatePeriodBlocks(caller, request.periodBlocks());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/vaults/{vault}/rate")
    @Operation(summary = "연 이자율 변경", description = "등록된 볼트의 연 이자율(bips)을 변경합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "변경 성공"),
            @ApiResponse(responseCode = "403", description = "관리자 권한 없음"),
            @ApiResponse(responseCode = "404", description = "등록되지 않은 볼트")
    })
    public ResponseEntity<Void> updateVaultRate(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @PathVariable String vault,
            @RequestBody @Valid InterestRateRequest request
    ) {
        vaultAdminService.updateVaultRate(caller, vault, request.annualRateBips());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/treasury/{token}/withdraw")
    @Operation(summary = "이자 인출", description = "징수된 이자 전액을 트레저리 계정으로 지급합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "인출 성공"),
            @ApiResponse(responseCode = "403", description = "관리자 권한 없음")
    })
    public BigInteger withdrawTreasury(@RequestHeader(ApiHeaders.CALLER) String caller, @PathVariable String token) {
        return vaultAdminService.withdrawTreasury(caller, token);
    }

    @PostMapping("/emergency-withdraw")
    @Operation(summary = "긴급 인출", description = "열린 포지션에 묶이지 않은 볼트 보유 토큰만 인출합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "인출 성공"),
            @ApiResponse(responseCode = "403", description = "관리자 권한 없음"),
            @ApiResponse(responseCode = "422", description = "인출 가능 잔고 부족")
    })
    public BigInteger emergencyWithdraw(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @RequestBody @Valid EmergencyWithdrawRequest request
    ) {
        return vaultAdminService.emergencyWithdraw(caller, request.token(), request.to(), request.amount());
    }

    @PostMapping("/roles")
    @Operation(summary = "권한 부여", description = "계정에 ADMIN 또는 LEVERAGE 권한을 부여합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "부여 성공"),
            @ApiResponse(responseCode = "403", description = "관리자 권한 없음")
    })
    public ResponseEntity<Void> grantRole(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @RequestBody @Valid RoleRequest request
    ) {
        vaultAdminService.grantRole(caller, request.account(), request.role());
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/roles")
    @Operation(summary = "권한 회수", description = "부여된 권한을 회수합니다. 설정 파일로 지정된 권한은 회수되지 않습니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "회수 성공"),
            @ApiResponse(responseCode = "404", description = "부여된 권한 없음"),
            @ApiResponse(responseCode = "403", description = "관리자 권한 없음")
    })
    public ResponseEntity<Void> revokeRole(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @RequestBody @Valid RoleRequest request
    ) {
        boolean revoked = vaultAdminService.revokeRole(caller, request.account(), request.role());
        return revoked ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }
}
