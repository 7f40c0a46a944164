package org.nowstart.lending.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.nowstart.lending.data.dto.ApproveRequest;
import org.nowstart.lending.data.dto.MintRequest;
import org.nowstart.lending.data.dto.TokenAllowanceDto;
import org.nowstart.lending.data.dto.TokenBalanceDto;
import org.nowstart.lending.service.admin.VaultAdminService;
import org.nowstart.lending.service.token.TokenGateway;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/tokens")
@Tag(name = "Tokens", description = "토큰 잔고/허용량 조회와 승인 API")
public class TokenController {

    private final TokenGateway tokenGateway;
    private final VaultAdminService vaultAdminService;

    public TokenController(TokenGateway tokenGateway, VaultAdminService vaultAdminService) {
        this.tokenGateway = tokenGateway;
        this.vaultAdminService = vaultAdminService;
    }

    @GetMapping("/{token}/balances/{holder}")
    @Operation(summary = "토큰 잔고 조회", description = "holder 계정의 토큰 잔고를 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공")
    })
    public TokenBalanceDto getBalance(@PathVariable String token, @PathVariable String holder) {
        return new TokenBalanceDto(token, holder, tokenGateway.balanceOf(token, holder));
    }

    @GetMapping("/{token}/allowances/{owner}/{spender}")
    @Operation(summary = "허용량 조회", description = "owner가 spender에게 허용한 토큰 수량을 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공")
    })
    public TokenAllowanceDto getAllowance(
            @PathVariable String token,
            @PathVariable String owner,
            @PathVariable String spender
    ) {
        return new TokenAllowanceDto(token, owner, spender, tokenGateway.allowance(token, owner, spender));
    }

    @PostMapping("/approve")
    @Operation(summary = "토큰 승인", description = "호출자의 토큰을 spender가 가져갈 수 있도록 허용량을 설정합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "승인 성공"),
            @ApiResponse(responseCode = "400", description = "요청 검증 실패")
    })
    public TokenAllowanceDto approve(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @RequestBody @Valid ApproveRequest request
    ) {
        tokenGateway.approve(request.token(), caller, request.spender(), request.amount());
        return new TokenAllowanceDto(request.token(), caller, request.spender(), request.amount());
    }

    @PostMapping("/mint")
    @Operation(summary = "토큰 발행", description = "관리자가 페이퍼 계정(사용자, 스왑 라우터 재고)에 토큰을 발행합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "발행 성공"),
            @ApiResponse(responseCode = "403", description = "관리자 권한 없음")
    })
    public TokenBalanceDto mint(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @RequestBody @Valid MintRequest request
    ) {
        vaultAdminService.mintTokens(caller, request.token(), request.to(), request.amount());
        return new TokenBalanceDto(request.token(), request.to(), tokenGateway.balanceOf(request.token(), request.to()));
    }
}
