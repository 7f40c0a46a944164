package org.nowstart.lending.service.leverage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.lending.data.dto.LeverageResultDto;
import org.nowstart.lending.data.entity.LoanPosition;
import org.nowstart.lending.data.entity.VaultSettings;
import org.nowstart.lending.data.exception.LendingException;
import org.nowstart.lending.data.type.LendingErrorCode;
import org.nowstart.lending.data.type.PositionStatus;
import org.nowstart.lending.service.audit.AuditEventService;
import org.nowstart.lending.service.ledger.PositionLedgerService;
import org.nowstart.lending.service.swap.SwapRoute;
import org.nowstart.lending.service.swap.SwapRouter;
import org.nowstart.lending.service.token.TokenGateway;
import org.nowstart.lending.service.vault.VaultSettingsService;
import org.nowstart.lending.support.TestLendingProperties;

@ExtendWith(MockitoExtension.class)
class LeverageLoopServiceTest {

    private static final String BUILDER = "leverage-builder";
    private static final String ROUTER = "paper-router";
    private static final SwapRoute ROUTE = new SwapRoute(List.of("USDL", "WETH"));

    @Mock
    private PositionLedgerService positionLedgerService;
    @Mock
    private SwapRouter swapRouter;
    @Mock
    private TokenGateway tokenGateway;
    @Mock
    private VaultSettingsService vaultSettingsService;
    @Mock
    private AuditEventService auditEventService;

    private LeverageLoopService leverageLoopService;

    @BeforeEach
    void setUp() {
        leverageLoopService = new LeverageLoopService(
                positionLedgerService,
                swapRouter,
                tokenGateway,
                vaultSettingsService,
                auditEventService,
                TestLendingProperties.defaults()
        );
    }

    @Test
    void leveragePosition_rejectsLeverageOutsideBoundsBeforeAnyEffect() {
        assertThatThrownBy(() -> leverageLoopService.leveragePosition("alice", BigInteger.TEN, 0, BigInteger.ZERO, null))
                .isInstanceOf(LendingException.class)
                .extracting("errorCode")
                .isEqualTo(LendingErrorCode.INVALID_LEVERAGE);
        assertThatThrownBy(() -> leverageLoopService.leveragePosition("alice", BigInteger.TEN, 11, BigInteger.ZERO, null))
                .isInstanceOf(LendingException.class)
                .extracting("errorCode")
                .isEqualTo(LendingErrorCode.INVALID_LEVERAGE);

        verifyNoInteractions(tokenGateway, positionLedgerService, swapRouter);
    }

    @Test
    void leveragePosition_loopsBorrowSwapDepositAndReturnsLastTranche() {
        when(vaultSettingsService.current()).thenReturn(settings());
        when(positionLedgerService.openPositionFor(BUILDER, "alice", BigInteger.valueOf(1_000), BigInteger.ZERO, 3))
                .thenReturn(position(1_000, 0));
        when(positionLedgerService.getMaxBorrowable(9L)).thenReturn(
                BigInteger.valueOf(100_000),
                BigInteger.valueOf(49_850),
                BigInteger.valueOf(24_850)
        );
        when(swapRouter.swapExactInput(BUILDER, ROUTE, BigInteger.valueOf(100_000), BigInteger.ZERO))
                .thenReturn(BigInteger.valueOf(498));
        when(swapRouter.swapExactInput(BUILDER, ROUTE, BigInteger.valueOf(49_850), BigInteger.ZERO))
                .thenReturn(BigInteger.valueOf(248));
        when(tokenGateway.balanceOf("USDL", BUILDER)).thenReturn(BigInteger.valueOf(24_850));
        when(positionLedgerService.getPosition(9L)).thenReturn(position(1_746, 174_700));

        LeverageResultDto result = leverageLoopService.leveragePosition("alice", BigInteger.valueOf(1_000), 3, BigInteger.ZERO, null);

        assertThat(result.positionId()).isEqualTo(9L);
        assertThat(result.swapOutputs()).containsExactly(BigInteger.valueOf(498), BigInteger.valueOf(248));
        assertThat(result.totalCollateral()).isEqualTo(BigInteger.valueOf(1_746));
        assertThat(result.totalDebt()).isEqualTo(BigInteger.valueOf(174_700));
        assertThat(result.returnedDebt()).isEqualTo(BigInteger.valueOf(24_850));

        InOrder order = inOrder(tokenGateway, positionLedgerService, swapRouter);
        order.verify(tokenGateway).transferFrom("WETH", BUILDER, "alice", BUILDER, BigInteger.valueOf(1_000));
        order.verify(tokenGateway).approve("WETH", BUILDER, "vault", BigInteger.valueOf(1_000));
        order.verify(positionLedgerService).openPositionFor(BUILDER, "alice", BigInteger.valueOf(1_000), BigInteger.ZERO, 3);
        order.verify(positionLedgerService).borrowFor(BUILDER, 9L, BUILDER, BigInteger.valueOf(100_000));
        order.verify(tokenGateway).approve("USDL", BUILDER, ROUTER, BigInteger.valueOf(100_000));
        order.verify(swapRouter).swapExactInput(BUILDER, ROUTE, BigInteger.valueOf(100_000), BigInteger.ZERO);
        order.verify(positionLedgerService).addCollateral(BUILDER, 9L, BigInteger.valueOf(498));
        order.verify(positionLedgerService).borrowFor(BUILDER, 9L, BUILDER, BigInteger.valueOf(49_850));
        order.verify(positionLedgerService).addCollateral(BUILDER, 9L, BigInteger.valueOf(248));
        order.verify(positionLedgerService).borrowFor(BUILDER, 9L, BUILDER, BigInteger.valueOf(24_850));
        order.verify(tokenGateway).transfer("USDL", BUILDER, "alice", BigInteger.valueOf(24_850));
        verify(auditEventService).record(eq("LEVERAGE_BUILT"), eq("alice"), eq(9L), anyString());
    }

    @Test
    void leveragePosition_withLeverageOneBorrowsOnceWithoutSwapping() {
        when(vaultSettingsService.current()).thenReturn(settings());
        when(positionLedgerService.openPositionFor(BUILDER, "alice", BigInteger.valueOf(1_000), BigInteger.ZERO, 1))
                .thenReturn(position(1_000, 0));
        when(positionLedgerService.getMaxBorrowable(9L)).thenReturn(BigInteger.valueOf(100_000));
        when(tokenGateway.balanceOf("USDL", BUILDER)).thenReturn(BigInteger.valueOf(100_000));
        when(positionLedgerService.getPosition(9L)).thenReturn(position(1_000, 100_000));

        LeverageResultDto result = leverageLoopService.leveragePosition("alice", BigInteger.valueOf(1_000), 1, null, List.of());

        assertThat(result.swapOutputs()).isEmpty();
        assertThat(result.returnedDebt()).isEqualTo(BigInteger.valueOf(100_000));
        verifyNoInteractions(swapRouter);
        verify(positionLedgerService, never()).addCollateral(anyString(), anyLong(), any());
    }

    @Test
    void leveragePosition_failsWhenHeadroomIsExhausted() {
        when(vaultSettingsService.current()).thenReturn(settings());
        when(positionLedgerService.openPositionFor(BUILDER, "alice", BigInteger.valueOf(1_000), BigInteger.ZERO, 2))
                .thenReturn(position(1_000, 0));
        when(positionLedgerService.getMaxBorrowable(9L)).thenReturn(BigInteger.ZERO);

        assertThatThrownBy(() -> leverageLoopService.leveragePosition("alice", BigInteger.valueOf(1_000), 2, BigInteger.ZERO, null))
                .isInstanceOf(LendingException.class)
                .extracting("errorCode")
                .isEqualTo(LendingErrorCode.NO_BORROW_CAPACITY);

        verify(positionLedgerService, never()).borrowFor(anyString(), anyLong(), anyString(), any());
    }

    @Test
    void leveragePosition_rejectsRouteThatDoesNotBuyCollateral() {
        when(vaultSettingsService.current()).thenReturn(settings());

        assertThatThrownBy(() -> leverageLoopService.leveragePosition(
                "alice",
                BigInteger.valueOf(1_000),
                2,
                BigInteger.ZERO,
                List.of("WETH", "USDL")
        ))
                .isInstanceOf(LendingException.class)
                .extracting("errorCode")
                .isEqualTo(LendingErrorCode.INVALID_ASSET);
        assertThatThrownBy(() -> leverageLoopService.leveragePosition(
                "alice",
                BigInteger.valueOf(1_000),
                2,
                BigInteger.ZERO,
                List.of("USDL")
        ))
                .isInstanceOf(LendingException.class)
                .extracting("errorCode")
                .isEqualTo(LendingErrorCode.INVALID_ASSET);

        verifyNoInteractions(tokenGateway, positionLedgerService);
    }

    private static LoanPosition position(long collateral, long debt) {
        return LoanPosition.builder()
                .id(9L)
                .owner("alice")
                .collateralAmount(BigInteger.valueOf(collateral))
                .debtAmount(BigInteger.valueOf(debt))
                .status(PositionStatus.OPEN)
                .leverage(3)
                .build();
    }

    private static VaultSettings settings() {
        return VaultSettings.builder()
                .vaultAddress("vault")
                .collateralAsset("WETH")
                .debtAsset("USDL")
                .build();
    }
}
