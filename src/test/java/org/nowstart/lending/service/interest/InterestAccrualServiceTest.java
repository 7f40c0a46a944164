package org.nowstart.lending.service.interest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigInteger;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.lending.data.entity.InterestSchedule;
import org.nowstart.lending.data.entity.InterestState;
import org.nowstart.lending.data.entity.InterestVault;
import org.nowstart.lending.data.entity.VaultSettings;
import org.nowstart.lending.data.exception.LendingException;
import org.nowstart.lending.data.type.LendingErrorCode;
import org.nowstart.lending.data.type.Permission;
import org.nowstart.lending.repository.InterestScheduleRepository;
import org.nowstart.lending.repository.InterestStateRepository;
import org.nowstart.lending.repository.InterestVaultRepository;
import org.nowstart.lending.service.audit.AuditEventService;
import org.nowstart.lending.service.auth.AccessControlService;
import org.nowstart.lending.service.chain.BlockClock;
import org.nowstart.lending.service.token.TokenGateway;
import org.nowstart.lending.service.vault.TreasuryService;
import org.nowstart.lending.service.vault.VaultSettingsService;
import org.nowstart.lending.support.TestLendingProperties;

@ExtendWith(MockitoExtension.class)
class InterestAccrualServiceTest {

    private static final BigInteger E18 = BigInteger.TEN.pow(18);
    private static final BigInteger DEBT = BigInteger.valueOf(100_000).multiply(E18);
    // 100_000 * 5% * (7200 / 2_628_000) with the period share floored at 18 decimals
    private static final BigInteger ONE_PERIOD = new BigInteger("13698630136986300000");
    private static final InterestState.InterestStateKey KEY = new InterestState.InterestStateKey("vault", 1L);

    @Mock
    private InterestVaultRepository interestVaultRepository;
    @Mock
    private InterestStateRepository interestStateRepository;
    @Mock
    private InterestScheduleRepository interestScheduleRepository;
    @Mock
    private TreasuryService treasuryService;
    @Mock
    private VaultSettingsService vaultSettingsService;
    @Mock
    private TokenGateway tokenGateway;
    @Mock
    private AccessControlService accessControlService;
    @Mock
    private AuditEventService auditEventService;
    @Mock
    private BlockClock blockClock;

    private InterestAccrualService interestAccrualService;

    @BeforeEach
    void setUp() {
        interestAccrualService = new InterestAccrualService(
                interestVaultRepository,
                interestStateRepository,
                interestScheduleRepository,
                treasuryService,
                vaultSettingsService,
                tokenGateway,
                accessControlService,
                auditEventService,
                blockClock,
                TestLendingProperties.defaults()
        );
    }

    @Test
    void periodShare_isFlooredFractionOfAYear() {
        assertThat(InterestAccrualService.periodShare(7200, 2_628_000)).isEqualTo(new BigInteger("2739726027397260"));
    }

    @Test
    void calculateInterestDue_chargesOneWholePeriod() {
        stubAccrual(1_000L, 8_200L);

        assertThat(interestAccrualService.calculateInterestDue("vault", 1L, DEBT)).isEqualTo(ONE_PERIOD);
    }

    @Test
    void calculateInterestDue_dropsPartialPeriods() {
        stubAccrual(1_000L, 8_199L);

        assertThat(interestAccrualService.calculateInterestDue("vault", 1L, DEBT)).isZero();
    }

    @Test
    void calculateInterestDue_scalesWithWholePeriodsOnly() {
        stubAccrual(1_000L, 1_000L + 7_200L * 2 + 7_199L);

        assertThat(interestAccrualService.calculateInterestDue("vault", 1L, DEBT)).isEqualTo(ONE_PERIOD.multiply(BigInteger.TWO));
    }

    @Test
    void calculateInterestDue_isZeroForDormantPosition() {
        when(interestVaultRepository.findById("vault")).thenReturn(Optional.of(vault(500)));
        when(interestStateRepository.findById(KEY)).thenReturn(Optional.of(state(InterestState.INACTIVE)));

        assertThat(interestAccrualService.calculateInterestDue("vault", 1L, DEBT)).isZero();
        verifyNoInteractions(blockClock);
    }

    @Test
    void collectInterest_advancesClockAndCreditsTreasury() {
        InterestState state = state(1_000L);
        when(interestVaultRepository.existsById("vault")).thenReturn(true);
        when(interestVaultRepository.findById("vault")).thenReturn(Optional.of(vault(500)));
        when(interestStateRepository.findById(KEY)).thenReturn(Optional.of(state));
        when(interestScheduleRepository.findById(InterestSchedule.DEFAULT_ID)).thenReturn(Optional.of(schedule()));
        when(blockClock.currentBlock()).thenReturn(8_300L);

        BigInteger interest = interestAccrualService.collectInterest("vault", "vault", "USDL", 1L, DEBT);

        assertThat(interest).isEqualTo(ONE_PERIOD);
        assertThat(state.getLastCollectionBlock()).isEqualTo(8_300L);
        assertThat(state.getTotalCollected()).isEqualTo(ONE_PERIOD);
        verify(interestStateRepository).save(state);
        verify(treasuryService).addInterest("USDL", ONE_PERIOD);
    }

    @Test
    void collectInterest_isNoOpBeforeAWholePeriod() {
        InterestState state = state(1_000L);
        when(interestVaultRepository.existsById("vault")).thenReturn(true);
        when(interestStateRepository.findById(KEY)).thenReturn(Optional.of(state));
        when(interestScheduleRepository.findById(InterestSchedule.DEFAULT_ID)).thenReturn(Optional.of(schedule()));
        when(blockClock.currentBlock()).thenReturn(1_500L);

        assertThat(interestAccrualService.collectInterest("vault", "vault", "USDL", 1L, DEBT)).isZero();

        assertThat(state.getLastCollectionBlock()).isEqualTo(1_000L);
        verify(interestStateRepository, never()).save(any());
        verifyNoInteractions(treasuryService);
    }

    @Test
    void collectInterest_rejectsDustThatRoundsToZero() {
        when(interestVaultRepository.existsById("vault")).thenReturn(true);
        when(interestVaultRepository.findById("vault")).thenReturn(Optional.of(vault(500)));
        when(interestStateRepository.findById(KEY)).thenReturn(Optional.of(state(1_000L)));
        when(interestScheduleRepository.findById(InterestSchedule.DEFAULT_ID)).thenReturn(Optional.of(schedule()));
        when(blockClock.currentBlock()).thenReturn(8_200L);

        assertThatThrownBy(() -> interestAccrualService.collectInterest("vault", "vault", "USDL", 1L, BigInteger.ONE))
                .isInstanceOf(LendingException.class)
                .extracting("errorCode")
                .isEqualTo(LendingErrorCode.NO_INTEREST_TO_COLLECT);
    }

    @Test
    void collectInterest_rejectsCallerOtherThanVault() {
        assertThatThrownBy(() -> interestAccrualService.collectInterest("alice", "vault", "USDL", 1L, DEBT))
                .isInstanceOf(LendingException.class)
                .extracting("errorCode")
                .isEqualTo(LendingErrorCode.VAULT_NOT_CALLER);
    }

    @Test
    void collectInterest_rejectsUnregisteredVault() {
        when(interestVaultRepository.existsById("vault")).thenReturn(false);

        assertThatThrownBy(() -> interestAccrualService.collectInterest("vault", "vault", "USDL", 1L, DEBT))
                .isInstanceOf(LendingException.class)
                .extracting("errorCode")
                .isEqualTo(LendingErrorCode.VAULT_NOT_REGISTERED);
    }

    @Test
    void registerVault_validatesRateAndDuplicates() {
        assertThatThrownBy(() -> interestAccrualService.registerVault("owner", "vault", 0))
                .isInstanceOf(LendingException.class)
                .extracting("errorCode")
                .isEqualTo(LendingErrorCode.INVALID_RATE);

        when(interestVaultRepository.existsById("vault")).thenReturn(true);
        assertThatThrownBy(() -> interestAccrualService.registerVault("owner", "vault", 500))
                .isInstanceOf(LendingException.class)
                .extracting("errorCode")
                .isEqualTo(LendingErrorCode.VAULT_ALREADY_REGISTERED);
        verify(interestVaultRepository, never()).save(any());
    }

    @Test
    void registerVault_requiresAdmin() {
        doThrow(new LendingException(LendingErrorCode.MISSING_ROLE, "mallory lacks role ADMIN"))
                .when(accessControlService).require("mallory", Permission.ADMIN);

        assertThatThrownBy(() -> interestAccrualService.registerVault("mallory", "vault", 500))
                .isInstanceOf(LendingException.class)
                .extracting("errorCode")
                .isEqualTo(LendingErrorCode.MISSING_ROLE);
        verifyNoInteractions(interestVaultRepository);
    }

    @Test
    void registerConfiguredVault_skipsVaultAlreadyOnRecord() {
        when(interestVaultRepository.existsById("vault")).thenReturn(true);

        assertThat(interestAccrualService.registerConfiguredVault("vault", 500)).isFalse();
        verify(interestVaultRepository, never()).save(any());
    }

    @Test
    void updatePeriodBlocks_recomputesPeriodShare() {
        InterestSchedule schedule = schedule();
        when(interestScheduleRepository.findById(InterestSchedule.DEFAULT_ID)).thenReturn(Optional.of(schedule));

        interestAccrualService.updatePeriodBlocks("owner", 14_400L);

        assertThat(schedule.getPeriodBlocks()).isEqualTo(14_400L);
        assertThat(schedule.getPeriodShare()).isEqualTo(new BigInteger("5479452054794520"));
        verify(interestScheduleRepository).save(schedule);
        verify(auditEventService).record(anyString(), anyString(), anyString());
    }

    @Test
    void schedule_isSeededFromPropertiesWhenMissing() {
        when(interestScheduleRepository.findById(InterestSchedule.DEFAULT_ID)).thenReturn(Optional.empty());
        when(interestScheduleRepository.save(any(InterestSchedule.class))).thenAnswer(invocation -> invocation.getArgument(0));

        InterestSchedule schedule = interestAccrualService.schedule();

        assertThat(schedule.getPeriodBlocks()).isEqualTo(7_200L);
        assertThat(schedule.getBlocksPerYear()).isEqualTo(2_628_000L);
        assertThat(schedule.getPeriodShare()).isEqualTo(new BigInteger("2739726027397260"));
    }

    @Test
    void deactivate_resetsExistingStateToDormant() {
        InterestState state = state(1_000L);
        when(interestStateRepository.findById(KEY)).thenReturn(Optional.of(state));

        interestAccrualService.deactivate("vault", 1L);

        assertThat(state.isActive()).isFalse();
        verify(interestStateRepository).save(state);
    }

    @Test
    void activate_anchorsNewStateAtCurrentBlock() {
        when(interestStateRepository.findById(KEY)).thenReturn(Optional.empty());
        when(blockClock.currentBlock()).thenReturn(4_242L);

        interestAccrualService.activate("vault", 1L);

        ArgumentCaptor<InterestState> captor = ArgumentCaptor.forClass(InterestState.class);
        verify(interestStateRepository).save(captor.capture());
        assertThat(captor.getValue().getId()).isEqualTo(KEY);
        assertThat(captor.getValue().getLastCollectionBlock()).isEqualTo(4_242L);
        assertThat(captor.getValue().getTotalCollected()).isZero();
    }

    @Test
    void activate_atGenesisBlockStaysActive() {
        when(interestStateRepository.findById(KEY)).thenReturn(Optional.empty());
        when(blockClock.currentBlock()).thenReturn(0L);

        interestAccrualService.activate("vault", 1L);

        ArgumentCaptor<InterestState> captor = ArgumentCaptor.forClass(InterestState.class);
        verify(interestStateRepository).save(captor.capture());
        assertThat(captor.getValue().getLastCollectionBlock()).isEqualTo(1L);
        assertThat(captor.getValue().isActive()).isTrue();
    }

    @Test
    void withdrawTreasury_mintsDrainedInterestToTreasury() {
        when(vaultSettingsService.current()).thenReturn(settings());
        when(treasuryService.drainPendingInterest("USDL")).thenReturn(ONE_PERIOD);

        BigInteger withdrawn = interestAccrualService.withdrawTreasury("owner", "USDL");

        assertThat(withdrawn).isEqualTo(ONE_PERIOD);
        verify(tokenGateway).mint("USDL", "treasury", ONE_PERIOD);
    }

    @Test
    void withdrawTreasury_rejectsNonDebtAsset() {
        when(vaultSettingsService.current()).thenReturn(settings());

        assertThatThrownBy(() -> interestAccrualService.withdrawTreasury("owner", "WETH"))
                .isInstanceOf(LendingException.class)
                .extracting("errorCode")
                .isEqualTo(LendingErrorCode.INVALID_ASSET);
        verifyNoInteractions(treasuryService, tokenGateway);
    }

    private void stubAccrual(long lastCollectionBlock, long currentBlock) {
        when(interestVaultRepository.findById("vault")).thenReturn(Optional.of(vault(500)));
        when(interestStateRepository.findById(KEY)).thenReturn(Optional.of(state(lastCollectionBlock)));
        when(interestScheduleRepository.findById(InterestSchedule.DEFAULT_ID)).thenReturn(Optional.of(schedule()));
        when(blockClock.currentBlock()).thenReturn(currentBlock);
    }

    private static InterestVault vault(int annualRateBips) {
        return InterestVault.builder().vaultAddress("vault").annualRateBips(annualRateBips).build();
    }

    private static InterestState state(long lastCollectionBlock) {
        return InterestState.builder()
                .id(KEY)
                .lastCollectionBlock(lastCollectionBlock)
                .totalCollected(BigInteger.ZERO)
                .build();
    }

    private static InterestSchedule schedule() {
        return InterestSchedule.builder()
                .id(InterestSchedule.DEFAULT_ID)
                .periodBlocks(7_200L)
                .blocksPerYear(2_628_000L)
                .periodShare(InterestAccrualService.periodShare(7_200L, 2_628_000L))
                .build();
    }

    private static VaultSettings settings() {
        return VaultSettings.builder()
                .vaultAddress("vault")
                .debtAsset("USDL")
                .treasury("treasury")
                .build();
    }
}
