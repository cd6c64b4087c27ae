package com.openfashion.lendingservice.service.imp;

import com.openfashion.lendingservice.core.config.LendingProperties;
import com.openfashion.lendingservice.core.exceptions.*;
import com.openfashion.lendingservice.core.util.LedgerMath;
import com.openfashion.lendingservice.dto.*;
import com.openfashion.lendingservice.dto.event.BalanceChangedEvent;
import com.openfashion.lendingservice.dto.event.LoanCreatedEvent;
import com.openfashion.lendingservice.dto.event.LoanLiquidatedEvent;
import com.openfashion.lendingservice.dto.event.LoanRepaidEvent;
import com.openfashion.lendingservice.model.*;
import com.openfashion.lendingservice.repository.BalanceRepository;
import com.openfashion.lendingservice.repository.LoanRepository;
import com.openfashion.lendingservice.repository.ProtocolStatRepository;
import com.openfashion.lendingservice.service.AssetTransferService;
import com.openfashion.lendingservice.service.BlockClock;
import com.openfashion.lendingservice.service.LendingService;
import com.openfashion.lendingservice.service.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class LendingServiceImp implements LendingService {

    private final BalanceRepository balanceRepository;
    private final LoanRepository loanRepository;
    private final ProtocolStatRepository statRepository;
    private final AssetTransferService assetTransferService;
    private final OutboxService outboxService;
    private final BlockClock blockClock;
    private final LendingProperties properties;

    private static final String DEPOSIT_EVENT = "DEPOSIT";
    private static final String WITHDRAWAL_EVENT = "WITHDRAWAL";
    private static final String LOAN_CREATED_EVENT = "LOAN_CREATED";
    private static final String LOAN_REPAID_EVENT = "LOAN_REPAID";
    private static final String LOAN_LIQUIDATED_EVENT = "LOAN_LIQUIDATED";

    @Override
    @Transactional
    public void deposit(String caller, long amount) {
        requirePositive(amount, "Deposit amount");

        long balance = LedgerMath.add(balanceRepository.balanceOf(caller, BalanceKind.DEPOSIT), amount);
        long totalDeposited = LedgerMath.add(statRepository.valueOf(StatKey.TOTAL_DEPOSITED), amount);
        long block = blockClock.currentBlock();

        transfer(amount, caller, properties.getCustodian());

        writeBalance(caller, BalanceKind.DEPOSIT, balance);
        writeStat(StatKey.TOTAL_DEPOSITED, totalDeposited);

        outboxService.record(DEPOSIT_EVENT, caller, new BalanceChangedEvent(caller, amount, balance, block));
        log.info("Account {} deposited {} (balance {})", caller, amount, balance);
    }

    @Override
    @Transactional
    public void withdraw(String caller, long amount) {
        requirePositive(amount, "Withdrawal amount");

        long balance = remaining(caller, balanceRepository.balanceOf(caller, BalanceKind.DEPOSIT), amount);
        long totalDeposited = remaining(StatKey.TOTAL_DEPOSITED, statRepository.valueOf(StatKey.TOTAL_DEPOSITED), amount);
        long block = blockClock.currentBlock();

        transfer(amount, properties.getCustodian(), caller);

        writeBalance(caller, BalanceKind.DEPOSIT, balance);
        writeStat(StatKey.TOTAL_DEPOSITED, totalDeposited);

        outboxService.record(WITHDRAWAL_EVENT, caller, new BalanceChangedEvent(caller, amount, balance, block));
        log.info("Account {} withdrew {} (balance {})", caller, amount, balance);
    }

    @Override
    @Transactional
    public long borrow(String caller, long amount, long collateralAmount) {
        requirePositive(amount, "Loan amount");
        requirePositive(collateralAmount, "Collateral amount");
        if (amount > properties.getMaxLoanAmount()) {
            throw new InvalidAmountException("Loan amount " + amount + " exceeds maximum " + properties.getMaxLoanAmount());
        }

        // ratio is checked on the account's aggregate position, not this loan alone
        long borrowed = LedgerMath.add(balanceRepository.balanceOf(caller, BalanceKind.BORROW), amount);
        long collateral = LedgerMath.add(balanceRepository.balanceOf(caller, BalanceKind.COLLATERAL), collateralAmount);
        long ratio = LedgerMath.collateralRatio(collateral, borrowed);
        if (ratio < properties.getMinCollateralRatio()) {
            throw new InvalidCollateralRatioException(ratio, properties.getMinCollateralRatio());
        }

        long loanId = LedgerMath.add(statRepository.valueOf(StatKey.LOAN_COUNT), 1L);
        long totalBorrowed = LedgerMath.add(statRepository.valueOf(StatKey.TOTAL_BORROWED), amount);
        long block = blockClock.currentBlock();

        transfer(collateralAmount, caller, properties.getCustodian());
        transfer(amount, properties.getCustodian(), caller);

        writeBalance(caller, BalanceKind.BORROW, borrowed);
        writeBalance(caller, BalanceKind.COLLATERAL, collateral);

        Loan loan = Loan.builder()
                .id(loanId)
                .borrower(caller)
                .principal(amount)
                .collateral(collateralAmount)
                .interestRate(properties.getInterestRatePerBlock())
                .startBlock(block)
                .lastUpdateBlock(block)
                .build();
        loanRepository.save(loan);

        writeStat(StatKey.LOAN_COUNT, loanId);
        writeStat(StatKey.TOTAL_BORROWED, totalBorrowed);

        outboxService.record(LOAN_CREATED_EVENT, String.valueOf(loanId), new LoanCreatedEvent(
                loanId, caller, amount, collateralAmount, loan.getInterestRate(), block));
        log.info("Loan {} opened by {}: principal {}, collateral {}, aggregate ratio {}",
                loanId, caller, amount, collateralAmount, ratio);

        return loanId;
    }

    @Override
    @Transactional
    public RepaymentResponse repay(String caller, long loanId, long amount) {
        Loan loan = findLoan(loanId);
        if (!loan.getBorrower().equals(caller)) {
            throw new UnauthorizedException(caller, "repay loan " + loanId);
        }

        long block = blockClock.currentBlock();
        // accrues from the last principal update, unlike liquidation which accrues from origination
        long interest = LedgerMath.interest(loan.getPrincipal(), loan.getInterestRate(), block - loan.getLastUpdateBlock());
        long totalOwed = LedgerMath.add(loan.getPrincipal(), interest);

        if (amount <= 0 || amount > totalOwed) {
            throw new InvalidAmountException("Repayment must be between 1 and " + totalOwed + ", got " + amount);
        }

        RepaymentResponse response;
        if (amount >= totalOwed) {
            long principal = loan.getPrincipal();
            long borrowed = remaining(caller, balanceRepository.balanceOf(caller, BalanceKind.BORROW), principal);
            long totalBorrowed = remaining(StatKey.TOTAL_BORROWED, statRepository.valueOf(StatKey.TOTAL_BORROWED), principal);

            transfer(amount, caller, properties.getCustodian());

            loanRepository.delete(loan);
            writeBalance(caller, BalanceKind.BORROW, borrowed);
            writeStat(StatKey.TOTAL_BORROWED, totalBorrowed);

            response = new RepaymentResponse(loanId, amount, interest, 0L, true);
            log.info("Loan {} fully repaid by {} ({} incl. {} interest)", loanId, caller, amount, interest);
        } else {
            transfer(amount, caller, properties.getCustodian());

            loan.setPrincipal(totalOwed - amount);
            loan.setLastUpdateBlock(block);
            loanRepository.save(loan);

            response = new RepaymentResponse(loanId, amount, interest, loan.getPrincipal(), false);
            log.info("Loan {} partially repaid by {}: paid {}, principal now {}", loanId, caller, amount, loan.getPrincipal());
        }

        outboxService.record(LOAN_REPAID_EVENT, String.valueOf(loanId), new LoanRepaidEvent(
                loanId, caller, amount, interest, response.remainingPrincipal(), response.fullRepayment(), block));
        return response;
    }

    @Override
    @Transactional
    public long liquidate(String caller, long loanId) {
        Loan loan = findLoan(loanId);

        long block = blockClock.currentBlock();
        long totalOwed = owedSinceOrigination(loan, block);
        long ratio = LedgerMath.collateralRatio(loan.getCollateral(), totalOwed);
        if (ratio >= properties.getMinCollateralRatio()) {
            throw new InvalidCollateralRatioException(ratio, properties.getMinCollateralRatio());
        }

        String borrower = loan.getBorrower();
        long collateral = remaining(borrower, balanceRepository.balanceOf(borrower, BalanceKind.COLLATERAL), loan.getCollateral());
        long borrowed = remaining(borrower, balanceRepository.balanceOf(borrower, BalanceKind.BORROW), loan.getPrincipal());
        long totalBorrowed = remaining(StatKey.TOTAL_BORROWED, statRepository.valueOf(StatKey.TOTAL_BORROWED), loan.getPrincipal());

        transfer(loan.getCollateral(), properties.getCustodian(), caller);

        loanRepository.delete(loan);
        writeBalance(borrower, BalanceKind.COLLATERAL, collateral);
        writeBalance(borrower, BalanceKind.BORROW, borrowed);
        writeStat(StatKey.TOTAL_BORROWED, totalBorrowed);

        outboxService.record(LOAN_LIQUIDATED_EVENT, String.valueOf(loanId), new LoanLiquidatedEvent(
                loanId, borrower, caller, loan.getPrincipal(), loan.getCollateral(), totalOwed, ratio, block));
        log.warn("Loan {} of {} liquidated by {} at ratio {}", loanId, borrower, caller, ratio);

        return loan.getCollateral();
    }

    @Override
    @Transactional(readOnly = true)
    public long getDepositBalance(String accountId) {
        return balanceRepository.balanceOf(accountId, BalanceKind.DEPOSIT);
    }

    @Override
    @Transactional(readOnly = true)
    public long getBorrowBalance(String accountId) {
        return balanceRepository.balanceOf(accountId, BalanceKind.BORROW);
    }

    @Override
    @Transactional(readOnly = true)
    public long getCollateralBalance(String accountId) {
        return balanceRepository.balanceOf(accountId, BalanceKind.COLLATERAL);
    }

    @Override
    @Transactional(readOnly = true)
    public AccountPosition getPosition(String accountId) {
        return new AccountPosition(
                accountId,
                balanceRepository.balanceOf(accountId, BalanceKind.DEPOSIT),
                balanceRepository.balanceOf(accountId, BalanceKind.BORROW),
                balanceRepository.balanceOf(accountId, BalanceKind.COLLATERAL)
        );
    }

    @Override
    @Transactional(readOnly = true)
    public LoanDetails getLoanDetails(long loanId) {
        return LoanDetails.from(findLoan(loanId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<LoanDetails> getLoans(String borrower) {
        return loanRepository.findAllByBorrower(borrower).stream()
                .map(LoanDetails::from)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public long getAmountOwed(long loanId) {
        Loan loan = findLoan(loanId);
        long interest = LedgerMath.interest(loan.getPrincipal(), loan.getInterestRate(),
                blockClock.currentBlock() - loan.getLastUpdateBlock());
        return LedgerMath.add(loan.getPrincipal(), interest);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isHealthy(long loanId) {
        long block = blockClock.currentBlock();
        return loanRepository.findById(loanId)
                .map(loan -> LedgerMath.collateralRatio(loan.getCollateral(), owedSinceOrigination(loan, block))
                        >= properties.getMinCollateralRatio())
                .orElse(false);
    }

    @Override
    @Transactional(readOnly = true)
    public ProtocolStats getProtocolStats() {
        return new ProtocolStats(
                statRepository.valueOf(StatKey.TOTAL_DEPOSITED),
                statRepository.valueOf(StatKey.TOTAL_BORROWED),
                statRepository.valueOf(StatKey.LOAN_COUNT)
        );
    }

    @Override
    @Transactional(readOnly = true)
    public long getUtilizationRate() {
        long totalDeposited = statRepository.valueOf(StatKey.TOTAL_DEPOSITED);
        if (totalDeposited == 0) return 0L;
        return LedgerMath.mulDiv(statRepository.valueOf(StatKey.TOTAL_BORROWED), LedgerMath.PERCENT, totalDeposited);
    }

    private long owedSinceOrigination(Loan loan, long block) {
        long interest = LedgerMath.interest(loan.getPrincipal(), loan.getInterestRate(), block - loan.getStartBlock());
        return LedgerMath.add(loan.getPrincipal(), interest);
    }

    private Loan findLoan(long loanId) {
        return loanRepository.findById(loanId)
                .orElseThrow(() -> new LoanNotFoundException(loanId));
    }

    private void requirePositive(long amount, String what) {
        if (amount <= 0) {
            throw new InvalidAmountException(what + " must be positive, got " + amount);
        }
    }

    // Balances never go below zero: a would-be negative result aborts the operation.
    private long remaining(String owner, long available, long requested) {
        if (requested > available) {
            throw new InsufficientFundsException(owner, requested, available);
        }
        return available - requested;
    }

    private long remaining(StatKey counter, long available, long requested) {
        if (requested > available) {
            throw new InsufficientFundsException(counter, requested, available);
        }
        return available - requested;
    }

    private void transfer(long amount, String from, String to) {
        TransferResult result = assetTransferService.transfer(properties.getAsset(), amount, from, to);
        if (!result.success()) {
            log.error("Transfer of {} {} from {} to {} failed: {}", amount, properties.getAsset(), from, to, result.failureReason());
            throw new TransferFailedException(from, to, amount, result.failureReason());
        }
    }

    private void writeBalance(String accountId, BalanceKind kind, long amount) {
        Balance balance = balanceRepository.findByAccountIdAndKind(accountId, kind)
                .orElseGet(() -> Balance.builder().accountId(accountId).kind(kind).build());
        balance.setAmount(amount);
        balanceRepository.save(balance);
    }

    private void writeStat(StatKey key, long value) {
        ProtocolStat stat = statRepository.findById(key.name())
                .orElseGet(() -> new ProtocolStat(key));
        stat.setValue(value);
        statRepository.save(stat);
    }
}
