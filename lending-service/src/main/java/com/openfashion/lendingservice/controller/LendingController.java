package com.openfashion.lendingservice.controller;

import com.openfashion.lendingservice.dto.*;
import com.openfashion.lendingservice.service.LendingService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/lending")
@RequiredArgsConstructor
public class LendingController {

    private static final String ACCOUNT_HEADER = "X-Account-ID";

    private final LendingService lendingService;

    @PostMapping("/deposits")
    public ResponseEntity<Void> deposit(@RequestHeader(ACCOUNT_HEADER) String caller,
                                        @RequestBody AmountRequest request) {
        lendingService.deposit(caller, request.amount());
        return new ResponseEntity<>(HttpStatus.CREATED);
    }

    @PostMapping("/withdrawals")
    public ResponseEntity<Void> withdraw(@RequestHeader(ACCOUNT_HEADER) String caller,
                                         @RequestBody AmountRequest request) {
        lendingService.withdraw(caller, request.amount());
        return new ResponseEntity<>(HttpStatus.OK);
    }

    @PostMapping("/loans")
    public ResponseEntity<BorrowResponse> borrow(@RequestHeader(ACCOUNT_HEADER) String caller,
                                                 @RequestBody BorrowRequest request) {
        long loanId = lendingService.borrow(caller, request.amount(), request.collateralAmount());
        return new ResponseEntity<>(new BorrowResponse(loanId), HttpStatus.CREATED);
    }

    @PostMapping("/loans/{loanId}/repayments")
    public ResponseEntity<RepaymentResponse> repay(@RequestHeader(ACCOUNT_HEADER) String caller,
                                                   @PathVariable long loanId,
                                                   @RequestBody AmountRequest request) {
        return ResponseEntity.ok(lendingService.repay(caller, loanId, request.amount()));
    }

    @PostMapping("/loans/{loanId}/liquidation")
    public ResponseEntity<Long> liquidate(@RequestHeader(ACCOUNT_HEADER) String caller,
                                          @PathVariable long loanId) {
        return ResponseEntity.ok(lendingService.liquidate(caller, loanId));
    }

    @GetMapping("/loans/{loanId}")
    public LoanDetails getLoan(@PathVariable long loanId) {
        return lendingService.getLoanDetails(loanId);
    }

    @GetMapping("/loans/{loanId}/owed")
    public long getAmountOwed(@PathVariable long loanId) {
        return lendingService.getAmountOwed(loanId);
    }

    @GetMapping("/loans/{loanId}/health")
    public boolean isHealthy(@PathVariable long loanId) {
        return lendingService.isHealthy(loanId);
    }

    @GetMapping("/accounts/{accountId}/position")
    public AccountPosition getPosition(@PathVariable String accountId) {
        return lendingService.getPosition(accountId);
    }

    @GetMapping("/accounts/{accountId}/loans")
    public List<LoanDetails> getLoans(@PathVariable String accountId) {
        return lendingService.getLoans(accountId);
    }

    @GetMapping("/stats")
    public ProtocolStats getStats() {
        return lendingService.getProtocolStats();
    }

    @GetMapping("/utilization")
    public long getUtilization() {
        return lendingService.getUtilizationRate();
    }
}
