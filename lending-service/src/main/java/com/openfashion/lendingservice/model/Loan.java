package com.openfashion.lendingservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "loans", indexes = {
        @Index(name = "idx_loans_borrower", columnList = "borrower")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Loan {

    // Assigned from the LOAN_COUNT statistic, never generated by the database.
    @Id
    private Long id;

    @Column(nullable = false)
    private String borrower;

    @Column(nullable = false)
    private long principal;

    @Column(nullable = false)
    private long collateral;

    @Column(nullable = false)
    private long interestRate;

    @Column(nullable = false)
    private long startBlock;

    @Column(nullable = false)
    private long lastUpdateBlock;

    @Version
    private Long version;
}
