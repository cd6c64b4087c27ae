package com.openfashion.ammservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "oracle_prices")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OraclePrice {

    @Id
    @Column(length = 64)
    private String asset;

    @Column(nullable = false)
    private long price;

    @Column(nullable = false)
    private long updatedAtBlock;

    @Version
    private Long version;
}
