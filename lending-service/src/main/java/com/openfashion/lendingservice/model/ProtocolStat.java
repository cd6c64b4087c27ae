package com.openfashion.lendingservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "protocol_stats")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProtocolStat {

    @Id
    @Column(length = 40)
    private String name;

    @Column(name = "stat_value", nullable = false)
    private long value;

    @Version
    private Long version;

    public ProtocolStat(StatKey key) {
        this(key.name(), 0L, null);
    }
}
