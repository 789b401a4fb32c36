package com.tickdata.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the tbt (tick-by-tick) table.
 * One row per trade as delivered in the daily tick archive; the DDL lives in
 * {@link com.tickdata.repository.JpaTickStore#ensureSchema()}.
 */
@Entity
@Table(name = "tbt")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TickEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "datetime", nullable = false)
    private LocalDateTime timestamp;

    @Column(name = "ticker", length = 20, nullable = false)
    private String instrumentId;

    @Column(name = "ltp")
    private Double lastPrice;

    @Column(name = "buy_price")
    private Double buyPrice;

    @Column(name = "buy_qty")
    private Long buyQty;

    @Column(name = "sell_price")
    private Double sellPrice;

    @Column(name = "sell_qty")
    private Long sellQty;

    @Column(name = "ltq")
    private Long lastQty;

    @Column(name = "open_interest")
    private Long openInterest;
}
