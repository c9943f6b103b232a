package com.arbtrader.repository;

import com.arbtrader.entity.TradeEntity;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the trades table.
 * Daily aggregation queries take a half-open [from, to) instant range.
 */
@Repository
public interface TradeJpaRepository extends JpaRepository<TradeEntity, String> {

    @Query("SELECT t FROM TradeEntity t ORDER BY t.executedAt DESC")
    List<TradeEntity> findRecent(Pageable pageable);

    List<TradeEntity> findByExecutedAtGreaterThanEqualOrderByExecutedAtDesc(Instant since);

    @Query("SELECT COALESCE(SUM(t.realizedProfitUsd), 0) FROM TradeEntity t "
            + "WHERE t.executedAt >= :from AND t.executedAt < :to AND t.realizedProfitUsd IS NOT NULL")
    BigDecimal sumRealizedPnl(@Param("from") Instant from, @Param("to") Instant to);

    @Query("SELECT COUNT(t) FROM TradeEntity t "
            + "WHERE t.executedAt >= :from AND t.executedAt < :to AND t.realizedProfitUsd IS NOT NULL")
    long countTrades(@Param("from") Instant from, @Param("to") Instant to);

    @Query("SELECT COUNT(t) FROM TradeEntity t "
            + "WHERE t.executedAt >= :from AND t.executedAt < :to AND t.realizedProfitUsd > 0")
    long countWinningTrades(@Param("from") Instant from, @Param("to") Instant to);
}
