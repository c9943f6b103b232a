package com.arbtrader.persistence;

import com.arbtrader.domain.model.DailyAggregate;
import com.arbtrader.domain.model.RiskEventRecord;
import com.arbtrader.domain.model.TradeRecord;
import com.arbtrader.entity.RiskEventEntity;
import com.arbtrader.entity.TradeEntity;
import com.arbtrader.exception.PersistenceException;
import com.arbtrader.mapper.RiskEventMapper;
import com.arbtrader.mapper.TradeRecordMapper;
import com.arbtrader.repository.RiskEventJpaRepository;
import com.arbtrader.repository.TradeJpaRepository;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link TradeJournal} backed by Spring Data JPA over the {@code trades} and
 * {@code risk_events} tables.
 *
 * <p>Trade ids are assigned here (UUID) when the caller left them empty. Spring's
 * {@link DataAccessException} is translated to {@link PersistenceException}.
 */
@Service
public class JpaTradeJournal implements TradeJournal {

    private static final Logger log = LoggerFactory.getLogger(JpaTradeJournal.class);

    private final TradeJpaRepository tradeJpaRepository;
    private final RiskEventJpaRepository riskEventJpaRepository;
    private final TradeRecordMapper tradeRecordMapper;
    private final RiskEventMapper riskEventMapper;

    public JpaTradeJournal(
            TradeJpaRepository tradeJpaRepository,
            RiskEventJpaRepository riskEventJpaRepository,
            TradeRecordMapper tradeRecordMapper,
            RiskEventMapper riskEventMapper) {
        this.tradeJpaRepository = tradeJpaRepository;
        this.riskEventJpaRepository = riskEventJpaRepository;
        this.tradeRecordMapper = tradeRecordMapper;
        this.riskEventMapper = riskEventMapper;
    }

    @Override
    @Transactional
    public TradeRecord saveTrade(TradeRecord trade) {
        if (trade.getId() == null) {
            trade.setId(UUID.randomUUID().toString());
        }
        try {
            TradeEntity saved = tradeJpaRepository.save(tradeRecordMapper.toEntity(trade));
            log.debug("Trade {} journaled for route {}", saved.getId(), saved.getRouteId());
            return tradeRecordMapper.toDomain(saved);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to save trade " + trade.getId(), e);
        }
    }

    @Override
    @Transactional
    public RiskEventRecord saveRiskEvent(RiskEventRecord event) {
        try {
            RiskEventEntity saved = riskEventJpaRepository.save(riskEventMapper.toEntity(event));
            log.debug("Risk event {} journaled with id {}", saved.getType(), saved.getId());
            return riskEventMapper.toDomain(saved);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to save risk event " + event.getType(), e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public DailyAggregate getDailyAggregate(LocalDate date) {
        Instant from = date.atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant to = date.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();

        long tradeCount = tradeJpaRepository.countTrades(from, to);
        if (tradeCount == 0) {
            return DailyAggregate.empty(date);
        }
        BigDecimal dailyPnl = tradeJpaRepository.sumRealizedPnl(from, to);
        long wins = tradeJpaRepository.countWinningTrades(from, to);

        return DailyAggregate.builder()
                .date(date)
                .dailyPnl(dailyPnl)
                .tradeCount((int) tradeCount)
                .winRate((double) wins / tradeCount)
                .build();
    }

    @Override
    @Transactional(readOnly = true)
    public List<TradeRecord> getRecentTrades(int limit) {
        return tradeRecordMapper.toDomainList(tradeJpaRepository.findRecent(PageRequest.of(0, limit)));
    }

    @Override
    @Transactional(readOnly = true)
    public List<TradeRecord> getTradesSince(Instant since) {
        return tradeRecordMapper.toDomainList(
                tradeJpaRepository.findByExecutedAtGreaterThanEqualOrderByExecutedAtDesc(since));
    }
}
