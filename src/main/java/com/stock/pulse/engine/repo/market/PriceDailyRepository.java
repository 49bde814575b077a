package com.stock.pulse.engine.repo.market;

import com.stock.pulse.engine.model.entity.market.PriceDailyEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface PriceDailyRepository extends JpaRepository<PriceDailyEntity, Long> {

    Optional<PriceDailyEntity> findBySymbolAndTradeDate(String symbol, LocalDate tradeDate);

    Optional<PriceDailyEntity> findTopBySymbolOrderByTradeDateDesc(String symbol);

    List<PriceDailyEntity> findBySymbolAndTradeDateGreaterThanEqualOrderByTradeDateAsc(String symbol, LocalDate from);

    long countBySymbol(String symbol);
}
