package com.stock.pulse.engine.repo.market;

import com.stock.pulse.engine.model.entity.market.TechnicalIndicatorEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;

@Repository
public interface TechnicalIndicatorRepository extends JpaRepository<TechnicalIndicatorEntity, Long> {

    Optional<TechnicalIndicatorEntity> findBySymbolAndTradeDate(String symbol, LocalDate tradeDate);

    Optional<TechnicalIndicatorEntity> findTopBySymbolOrderByTradeDateDesc(String symbol);
}
