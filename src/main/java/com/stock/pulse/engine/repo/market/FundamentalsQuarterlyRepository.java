package com.stock.pulse.engine.repo.market;

import com.stock.pulse.engine.model.entity.market.FundamentalsQuarterlyEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;

@Repository
public interface FundamentalsQuarterlyRepository extends JpaRepository<FundamentalsQuarterlyEntity, Long> {

    Optional<FundamentalsQuarterlyEntity> findBySymbolAndPeriodEndAndPeriodType(String symbol, LocalDate periodEnd, String periodType);

    Optional<FundamentalsQuarterlyEntity> findTopBySymbolOrderByPeriodEndDesc(String symbol);
}
