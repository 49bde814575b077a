package com.stock.pulse.engine.repo.market;

import com.stock.pulse.engine.model.entity.market.ShareholdingQuarterlyEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;

@Repository
public interface ShareholdingQuarterlyRepository extends JpaRepository<ShareholdingQuarterlyEntity, Long> {

    Optional<ShareholdingQuarterlyEntity> findBySymbolAndQuarterEnd(String symbol, LocalDate quarterEnd);

    Optional<ShareholdingQuarterlyEntity> findTopBySymbolOrderByQuarterEndDesc(String symbol);
}
