package com.oitracker.repository.jpa;

import com.oitracker.domain.enums.TradeSetupStatus;
import com.oitracker.entity.TradeSetupEntity;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the trade_setups table.
 * Supports finding the live (PENDING/ACTIVE) setup and resolved setups for statistics.
 */
@Repository
public interface TradeSetupJpaRepository extends JpaRepository<TradeSetupEntity, Long> {

    Optional<TradeSetupEntity> findFirstByStatusInOrderByCreatedAtDesc(Collection<TradeSetupStatus> statuses);

    Optional<TradeSetupEntity> findFirstByOrderByCreatedAtDesc();

    List<TradeSetupEntity> findByStatusInAndResolvedAtGreaterThanEqualOrderByResolvedAtDesc(
            Collection<TradeSetupStatus> statuses, LocalDateTime since);

    List<TradeSetupEntity> findByCreatedAtGreaterThanEqualOrderByCreatedAtDesc(LocalDateTime since);
}
