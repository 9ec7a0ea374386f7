package com.oitracker.service;

import com.oitracker.domain.enums.TradeSetupStatus;
import com.oitracker.domain.model.TradeSetup;
import com.oitracker.domain.model.TradeSetupStats;
import com.oitracker.entity.TradeSetupEntity;
import com.oitracker.exception.ResourceNotFoundException;
import com.oitracker.mapper.TradeSetupMapper;
import com.oitracker.repository.jpa.TradeSetupJpaRepository;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Durable store for trade setups.
 *
 * <p>Create, read and update-by-id only; each call is a single-row transaction. The live
 * setup is the newest PENDING or ACTIVE row.
 */
@Service
public class TradeSetupService {

    private static final Logger log = LoggerFactory.getLogger(TradeSetupService.class);

    static final int DEFAULT_STATS_LOOKBACK_DAYS = 30;

    private static final EnumSet<TradeSetupStatus> LIVE_STATUSES =
            EnumSet.of(TradeSetupStatus.PENDING, TradeSetupStatus.ACTIVE);

    private static final EnumSet<TradeSetupStatus> RESOLVED_STATUSES =
            EnumSet.of(TradeSetupStatus.WON, TradeSetupStatus.LOST);

    private final TradeSetupJpaRepository tradeSetupJpaRepository;
    private final TradeSetupMapper tradeSetupMapper;
    private final TradeSetupStatsCalculator tradeSetupStatsCalculator;

    public TradeSetupService(
            TradeSetupJpaRepository tradeSetupJpaRepository,
            TradeSetupMapper tradeSetupMapper,
            TradeSetupStatsCalculator tradeSetupStatsCalculator) {
        this.tradeSetupJpaRepository = tradeSetupJpaRepository;
        this.tradeSetupMapper = tradeSetupMapper;
        this.tradeSetupStatsCalculator = tradeSetupStatsCalculator;
    }

    /**
     * Persists a new setup and assigns its generated id to the passed instance.
     */
    @Transactional
    public TradeSetup create(TradeSetup tradeSetup) {
        TradeSetupEntity saved = tradeSetupJpaRepository.save(tradeSetupMapper.toEntity(tradeSetup));
        tradeSetup.setId(saved.getId());
        log.info(
                "Trade setup saved: id={}, {} {} {}",
                saved.getId(),
                saved.getDirection(),
                saved.getStrike(),
                saved.getStatus());
        return tradeSetup;
    }

    /**
     * @throws ResourceNotFoundException if no setup has this id
     */
    public TradeSetup findById(Long id) {
        return tradeSetupJpaRepository
                .findById(id)
                .map(tradeSetupMapper::toDomain)
                .orElseThrow(() -> new ResourceNotFoundException("TradeSetup", String.valueOf(id)));
    }

    /** The PENDING or ACTIVE setup, if any. */
    public Optional<TradeSetup> findLive() {
        return tradeSetupJpaRepository
                .findFirstByStatusInOrderByCreatedAtDesc(LIVE_STATUSES)
                .map(tradeSetupMapper::toDomain);
    }

    /** The most recently created setup in any status. */
    public Optional<TradeSetup> findLatest() {
        return tradeSetupJpaRepository.findFirstByOrderByCreatedAtDesc().map(tradeSetupMapper::toDomain);
    }

    /**
     * Writes the setup's current state over its row.
     *
     * @throws ResourceNotFoundException if the setup was never created
     */
    @Transactional
    public TradeSetup update(TradeSetup tradeSetup) {
        if (tradeSetup.getId() == null) {
            throw new ResourceNotFoundException("TradeSetup", "null");
        }
        TradeSetupEntity entity = tradeSetupJpaRepository
                .findById(tradeSetup.getId())
                .orElseThrow(() -> new ResourceNotFoundException("TradeSetup", String.valueOf(tradeSetup.getId())));
        tradeSetupMapper.updateEntity(tradeSetup, entity);
        tradeSetupJpaRepository.save(entity);
        log.debug("Trade setup updated: id={}, status={}", entity.getId(), entity.getStatus());
        return tradeSetup;
    }

    /** WON and LOST setups resolved at or after {@code since}, most recently resolved first. */
    public List<TradeSetup> findResolvedSince(LocalDateTime since) {
        return tradeSetupMapper.toDomainList(
                tradeSetupJpaRepository.findByStatusInAndResolvedAtGreaterThanEqualOrderByResolvedAtDesc(
                        RESOLVED_STATUSES, since));
    }

    public TradeSetupStats getStats(LocalDateTime now) {
        return getStats(now, DEFAULT_STATS_LOOKBACK_DAYS);
    }

    public TradeSetupStats getStats(LocalDateTime now, int lookbackDays) {
        List<TradeSetupEntity> entities =
                tradeSetupJpaRepository.findByCreatedAtGreaterThanEqualOrderByCreatedAtDesc(now.minusDays(lookbackDays));
        return tradeSetupStatsCalculator.calculate(tradeSetupMapper.toDomainList(entities));
    }
}
