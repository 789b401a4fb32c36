package com.tickdata.repository;

import com.tickdata.domain.model.DateRange;
import com.tickdata.domain.model.Tick;
import com.tickdata.entity.TickEntity;
import com.tickdata.exception.TickStoreException;
import com.tickdata.mapper.TickMapper;
import com.tickdata.repository.jpa.TickJpaRepository;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * PostgreSQL-backed tick store (the default, {@code tickdata.store.type=jpa}).
 *
 * <p>Reads and writes go through Spring Data JPA; connections are acquired per transaction
 * and released by Spring on every exit path, including failures. The table DDL is issued
 * through JdbcTemplate because it predates the entity and is shared with other loaders.
 */
@Repository
@ConditionalOnProperty(prefix = "tickdata.store", name = "type", havingValue = "jpa", matchIfMissing = true)
public class JpaTickStore implements TickStore {

    private static final Logger log = LoggerFactory.getLogger(JpaTickStore.class);

    static final String CREATE_TABLE_SQL =
            """
            CREATE TABLE IF NOT EXISTS tbt (
                id              BIGSERIAL PRIMARY KEY,
                datetime        TIMESTAMP NOT NULL,
                ticker          VARCHAR(20) NOT NULL,
                ltp             DOUBLE PRECISION,
                buy_price       DOUBLE PRECISION,
                buy_qty         BIGINT,
                sell_price      DOUBLE PRECISION,
                sell_qty        BIGINT,
                ltq             BIGINT,
                open_interest   BIGINT
            )
            """;

    static final String CREATE_INDEX_SQL = "CREATE INDEX IF NOT EXISTS idx_tbt_ticker_datetime ON tbt (ticker, datetime)";

    private final TickJpaRepository tickJpaRepository;
    private final JdbcTemplate jdbcTemplate;
    private final TickMapper tickMapper = Mappers.getMapper(TickMapper.class);

    public JpaTickStore(TickJpaRepository tickJpaRepository, JdbcTemplate jdbcTemplate) {
        this.tickJpaRepository = tickJpaRepository;
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void ensureSchema() {
        try {
            jdbcTemplate.execute(CREATE_TABLE_SQL);
            jdbcTemplate.execute(CREATE_INDEX_SQL);
        } catch (DataAccessException e) {
            throw new TickStoreException("Failed to create tbt table", e);
        }
    }

    @Override
    @Transactional
    public void insertTicks(List<Tick> ticks) {
        if (ticks.isEmpty()) {
            return;
        }
        try {
            List<TickEntity> entities = tickMapper.toEntityList(ticks);
            tickJpaRepository.saveAll(entities);
            log.debug("Inserted {} ticks", entities.size());
        } catch (DataAccessException e) {
            throw new TickStoreException("Failed to insert " + ticks.size() + " ticks", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Tick> fetchTicksInRange(DateRange range, String instrumentId) {
        try {
            List<TickEntity> entities = instrumentId == null || instrumentId.isBlank()
                    ? tickJpaRepository.findInRange(range.startInclusive(), range.endExclusive())
                    : tickJpaRepository.findByInstrumentInRange(
                            instrumentId, range.startInclusive(), range.endExclusive());
            return tickMapper.toDomainList(entities);
        } catch (DataAccessException e) {
            throw new TickStoreException("Failed to query ticks for " + range, e);
        }
    }
}
