package com.tickpipe.store;

import com.tickpipe.domain.model.DepthLevel;
import com.tickpipe.domain.model.FlushResult;
import com.tickpipe.domain.model.Tick;
import com.tickpipe.entity.DepthRowEntity;
import com.tickpipe.entity.TickRowEntity;
import com.tickpipe.mapper.TickRowMapper;
import com.tickpipe.repository.jpa.DepthRowJpaRepository;
import com.tickpipe.repository.jpa.TickRowJpaRepository;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes a flush batch as tick rows plus their depth rows in one transaction.
 */
@Component
public class JpaTickRowWriter implements TickRowWriter {

    private final TickRowJpaRepository tickRowJpaRepository;
    private final DepthRowJpaRepository depthRowJpaRepository;
    private final TickRowMapper tickRowMapper;

    public JpaTickRowWriter(
            TickRowJpaRepository tickRowJpaRepository,
            DepthRowJpaRepository depthRowJpaRepository,
            TickRowMapper tickRowMapper) {
        this.tickRowJpaRepository = tickRowJpaRepository;
        this.depthRowJpaRepository = depthRowJpaRepository;
        this.tickRowMapper = tickRowMapper;
    }

    @Override
    @Transactional
    public FlushResult write(List<Tick> ticks) {
        List<TickRowEntity> rows = new ArrayList<>(ticks.size());
        for (Tick tick : ticks) {
            TickRowEntity row = tickRowMapper.toEntity(tick);
            row.setTradeDate(TickStore.tradeDateOf(tick));
            rows.add(row);
        }
        List<TickRowEntity> saved = tickRowJpaRepository.saveAll(rows);

        // saveAll keeps input order, so saved.get(i) is the row of ticks.get(i)
        List<DepthRowEntity> depthRows = new ArrayList<>();
        for (int i = 0; i < ticks.size(); i++) {
            Long tickId = saved.get(i).getId();
            addDepth(depthRows, tickId, DepthRowEntity.SIDE_BUY, ticks.get(i).getBuyDepth());
            addDepth(depthRows, tickId, DepthRowEntity.SIDE_SELL, ticks.get(i).getSellDepth());
        }
        depthRowJpaRepository.saveAll(depthRows);

        return new FlushResult(saved.size(), depthRows.size());
    }

    private void addDepth(List<DepthRowEntity> target, Long tickId, String side, List<DepthLevel> levels) {
        if (levels == null) {
            return;
        }
        for (int level = 0; level < levels.size(); level++) {
            DepthRowEntity row = tickRowMapper.toEntity(levels.get(level));
            row.setTickId(tickId);
            row.setSide(side);
            row.setLevel(level);
            target.add(row);
        }
    }
}
