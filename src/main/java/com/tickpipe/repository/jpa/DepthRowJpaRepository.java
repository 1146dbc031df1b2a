package com.tickpipe.repository.jpa;

import com.tickpipe.entity.DepthRowEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface DepthRowJpaRepository extends JpaRepository<DepthRowEntity, Long> {

    List<DepthRowEntity> findByTickIdOrderBySideAscLevelAsc(Long tickId);
}
