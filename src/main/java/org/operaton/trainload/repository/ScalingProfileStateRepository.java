package org.operaton.trainload.repository;

import org.operaton.trainload.model.entity.ScalingProfileState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ScalingProfileStateRepository extends JpaRepository<ScalingProfileState, Long> {
}
