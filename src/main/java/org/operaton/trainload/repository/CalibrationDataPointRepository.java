package org.operaton.trainload.repository;

import org.operaton.trainload.model.DerivationMethod;
import org.operaton.trainload.model.entity.CalibrationDataPoint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CalibrationDataPointRepository extends JpaRepository<CalibrationDataPoint, UUID> {

    List<CalibrationDataPoint> findByValidTrue();

    List<CalibrationDataPoint> findTop20ByOrderByEffectiveDateDescCreatedAtDesc();

    List<CalibrationDataPoint> findByDerivationMethodAndValidTrue(DerivationMethod derivationMethod);
}
