package org.nowstart.lending.repository;

import org.nowstart.lending.data.entity.InterestSchedule;
import org.springframework.data.jpa.repository.JpaRepository;

public interface InterestScheduleRepository extends JpaRepository<InterestSchedule, String> {
}
