package org.nowstart.lending.repository;

import org.nowstart.lending.data.entity.InterestState;
import org.springframework.data.jpa.repository.JpaRepository;

public interface InterestStateRepository extends JpaRepository<InterestState, InterestState.InterestStateKey> {
}
