package org.nowstart.lending.repository;

import java.math.BigInteger;
import java.util.List;
import org.nowstart.lending.data.entity.LoanPosition;
import org.nowstart.lending.data.type.PositionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LoanPositionRepository extends JpaRepository<LoanPosition, Long> {

    List<LoanPosition> findByOwnerOrderByIdAsc(String owner);

    List<LoanPosition> findByStatusAndDebtAmountGreaterThanOrderByIdAsc(PositionStatus status, BigInteger debtAmount);

    @Query("select sum(p.collateralAmount) from LoanPosition p where p.status = :status")
    BigInteger sumCollateralByStatus(@Param("status") PositionStatus status);
}
