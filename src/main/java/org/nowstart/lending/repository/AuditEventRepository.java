package org.nowstart.lending.repository;

import java.util.List;
import java.util.UUID;
import org.nowstart.lending.data.entity.AuditEvent;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AuditEventRepository extends JpaRepository<AuditEvent, UUID> {

    List<AuditEvent> findByTypeOrderByCreatedAtAsc(String type);

    List<AuditEvent> findByPositionIdOrderByCreatedAtAsc(Long positionId);
}
