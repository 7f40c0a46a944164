package org.nowstart.lending.service.audit;

import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.nowstart.lending.data.entity.AuditEvent;
import org.nowstart.lending.repository.AuditEventRepository;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AuditEventService {

    private final AuditEventRepository auditEventRepository;

    public void record(String type, String actor, Long positionId, String payload) {
        AuditEvent event = AuditEvent.builder()
                .eventId(UUID.randomUUID())
                .type(type)
                .actor(actor)
                .positionId(positionId)
                .payload(payload)
                .build();
        auditEventRepository.save(event);
    }

    public void record(String type, String actor, String payload) {
        record(type, actor, null, payload);
    }
}
