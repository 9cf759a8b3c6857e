package com.autorepair.repairservice.service;

import com.autorepair.repairservice.entity.Feedback;
import com.autorepair.repairservice.repository.FeedbackRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Component
public class FeedbackStore extends AuditedEntityStore<Feedback> {

    public static final String TABLE = "feedback";

    private final FeedbackRepository feedback;

    public FeedbackStore(FeedbackRepository repository, AuditStore auditStore,
                         ObjectMapper objectMapper, RecordIdGenerator idGenerator) {
        super(repository, auditStore, objectMapper, idGenerator, Feedback.class, TABLE);
        this.feedback = repository;
    }

    @Transactional(readOnly = true)
    public List<Feedback> findByLog(Long logId) {
        return feedback.findAllByLogIdOrderByFeedbackTimeAsc(logId);
    }
}
