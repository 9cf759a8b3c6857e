package com.autorepair.repairservice.service;

import com.autorepair.repairservice.dto.FeedbackResponse;
import com.autorepair.repairservice.entity.Feedback;
import com.autorepair.repairservice.entity.RepairLog;
import com.autorepair.repairservice.entity.RepairOrder;
import com.autorepair.repairservice.exception.ForbiddenOperationException;
import com.autorepair.repairservice.exception.RecordNotFoundException;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.util.List;

/** Customer ratings of the work recorded in a repair log entry. */
@Slf4j
@Service
@Validated
@RequiredArgsConstructor
public class FeedbackService {

    private final FeedbackStore feedbackStore;
    private final RepairLogStore logStore;
    private final RepairOrderStore orderStore;
    private final RepairMapper mapper;
    private final Clock clock;

    /**
     * Records a rating from the customer who owns the order the log entry belongs to.
     *
     * @throws RecordNotFoundException     the log entry or its order does not exist
     * @throws ForbiddenOperationException the customer does not own the order
     */
    @Transactional
    public FeedbackResponse submitFeedback(Long customerId, Long logId,
                                           @Min(1) @Max(5) int rating,
                                           @Size(max = 1000) String comments) {
        RepairLog entry = logStore.find(logId)
                .orElseThrow(() -> new RecordNotFoundException(RepairLogStore.TABLE, logId));
        RepairOrder order = orderStore.find(entry.getOrderId())
                .orElseThrow(() -> new RecordNotFoundException(RepairOrderStore.TABLE, entry.getOrderId()));
        if (!order.getCustomerId().equals(customerId)) {
            throw new ForbiddenOperationException(String.format(
                    "Customer %d does not own repair order %d", customerId, order.getId()));
        }

        Feedback feedback = new Feedback();
        feedback.setCustomerId(customerId);
        feedback.setLogId(logId);
        feedback.setRating(rating);
        feedback.setComments(comments);
        feedback.setFeedbackTime(Timestamps.now(clock));
        Feedback saved = feedbackStore.insert(feedback);

        log.info("Feedback {} rated log {} of order {} at {}", saved.getId(), logId, order.getId(), rating);
        return mapper.toResponse(saved);
    }

    @Transactional(readOnly = true)
    public FeedbackResponse getFeedback(Long feedbackId) {
        return feedbackStore.find(feedbackId)
                .map(mapper::toResponse)
                .orElseThrow(() -> new RecordNotFoundException(FeedbackStore.TABLE, feedbackId));
    }

    @Transactional(readOnly = true)
    public List<FeedbackResponse> feedbackForLog(Long logId) {
        return feedbackStore.findByLog(logId).stream().map(mapper::toResponse).toList();
    }
}
