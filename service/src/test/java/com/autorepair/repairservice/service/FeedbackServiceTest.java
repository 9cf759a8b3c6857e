package com.autorepair.repairservice.service;

import com.autorepair.repairservice.dto.FeedbackResponse;
import com.autorepair.repairservice.entity.Feedback;
import com.autorepair.repairservice.entity.RepairLog;
import com.autorepair.repairservice.entity.RepairOrder;
import com.autorepair.repairservice.exception.ForbiddenOperationException;
import com.autorepair.repairservice.exception.RecordNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FeedbackServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-10T09:30:00Z");

    @Mock private FeedbackStore feedbackStore;
    @Mock private RepairLogStore logStore;
    @Mock private RepairOrderStore orderStore;

    private FeedbackService feedbackService;

    @BeforeEach
    void setUp() {
        feedbackService = new FeedbackService(feedbackStore, logStore, orderStore, new RepairMapper(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void logOfOrderOwnedBy(long customerId) {
        RepairLog entry = new RepairLog();
        entry.setId(40L);
        entry.setOrderId(4L);
        RepairOrder order = new RepairOrder();
        order.setId(4L);
        order.setCustomerId(customerId);
        when(logStore.find(40L)).thenReturn(Optional.of(entry));
        when(orderStore.find(4L)).thenReturn(Optional.of(order));
    }

    @Test
    void submitFeedback_ownerOfOrder_insertsStampedFeedback() {
        logOfOrderOwnedBy(1L);
        when(feedbackStore.insert(any())).thenAnswer(inv -> {
            Feedback f = inv.getArgument(0);
            f.setId(900L);
            return f;
        });

        FeedbackResponse resp = feedbackService.submitFeedback(1L, 40L, 4, "Good work");

        ArgumentCaptor<Feedback> saved = ArgumentCaptor.forClass(Feedback.class);
        verify(feedbackStore).insert(saved.capture());
        assertThat(saved.getValue().getCustomerId()).isEqualTo(1L);
        assertThat(saved.getValue().getLogId()).isEqualTo(40L);
        assertThat(saved.getValue().getFeedbackTime()).isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
        assertThat(resp.getId()).isEqualTo(900L);
        assertThat(resp.getRating()).isEqualTo(4);
        assertThat(resp.getComments()).isEqualTo("Good work");
    }

    @Test
    void submitFeedback_otherCustomer_isForbidden() {
        logOfOrderOwnedBy(1L);

        assertThatThrownBy(() -> feedbackService.submitFeedback(2L, 40L, 5, null))
                .isInstanceOf(ForbiddenOperationException.class)
                .hasMessageContaining("does not own");
        verify(feedbackStore, never()).insert(any());
    }

    @Test
    void submitFeedback_logWithoutOrder_isNotFound() {
        RepairLog entry = new RepairLog();
        entry.setId(40L);
        entry.setOrderId(4L);
        when(logStore.find(40L)).thenReturn(Optional.of(entry));
        when(orderStore.find(4L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> feedbackService.submitFeedback(1L, 40L, 3, null))
                .isInstanceOf(RecordNotFoundException.class);
        verifyNoInteractions(feedbackStore);
    }

    @Test
    void getFeedback_missing_isNotFound() {
        when(feedbackStore.find(7L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> feedbackService.getFeedback(7L))
                .isInstanceOf(RecordNotFoundException.class);
    }

    @Test
    void feedbackForLog_mapsEveryEntry() {
        Feedback f = new Feedback();
        f.setId(1L);
        f.setLogId(40L);
        f.setRating(2);
        when(feedbackStore.findByLog(40L)).thenReturn(List.of(f));

        assertThat(feedbackService.feedbackForLog(40L)).extracting("rating").containsExactly(2);
    }
}
