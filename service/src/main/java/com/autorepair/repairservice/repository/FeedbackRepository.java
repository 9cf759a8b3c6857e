package com.autorepair.repairservice.repository;

import com.autorepair.repairservice.entity.Feedback;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface FeedbackRepository extends JpaRepository<Feedback, Long> {

    List<Feedback> findAllByLogIdOrderByFeedbackTimeAsc(Long logId);
}
