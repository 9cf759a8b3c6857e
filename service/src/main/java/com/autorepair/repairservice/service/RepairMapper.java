package com.autorepair.repairservice.service;

import com.autorepair.repairservice.dto.AssignmentResponse;
import com.autorepair.repairservice.dto.FeedbackResponse;
import com.autorepair.repairservice.dto.MaterialResponse;
import com.autorepair.repairservice.dto.OrderResponse;
import com.autorepair.repairservice.dto.RepairLogResponse;
import com.autorepair.repairservice.entity.Feedback;
import com.autorepair.repairservice.entity.Material;
import com.autorepair.repairservice.entity.RepairAssignment;
import com.autorepair.repairservice.entity.RepairLog;
import com.autorepair.repairservice.entity.RepairOrder;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class RepairMapper {

    public OrderResponse toResponse(RepairOrder order, List<RepairAssignment> assignments) {
        OrderResponse resp = new OrderResponse();
        resp.setId(order.getId());
        resp.setVehicleId(order.getVehicleId());
        resp.setCustomerId(order.getCustomerId());
        resp.setRequestId(order.getRequestId());
        resp.setRequiredStaffType(order.getRequiredStaffType());
        resp.setStatus(order.getStatus());
        resp.setOrderTime(order.getOrderTime());
        resp.setFinishTime(order.getFinishTime());
        resp.setRemarks(order.getRemarks());
        resp.setAssignments(assignments.stream().map(this::toResponse).toList());
        return resp;
    }

    public AssignmentResponse toResponse(RepairAssignment assignment) {
        AssignmentResponse r = new AssignmentResponse();
        r.setId(assignment.getId());
        r.setOrderId(assignment.getOrderId());
        r.setStaffId(assignment.getStaffId());
        r.setStatus(assignment.getStatus());
        r.setTimeWorked(assignment.getTimeWorked());
        return r;
    }

    public RepairLogResponse toResponse(RepairLog log, List<Material> materials) {
        RepairLogResponse r = new RepairLogResponse();
        r.setId(log.getId());
        r.setOrderId(log.getOrderId());
        r.setStaffId(log.getStaffId());
        r.setLogTime(log.getLogTime());
        r.setLogMessage(log.getLogMessage());
        r.setMaterials(materials.stream().map(this::toMaterialResponse).toList());
        return r;
    }

    public FeedbackResponse toResponse(Feedback feedback) {
        FeedbackResponse r = new FeedbackResponse();
        r.setId(feedback.getId());
        r.setCustomerId(feedback.getCustomerId());
        r.setLogId(feedback.getLogId());
        r.setRating(feedback.getRating());
        r.setComments(feedback.getComments());
        r.setFeedbackTime(feedback.getFeedbackTime());
        return r;
    }

    private MaterialResponse toMaterialResponse(Material m) {
        MaterialResponse r = new MaterialResponse();
        r.setId(m.getId());
        r.setName(m.getName());
        r.setQuantity(m.getQuantity());
        r.setUnitPrice(m.getUnitPrice());
        r.setTotalPrice(m.getTotalPrice());
        r.setRemarks(m.getRemarks());
        return r;
    }
}
