package com.autorepair.repairservice.service;

import com.autorepair.repairservice.dto.RegisterVehicleRequest;
import com.autorepair.repairservice.entity.Vehicle;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

@Slf4j
@Service
@Validated
@RequiredArgsConstructor
public class VehicleService {

    private final VehicleStore vehicleStore;

    @Transactional
    public Vehicle register(@Valid RegisterVehicleRequest req) {
        Vehicle vehicle = new Vehicle();
        vehicle.setCustomerId(req.getCustomerId());
        vehicle.setLicensePlate(req.getLicensePlate());
        vehicle.setBrand(req.getBrand());
        vehicle.setModel(req.getModel());
        vehicle.setType(req.getType());
        vehicle.setColor(req.getColor());
        vehicle.setRemarks(req.getRemarks());

        Vehicle saved = vehicleStore.insert(vehicle);
        log.info("Vehicle registered: id={}, plate={}, customer={}",
                saved.getId(), saved.getLicensePlate(), saved.getCustomerId());
        return saved;
    }

    @Transactional
    public Vehicle updateDetails(Long vehicleId, String color, String remarks) {
        return vehicleStore.update(vehicleId, v -> {
            v.setColor(color);
            v.setRemarks(remarks);
        });
    }

    @Transactional
    public void remove(Long vehicleId) {
        vehicleStore.delete(vehicleId);
        log.info("Vehicle {} removed", vehicleId);
    }
}
