package com.autorepair.repairservice.service;

import com.autorepair.repairservice.dto.StaffCandidate;

import java.util.List;

/** Picks who gets an assignment out of a non-empty list of eligible staff. */
public interface StaffSelector {

    StaffCandidate select(List<StaffCandidate> eligible);
}
