package com.autorepair.repairservice.repository;

import com.autorepair.repairservice.entity.AppUser;
import com.autorepair.repairservice.entity.StaffJobType;
import com.autorepair.repairservice.entity.UserRole;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AppUserRepository extends JpaRepository<AppUser, Long> {

    List<AppUser> findAllByRoleAndStaffProfileJobTypeOrderByIdAsc(UserRole role, StaffJobType jobType);
}
