package com.autorepair.repairservice.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

/**
 * Account shared by customers, staff and admins. The role picks the variant; role-specific data
 * lives in embedded payloads ({@link StaffProfile} for staff) instead of subclasses.
 */
@Entity
@Table(name = "app_user")
@Getter
@Setter
public class AppUser {

    @Id
    @Column(name = "user_id")
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, unique = true, length = 50)
    private String username;

    @Column(length = 100)
    private String email;

    @Column(length = 30)
    private String phone;

    @Column(length = 255)
    private String address;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UserRole role;

    @Embedded
    private StaffProfile staffProfile;

    public boolean isStaff() {
        return role == UserRole.STAFF && staffProfile != null;
    }
}
