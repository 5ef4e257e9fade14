package com.arbitration.award.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserAccount {
    private String userId;
    private String displayName;
    private UserRole role;
    private String phoneNumber;
    private String email;
    private ArbitratorProfile arbitratorProfile;   // null for non-arbitrators
}
