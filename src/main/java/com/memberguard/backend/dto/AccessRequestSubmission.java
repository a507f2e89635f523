package com.memberguard.backend.dto;

import lombok.Data;

@Data
public class AccessRequestSubmission {

    // Plan picked from a renewal button, if any
    private Long planId;
}
