package com.example.evidenceledger.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Custody policy bound from application.yml (custody.policy.*). Read once at startup; the
 * defaults below apply when a property is missing from YAML.
 */
@Component
@ConfigurationProperties(prefix = "custody.policy")
@Data
public class CustodyPolicyProperties {

    private boolean enabled = true;
    private List<String> requiredOrder = new ArrayList<>(List.of("COLLECTED", "SEALED", "ANALYZED", "VERIFIED"));
    private List<String> allowedSkips = new ArrayList<>();
    private double maxAccessDurationHours = 48;
    private boolean noParallelAccess = true;
}
