package com.tenacy.tradepulse.alert;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.tenacy.tradepulse.domain.AlertSeverity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlertRule {
    private String id;
    private String name;
    private String description;
    private AlertSeverity severity;
    private boolean enabled;
}
