package com.tenacy.tradepulse.alert;

import com.tenacy.tradepulse.domain.AlertSeverity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Channel independent alert payload.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertMessage {
    private String title;
    private String text;
    private String details;
    private AlertSeverity severity;
    private Instant timestamp;
}
