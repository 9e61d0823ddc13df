package com.tenacy.tradepulse.logs;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorCounts {
    private int lastHour;
    private int last10Minutes;

    public static ErrorCounts none() {
        return new ErrorCounts(0, 0);
    }
}
