package com.tenacy.tradepulse.monitor.health;

import com.tenacy.tradepulse.domain.ComponentHealthSnapshot;

/**
 * Health check of one monitored component.
 * <p>
 * Implementations capture their own failures as a {@code critical} snapshot
 * instead of throwing.
 */
public interface ComponentProbe {

    String getComponentId();

    ComponentHealthSnapshot check();
}
