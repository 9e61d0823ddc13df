package com.tenacy.tradepulse.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Structured monitoring settings bound from {@code tradepulse.*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "tradepulse")
public class MonitorProperties {

    private Components components = new Components();
    private Thresholds thresholds = new Thresholds();
    private Store store = new Store();
    private Logs logs = new Logs();

    @Getter
    @Setter
    public static class Components {
        private HttpComponent backend = new HttpComponent();
        private HttpComponent frontend = new HttpComponent();
        private LivenessComponent tradingAgent = new LivenessComponent();
    }

    @Getter
    @Setter
    public static class HttpComponent {
        private boolean enabled = true;
        private String url;
        private int timeoutMs = 5000;
    }

    @Getter
    @Setter
    public static class LivenessComponent {
        private boolean enabled = true;
        private String healthFile = "bot_health.json";
        // 초 단위
        private long maxHeartbeatAge = 60;
    }

    @Getter
    @Setter
    public static class Thresholds {
        private long responseTimeWarningMs = 1000;
        private long responseTimeCriticalMs = 2000;
    }

    @Getter
    @Setter
    public static class Store {
        private String directory = "data";
        private int healthSnapshotsMax = 1000;
        private int performanceMetricsMax = 2000;
        private int alertsLogMax = 500;
        private int systemLogsMax = 1000;
        private int retentionDays = 30;
    }

    @Getter
    @Setter
    public static class Logs {
        private boolean watchEnabled = true;
        private String file = "../logs/trading_agent.log";
        private long pollDelayMs = 1000;
    }
}
