package phishinganalytics.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.ZoneId;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "analytics-settings")
public class AnalyticsSettings {
    private String defaultSource = "manual";
    private int historyPageSize = 50;
    private RiskThresholds riskThresholds = new RiskThresholds();
    private ZoneId zone = ZoneId.of("UTC");
}
