package phishinganalytics.config;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class RiskThresholds {
    private int medium = 40;
    private int high = 70;
}
