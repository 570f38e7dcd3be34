package phishinganalytics.dto.statistics;

import lombok.Data;

@Data
public class RiskDistribution {
    private long low;
    private long medium;
    private long high;
}
