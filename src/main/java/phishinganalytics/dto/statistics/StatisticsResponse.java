package phishinganalytics.dto.statistics;

import lombok.Data;

import java.util.Map;

@Data
public class StatisticsResponse {
    private long totalAnalyses;
    private long phishingDetected;
    private long safeUrls;
    private double avgRiskScore;
    private double phishingPercentage;
    private RiskDistribution riskDistribution;
    private Map<String, Long> confidenceDistribution;
    private Map<String, Long> sourcesUsage;
}
