package phishinganalytics.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisVerdict {
    private Boolean phishing;
    private Integer riskScore;
    private String confidenceLevel;
    private Map<String, Object> virustotalResult;
    private Map<String, Object> heuristicResult;
    private Integer analysisDurationMs;
    private List<String> sourcesChecked;
    private String errorLog;
    // если не задана, используется момент записи
    private OffsetDateTime analysisDate;
}
