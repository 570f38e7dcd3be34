package phishinganalytics.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Entity
@Immutable
@Getter
@Setter
@Table(name = "analysis_results", indexes = {
        @Index(name = "idx_analysis_results_url_id", columnList = "url_id"),
        @Index(name = "idx_analysis_results_analysis_date", columnList = "analysis_date DESC"),
        @Index(name = "idx_analysis_results_is_phishing", columnList = "is_phishing")
})
public class AnalysisResultEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "url_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private UrlEntity url;

    @Column(name = "analysis_date")
    private OffsetDateTime analysisDate;

    @Column(name = "is_phishing", nullable = false)
    private Boolean phishing;

    @Column(name = "risk_score", nullable = false,
            columnDefinition = "INTEGER CHECK (risk_score >= 0 AND risk_score <= 100)")
    private Integer riskScore;

    @Convert(converter = ConfidenceLevelConverter.class)
    @Column(name = "confidence_level", nullable = false,
            columnDefinition = "VARCHAR(16) CHECK (confidence_level IN ('high', 'medium', 'low'))")
    private ConfidenceLevel confidenceLevel;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "virustotal_result")
    private Map<String, Object> virustotalResult;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "heuristic_result")
    private Map<String, Object> heuristicResult;

    @Column(name = "analysis_duration_ms")
    private Integer analysisDurationMs;

    @JdbcTypeCode(SqlTypes.ARRAY)
    @Column(name = "sources_checked")
    private List<String> sourcesChecked;

    @Column(name = "error_log", columnDefinition = "TEXT")
    private String errorLog;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;
}
