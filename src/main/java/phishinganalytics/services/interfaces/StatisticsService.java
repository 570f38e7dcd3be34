package phishinganalytics.services.interfaces;

import phishinganalytics.dto.statistics.DailyCount;
import phishinganalytics.dto.statistics.StatisticsResponse;
import phishinganalytics.model.AnalysisResultEntity;

import java.time.LocalDate;
import java.util.List;

public interface StatisticsService {

    List<AnalysisResultEntity> getAnalyses(LocalDate start, LocalDate end);

    StatisticsResponse getStatistics(LocalDate start, LocalDate end);

    List<DailyCount> getDailyCounts(LocalDate start, LocalDate end);
}
