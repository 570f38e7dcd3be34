package phishinganalytics.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import phishinganalytics.config.AnalyticsSettings;
import phishinganalytics.config.RiskThresholds;
import phishinganalytics.dto.statistics.DailyCount;
import phishinganalytics.dto.statistics.RiskDistribution;
import phishinganalytics.dto.statistics.StatisticsResponse;
import phishinganalytics.exceptions.StorageException;
import phishinganalytics.exceptions.ValidationException;
import phishinganalytics.model.AnalysisResultEntity;
import phishinganalytics.model.ConfidenceLevel;
import phishinganalytics.repositories.AnalysisResultRepository;
import phishinganalytics.services.interfaces.StatisticsService;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.*;
import java.util.function.Supplier;

@Slf4j
@Service
@RequiredArgsConstructor
public class StatisticsServiceImpl implements StatisticsService {

    private final AnalysisResultRepository resultRepository;
    private final AnalyticsSettings settings;

    @Override
    public List<AnalysisResultEntity> getAnalyses(LocalDate start, LocalDate end) {
        if (start == null && end == null) {
            log.info("📋 Выборка всех результатов анализа");
            return fetch(resultRepository::findAllByOrderByAnalysisDateDesc);
        }
        if (start == null || end == null) {
            throw new ValidationException("date_range", "Нужно задать обе границы периода или ни одной");
        }
        if (start.isAfter(end)) {
            throw new ValidationException("date_range", "Начало периода позже конца: " + start + " > " + end);
        }

        ZoneId zone = settings.getZone();
        OffsetDateTime from = start.atStartOfDay(zone).toOffsetDateTime();
        // [from, until): последний день входит целиком, до начала следующих суток
        OffsetDateTime until = end.plusDays(1).atStartOfDay(zone).toOffsetDateTime();

        log.info("📋 Выборка результатов анализа за период [{}, {})", from, until);
        return fetch(() -> resultRepository
                .findAllByAnalysisDateGreaterThanEqualAndAnalysisDateLessThanOrderByAnalysisDateDesc(from, until));
    }

    @Override
    public StatisticsResponse getStatistics(LocalDate start, LocalDate end) {
        log.info("📊 Запрос статистики анализов: start={}, end={}", start, end);

        List<AnalysisResultEntity> results = getAnalyses(start, end);
        RiskThresholds thresholds = settings.getRiskThresholds();

        long total = results.size();
        long phishing = results.stream().filter(r -> Boolean.TRUE.equals(r.getPhishing())).count();

        RiskDistribution riskDistribution = new RiskDistribution();
        long scoreSum = 0;
        for (AnalysisResultEntity result : results) {
            int score = result.getRiskScore();
            scoreSum += score;
            if (score < thresholds.getMedium()) {
                riskDistribution.setLow(riskDistribution.getLow() + 1);
            } else if (score < thresholds.getHigh()) {
                riskDistribution.setMedium(riskDistribution.getMedium() + 1);
            } else {
                riskDistribution.setHigh(riskDistribution.getHigh() + 1);
            }
        }

        StatisticsResponse response = new StatisticsResponse();
        response.setTotalAnalyses(total);
        response.setPhishingDetected(phishing);
        response.setSafeUrls(total - phishing);
        response.setAvgRiskScore(total == 0 ? 0.0 : round((double) scoreSum / total));
        response.setPhishingPercentage(total == 0 ? 0.0 : round(phishing * 100.0 / total));
        response.setRiskDistribution(riskDistribution);
        response.setConfidenceDistribution(getConfidenceDistribution(results));
        response.setSourcesUsage(getSourcesUsage(results));

        log.info("✅ Статистика: total={}, phishing={}, avgRisk={}",
                total, phishing, response.getAvgRiskScore());
        return response;
    }

    @Override
    public List<DailyCount> getDailyCounts(LocalDate start, LocalDate end) {
        ZoneId zone = settings.getZone();
        Map<LocalDate, Long> counts = new TreeMap<>();
        for (AnalysisResultEntity result : getAnalyses(start, end)) {
            if (result.getAnalysisDate() == null) continue;
            LocalDate day = result.getAnalysisDate().atZoneSameInstant(zone).toLocalDate();
            counts.merge(day, 1L, Long::sum);
        }

        List<DailyCount> daily = new ArrayList<>();
        counts.forEach((day, count) -> daily.add(new DailyCount(day, count)));
        log.info("📅 Дневная статистика: дней={}", daily.size());
        return daily;
    }

    private Map<String, Long> getConfidenceDistribution(List<AnalysisResultEntity> results) {
        Map<String, Long> distribution = new LinkedHashMap<>();
        distribution.put(ConfidenceLevel.LOW.getValue(), 0L);
        distribution.put(ConfidenceLevel.MEDIUM.getValue(), 0L);
        distribution.put(ConfidenceLevel.HIGH.getValue(), 0L);
        for (AnalysisResultEntity result : results) {
            if (result.getConfidenceLevel() != null) {
                distribution.merge(result.getConfidenceLevel().getValue(), 1L, Long::sum);
            }
        }
        return distribution;
    }

    private Map<String, Long> getSourcesUsage(List<AnalysisResultEntity> results) {
        Map<String, Long> usage = new TreeMap<>();
        for (AnalysisResultEntity result : results) {
            if (result.getSourcesChecked() == null) continue;
            result.getSourcesChecked().stream()
                    .filter(Objects::nonNull)
                    .map(String::trim)
                    .filter(source -> !source.isEmpty())
                    .forEach(source -> usage.merge(source, 1L, Long::sum));
        }
        return usage;
    }

    private List<AnalysisResultEntity> fetch(Supplier<List<AnalysisResultEntity>> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            log.error("❌ Ошибка хранилища при выборке результатов: {}", e.getMessage(), e);
            throw new StorageException("Хранилище недоступно при выборке результатов анализа", e);
        }
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
