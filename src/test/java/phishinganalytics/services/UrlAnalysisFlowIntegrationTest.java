package phishinganalytics.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;
import phishinganalytics.dto.AnalysisVerdict;
import phishinganalytics.dto.statistics.DailyCount;
import phishinganalytics.dto.statistics.StatisticsResponse;
import phishinganalytics.exceptions.NotFoundException;
import phishinganalytics.exceptions.ValidationException;
import phishinganalytics.model.AnalysisResultEntity;
import phishinganalytics.model.ConfidenceLevel;
import phishinganalytics.model.UrlEntity;
import phishinganalytics.repositories.AnalysisResultRepository;
import phishinganalytics.repositories.UrlRepository;
import phishinganalytics.services.interfaces.AnalysisRecorderService;
import phishinganalytics.services.interfaces.StatisticsService;
import phishinganalytics.services.interfaces.UrlRegistryService;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class UrlAnalysisFlowIntegrationTest {

    @Autowired
    private UrlRegistryService registryService;

    @Autowired
    private AnalysisRecorderService recorderService;

    @Autowired
    private StatisticsService statisticsService;

    @Autowired
    private UrlRepository urlRepository;

    @Autowired
    private AnalysisResultRepository resultRepository;

    private final OffsetDateTime base = OffsetDateTime.of(2025, 8, 1, 12, 0, 0, 0, ZoneOffset.UTC);

    @BeforeEach
    void cleanDatabase() {
        urlRepository.deleteAll();
    }

    private AnalysisVerdict verdict(boolean phishing, int riskScore, String confidence, OffsetDateTime date) {
        return AnalysisVerdict.builder()
                .phishing(phishing)
                .riskScore(riskScore)
                .confidenceLevel(confidence)
                .sourcesChecked(List.of("virustotal", "heuristics"))
                .analysisDate(date)
                .build();
    }

    @Test
    @DisplayName("Отправка URL, запись вердикта и чтение последнего результата")
    void submitRecordAndReadLatest() {
        UUID urlId = registryService.submit("http://evil.example/a", "evil.example", "manual");

        UUID resultId = recorderService.recordResult(urlId, AnalysisVerdict.builder()
                .phishing(true)
                .riskScore(92)
                .confidenceLevel("high")
                .build());

        AnalysisResultEntity latest = recorderService.latestResult(urlId);
        assertThat(latest.getId()).isEqualTo(resultId);
        assertThat(latest.getPhishing()).isTrue();
        assertThat(latest.getRiskScore()).isEqualTo(92);
        assertThat(latest.getConfidenceLevel()).isEqualTo(ConfidenceLevel.HIGH);
    }

    @Test
    @DisplayName("Повторная отправка того же URL возвращает тот же идентификатор")
    void submitIsIdempotent() {
        UUID first = registryService.submit("http://evil.example/a", "evil.example", "manual");
        UUID second = registryService.submit("HTTP://EVIL.example/a#login", "evil.example", "feed");

        assertThat(second).isEqualTo(first);
        assertThat(urlRepository.count()).isEqualTo(1);

        UrlEntity stored = registryService.lookupByUrl("http://evil.example/a");
        assertThat(stored.getSource()).isEqualTo("manual");
        assertThat(stored.getUrlHash()).hasSize(32);
    }

    @Test
    @DisplayName("Выборка по домену от новых к старым")
    void listByDomainNewestFirst() {
        UUID first = registryService.submit("http://evil.example/a", "evil.example", null);
        UUID second = registryService.submit("http://evil.example/b", "evil.example", null);
        registryService.submit("http://other.example/c", "other.example", null);

        List<UrlEntity> urls = registryService.listByDomain("evil.example");

        assertThat(urls).extracting(UrlEntity::getId).containsExactlyInAnyOrder(first, second);
        assertThat(urls.get(0).getSubmittedAt()).isAfterOrEqualTo(urls.get(1).getSubmittedAt());
        assertThat(urls).allSatisfy(url -> assertThat(url.getSource()).isEqualTo("manual"));
    }

    @Test
    @DisplayName("Последний результат определяется максимальной датой анализа")
    void latestResultByAnalysisDate() {
        UUID urlId = registryService.submit("http://evil.example/a", "evil.example", "manual");
        recorderService.recordResult(urlId, verdict(false, 20, "low", base.plusDays(1)));
        UUID newest = recorderService.recordResult(urlId, verdict(true, 85, "high", base.plusDays(3)));
        recorderService.recordResult(urlId, verdict(false, 35, "medium", base.plusDays(2)));

        assertThat(recorderService.latestResult(urlId).getId()).isEqualTo(newest);
    }

    @Test
    @DisplayName("История упорядочена по дате анализа и перечитывается при повторном обходе")
    void historyIsOrderedAndRestartable() {
        UUID urlId = registryService.submit("http://evil.example/a", "evil.example", "manual");
        for (int i = 0; i < 4; i++) {
            recorderService.recordResult(urlId, verdict(false, i * 10, "low", base.plusHours(i)));
        }

        Iterable<AnalysisResultEntity> history = recorderService.history(urlId);
        List<Integer> firstPass = new ArrayList<>();
        history.forEach(result -> firstPass.add(result.getRiskScore()));
        List<Integer> secondPass = new ArrayList<>();
        history.forEach(result -> secondPass.add(result.getRiskScore()));

        assertThat(firstPass).containsExactly(30, 20, 10, 0);
        assertThat(secondPass).isEqualTo(firstPass);
        assertThat(recorderService.history(urlId, PageRequest.of(1, 3)).getContent())
                .extracting(AnalysisResultEntity::getRiskScore)
                .containsExactly(0);
    }

    @Test
    @DisplayName("Удаление URL удаляет его результаты")
    void deletingUrlCascades() {
        UUID urlId = registryService.submit("http://evil.example/a", "evil.example", "manual");
        recorderService.recordResult(urlId, verdict(true, 92, "high", base));
        recorderService.recordResult(urlId, verdict(true, 88, "medium", base.plusHours(1)));

        urlRepository.deleteById(urlId);

        assertThat(resultRepository.count()).isZero();
        assertThatThrownBy(() -> recorderService.latestResult(urlId)).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Недопустимые вердикты и неизвестный URL не записываются")
    void invalidVerdictsAreRejected() {
        UUID urlId = registryService.submit("http://evil.example/a", "evil.example", "manual");

        assertThatThrownBy(() -> recorderService.recordResult(urlId, verdict(true, 101, "high", base)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> recorderService.recordResult(urlId, verdict(true, -1, "high", base)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> recorderService.recordResult(urlId, verdict(true, 50, "critical", base)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> recorderService.recordResult(UUID.randomUUID(), verdict(true, 50, "high", base)))
                .isInstanceOf(NotFoundException.class);

        assertThat(resultRepository.count()).isZero();
    }

    @Test
    @DisplayName("Статистика за период строится по сохранённым результатам")
    void statisticsOverStoredResults() {
        UUID evil = registryService.submit("http://evil.example/a", "evil.example", "manual");
        UUID safe = registryService.submit("https://docs.example/guide", "docs.example", "manual");
        recorderService.recordResult(evil, verdict(true, 92, "high", base));
        recorderService.recordResult(safe, verdict(false, 10, "medium", base.plusDays(1)));
        recorderService.recordResult(safe, verdict(false, 50, "low", base.plusDays(10)));

        StatisticsResponse response = statisticsService.getStatistics(
                base.toLocalDate(), base.plusDays(1).toLocalDate());

        assertThat(response.getTotalAnalyses()).isEqualTo(2);
        assertThat(response.getPhishingDetected()).isEqualTo(1);
        assertThat(response.getAvgRiskScore()).isEqualTo(51.0);
        assertThat(response.getSourcesUsage()).containsEntry("virustotal", 2L);
        assertThat(statisticsService.getDailyCounts(base.toLocalDate(), base.plusDays(10).toLocalDate()))
                .hasSize(3);
    }

    @Test
    @DisplayName("Результат в последнюю секунду конечного дня попадает в статистику")
    void statisticsIncludeLastSecondOfEndDay() {
        UUID urlId = registryService.submit("http://evil.example/a", "evil.example", "manual");
        OffsetDateTime lastSecond = OffsetDateTime.of(2025, 8, 1, 23, 59, 59, 500_000_000, ZoneOffset.UTC);
        recorderService.recordResult(urlId, verdict(true, 90, "high", lastSecond));
        recorderService.recordResult(urlId, verdict(false, 10, "low", lastSecond.plusSeconds(1)));

        LocalDate day = LocalDate.of(2025, 8, 1);

        assertThat(statisticsService.getAnalyses(day, day))
                .extracting(AnalysisResultEntity::getRiskScore)
                .containsExactly(90);
        assertThat(statisticsService.getDailyCounts(day, day)).containsExactly(new DailyCount(day, 1));
        assertThat(statisticsService.getStatistics(day, day).getTotalAnalyses()).isEqualTo(1);
    }

    @Test
    @DisplayName("URL результата доступен после закрытия транзакции чтения")
    void resultUrlIsLoadedWithResult() {
        UUID urlId = registryService.submit("http://evil.example/a", "evil.example", "manual");
        recorderService.recordResult(urlId, verdict(true, 92, "high", base));

        assertThat(recorderService.latestResult(urlId).getUrl().getUrl()).isEqualTo("http://evil.example/a");
        assertThat(recorderService.history(urlId))
                .allSatisfy(result -> assertThat(result.getUrl().getDomain()).isEqualTo("evil.example"));
        assertThat(recorderService.history(urlId, PageRequest.of(0, 5)).getContent())
                .allSatisfy(result -> assertThat(result.getUrl().getUrl()).isEqualTo("http://evil.example/a"));
    }

    @Test
    @DisplayName("Результат, записанный во время обхода истории, не дублирует уже прочитанные")
    void historyHasNoDuplicatesWhenResultArrivesMidIteration() {
        UUID urlId = registryService.submit("http://evil.example/a", "evil.example", "manual");
        for (int i = 0; i < 5; i++) {
            recorderService.recordResult(urlId, verdict(false, i * 10, "low", base.plusHours(i)));
        }

        List<UUID> seen = new ArrayList<>();
        Iterator<AnalysisResultEntity> iterator = recorderService.history(urlId).iterator();
        seen.add(iterator.next().getId());
        recorderService.recordResult(urlId, verdict(true, 99, "high", base.plusDays(1)));
        iterator.forEachRemaining(result -> seen.add(result.getId()));

        assertThat(seen).doesNotHaveDuplicates().hasSize(5);
    }
}
