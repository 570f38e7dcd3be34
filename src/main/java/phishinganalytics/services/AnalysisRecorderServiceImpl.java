package phishinganalytics.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import phishinganalytics.config.AnalyticsSettings;
import phishinganalytics.dto.AnalysisVerdict;
import phishinganalytics.exceptions.NotFoundException;
import phishinganalytics.exceptions.StorageException;
import phishinganalytics.exceptions.ValidationException;
import phishinganalytics.model.AnalysisResultEntity;
import phishinganalytics.model.ConfidenceLevel;
import phishinganalytics.model.UrlEntity;
import phishinganalytics.repositories.AnalysisResultRepository;
import phishinganalytics.repositories.UrlRepository;
import phishinganalytics.services.interfaces.AnalysisRecorderService;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisRecorderServiceImpl implements AnalysisRecorderService {

    static final int MIN_RISK_SCORE = 0;
    static final int MAX_RISK_SCORE = 100;

    private final AnalysisResultRepository resultRepository;
    private final UrlRepository urlRepository;
    private final AnalyticsSettings settings;

    @Override
    @Transactional
    public UUID recordResult(UUID urlId, AnalysisVerdict verdict) {
        ConfidenceLevel confidence = validate(verdict);
        if (urlId == null) {
            throw new ValidationException("url_id", "Не задан идентификатор URL");
        }

        log.info("📝 Запись результата анализа: urlId={}, phishing={}, riskScore={}, confidence={}",
                urlId, verdict.getPhishing(), verdict.getRiskScore(), confidence.getValue());

        try {
            UrlEntity url = urlRepository.findById(urlId)
                    .orElseThrow(() -> new NotFoundException("URL не найден: id=" + urlId));

            AnalysisResultEntity result = new AnalysisResultEntity();
            result.setUrl(url);
            result.setPhishing(verdict.getPhishing());
            result.setRiskScore(verdict.getRiskScore());
            result.setConfidenceLevel(confidence);
            result.setVirustotalResult(verdict.getVirustotalResult() == null
                    ? null : new LinkedHashMap<>(verdict.getVirustotalResult()));
            result.setHeuristicResult(verdict.getHeuristicResult() == null
                    ? null : new LinkedHashMap<>(verdict.getHeuristicResult()));
            result.setAnalysisDurationMs(verdict.getAnalysisDurationMs());
            result.setSourcesChecked(verdict.getSourcesChecked() == null
                    ? null : new ArrayList<>(verdict.getSourcesChecked()));
            result.setErrorLog(verdict.getErrorLog());
            result.setAnalysisDate(verdict.getAnalysisDate() != null ? verdict.getAnalysisDate() : OffsetDateTime.now());

            UUID id = resultRepository.saveAndFlush(result).getId();
            log.info("✅ Результат анализа сохранён: id={}, urlId={}", id, urlId);
            return id;
        } catch (DataIntegrityViolationException e) {
            // URL удалён между проверкой и вставкой
            log.warn("⚠️ Нарушение ссылочной целостности при записи результата для urlId={}", urlId);
            throw new NotFoundException("URL не найден: id=" + urlId, e);
        } catch (DataAccessException e) {
            log.error("❌ Ошибка хранилища при записи результата для urlId={}: {}", urlId, e.getMessage(), e);
            throw new StorageException("Хранилище недоступно при записи результата: urlId=" + urlId, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public AnalysisResultEntity latestResult(UUID urlId) {
        try {
            requireUrl(urlId);
            return resultRepository.findFirstByUrlIdOrderByAnalysisDateDescCreatedAtDescIdDesc(urlId)
                    .orElseThrow(() -> new NotFoundException("Нет результатов анализа для URL: id=" + urlId));
        } catch (DataAccessException e) {
            log.error("❌ Ошибка хранилища при чтении последнего результата urlId={}: {}", urlId, e.getMessage(), e);
            throw new StorageException("Хранилище недоступно при чтении результата: urlId=" + urlId, e);
        }
    }

    @Override
    public Iterable<AnalysisResultEntity> history(UUID urlId) {
        try {
            requireUrl(urlId);
        } catch (DataAccessException e) {
            log.error("❌ Ошибка хранилища при проверке URL для истории urlId={}: {}", urlId, e.getMessage(), e);
            throw new StorageException("Хранилище недоступно при чтении истории: urlId=" + urlId, e);
        }
        return new AnalysisHistory(resultRepository, urlId, settings.getHistoryPageSize());
    }

    @Override
    @Transactional(readOnly = true)
    public Page<AnalysisResultEntity> history(UUID urlId, Pageable pageable) {
        try {
            requireUrl(urlId);
            Pageable sorted = PageRequest.of(pageable.getPageNumber(), pageable.getPageSize(), AnalysisHistory.NEWEST_FIRST);
            return resultRepository.findAllByUrlId(urlId, sorted);
        } catch (DataAccessException e) {
            log.error("❌ Ошибка хранилища при чтении истории urlId={}: {}", urlId, e.getMessage(), e);
            throw new StorageException("Хранилище недоступно при чтении истории: urlId=" + urlId, e);
        }
    }

    private void requireUrl(UUID urlId) {
        if (urlId == null || !urlRepository.existsById(urlId)) {
            log.warn("⛔ URL не найден: id={}", urlId);
            throw new NotFoundException("URL не найден: id=" + urlId);
        }
    }

    private ConfidenceLevel validate(AnalysisVerdict verdict) {
        if (verdict == null) {
            throw new ValidationException("verdict", "Не передан результат анализа");
        }
        if (verdict.getPhishing() == null) {
            throw new ValidationException("is_phishing", "Не задан признак фишинга");
        }
        Integer score = verdict.getRiskScore();
        if (score == null || score < MIN_RISK_SCORE || score > MAX_RISK_SCORE) {
            throw new ValidationException("risk_score",
                    "Оценка риска должна быть в диапазоне [" + MIN_RISK_SCORE + ", " + MAX_RISK_SCORE + "]: " + score);
        }
        if (verdict.getAnalysisDurationMs() != null && verdict.getAnalysisDurationMs() < 0) {
            throw new ValidationException("analysis_duration_ms",
                    "Длительность анализа не может быть отрицательной: " + verdict.getAnalysisDurationMs());
        }
        return ConfidenceLevel.fromValue(verdict.getConfidenceLevel());
    }
}
