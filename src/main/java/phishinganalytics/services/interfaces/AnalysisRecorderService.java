package phishinganalytics.services.interfaces;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import phishinganalytics.dto.AnalysisVerdict;
import phishinganalytics.model.AnalysisResultEntity;

import java.util.UUID;

/**
 * Журнал результатов анализа. Записи только добавляются и никогда не меняются.
 */
public interface AnalysisRecorderService {

    UUID recordResult(UUID urlId, AnalysisVerdict verdict);

    AnalysisResultEntity latestResult(UUID urlId);

    /**
     * Ленивая последовательность результатов от самого нового к самому старому.
     * Каждый новый обход начинается заново с первой страницы.
     */
    Iterable<AnalysisResultEntity> history(UUID urlId);

    Page<AnalysisResultEntity> history(UUID urlId, Pageable pageable);
}
