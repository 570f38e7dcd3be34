package phishinganalytics.services;

import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import phishinganalytics.exceptions.StorageException;
import phishinganalytics.model.AnalysisResultEntity;
import phishinganalytics.repositories.AnalysisResultRepository;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;

/**
 * История анализов одного URL. Порции подгружаются по мере обхода,
 * каждый вызов {@link #iterator()} начинает с самого свежего результата.
 * Следующая порция читается от последней прочитанной записи
 * (analysisDate, createdAt, id), поэтому новые результаты, записанные во время
 * обхода, не сдвигают уже прочитанные.
 */
public class AnalysisHistory implements Iterable<AnalysisResultEntity> {

    static final Sort NEWEST_FIRST = Sort.by(
            Sort.Order.desc("analysisDate"), Sort.Order.desc("createdAt"), Sort.Order.desc("id"));

    private final AnalysisResultRepository resultRepository;
    private final UUID urlId;
    private final int pageSize;

    public AnalysisHistory(AnalysisResultRepository resultRepository, UUID urlId, int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("Размер страницы должен быть положительным: " + pageSize);
        }
        this.resultRepository = resultRepository;
        this.urlId = urlId;
        this.pageSize = pageSize;
    }

    @Override
    public Iterator<AnalysisResultEntity> iterator() {
        return new BatchIterator();
    }

    private class BatchIterator implements Iterator<AnalysisResultEntity> {
        private AnalysisResultEntity last;
        private Iterator<AnalysisResultEntity> current;
        private boolean exhausted;

        @Override
        public boolean hasNext() {
            while (current == null || !current.hasNext()) {
                if (exhausted) {
                    return false;
                }
                List<AnalysisResultEntity> batch = fetch();
                exhausted = batch.size() < pageSize;
                if (batch.isEmpty()) {
                    return false;
                }
                last = batch.get(batch.size() - 1);
                current = batch.iterator();
            }
            return true;
        }

        private List<AnalysisResultEntity> fetch() {
            Pageable limit = PageRequest.of(0, pageSize);
            try {
                if (last == null) {
                    return resultRepository.findAllByUrlIdOrderByAnalysisDateDescCreatedAtDescIdDesc(urlId, limit);
                }
                return resultRepository.findAllAfter(urlId,
                        last.getAnalysisDate(), last.getCreatedAt(), last.getId(), limit);
            } catch (DataAccessException e) {
                throw new StorageException("Хранилище недоступно при чтении истории: urlId=" + urlId
                        + ", after=" + (last == null ? null : last.getId()), e);
            }
        }

        @Override
        public AnalysisResultEntity next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return current.next();
        }
    }
}
