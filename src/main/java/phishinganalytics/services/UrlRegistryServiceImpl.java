package phishinganalytics.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import phishinganalytics.config.AnalyticsSettings;
import phishinganalytics.exceptions.ConflictException;
import phishinganalytics.exceptions.NotFoundException;
import phishinganalytics.exceptions.StorageException;
import phishinganalytics.model.UrlEntity;
import phishinganalytics.repositories.UrlRepository;
import phishinganalytics.services.interfaces.UrlRegistryService;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static phishinganalytics.utils.UrlUtils.*;

@Slf4j
@Service
@RequiredArgsConstructor
public class UrlRegistryServiceImpl implements UrlRegistryService {

    private final UrlRepository urlRepository;
    private final AnalyticsSettings settings;

    // Без общей транзакции: после нарушения уникальности нужен повторный поиск в новой транзакции.
    @Override
    public UUID submit(String url, String domain, String source) {
        String normalizedUrl = normalizeUrl(url);
        String normalizedDomain = normalizeDomain(domain);
        String provenance = StringUtils.hasText(source) ? source.trim() : settings.getDefaultSource();
        String hash = urlHash(normalizedUrl);

        log.info("📥 Отправка URL: '{}', domain={}, source={}", normalizedUrl, normalizedDomain, provenance);

        try {
            Optional<UrlEntity> existing = findExisting(normalizedUrl, hash);
            if (existing.isPresent()) {
                UUID id = existing.get().getId();
                urlRepository.touch(id, OffsetDateTime.now());
                log.info("♻️ URL уже зарегистрирован: id={}, url='{}'", id, normalizedUrl);
                return id;
            }

            try {
                UUID id = insert(normalizedUrl, normalizedDomain, provenance, hash);
                log.info("✅ Зарегистрирован новый URL: id={}, url='{}'", id, normalizedUrl);
                return id;
            } catch (ConflictException e) {
                log.warn("⚠️ Параллельная вставка того же URL, повторный поиск: '{}'", normalizedUrl);
                return findExisting(normalizedUrl, hash)
                        .map(UrlEntity::getId)
                        .orElseThrow(() -> e);
            }
        } catch (DataAccessException e) {
            log.error("❌ Ошибка хранилища при регистрации URL '{}': {}", normalizedUrl, e.getMessage(), e);
            throw new StorageException("Хранилище недоступно при регистрации URL: " + normalizedUrl, e);
        }
    }

    @Override
    public UUID submit(String url, String source) {
        return submit(url, extractDomain(url), source);
    }

    @Override
    public UrlEntity lookupByUrl(String url) {
        String normalizedUrl = normalizeUrl(url);
        try {
            return findExisting(normalizedUrl, urlHash(normalizedUrl))
                    .orElseThrow(() -> new NotFoundException("URL не найден: " + normalizedUrl));
        } catch (DataAccessException e) {
            log.error("❌ Ошибка хранилища при поиске URL '{}': {}", normalizedUrl, e.getMessage(), e);
            throw new StorageException("Хранилище недоступно при поиске URL: " + normalizedUrl, e);
        }
    }

    @Override
    public List<UrlEntity> listByDomain(String domain) {
        String normalizedDomain = normalizeDomain(domain);
        try {
            List<UrlEntity> urls = urlRepository.findAllByDomainOrderBySubmittedAtDesc(normalizedDomain);
            log.debug("🔎 Найдено URL для домена {}: {}", normalizedDomain, urls.size());
            return urls;
        } catch (DataAccessException e) {
            log.error("❌ Ошибка хранилища при выборке домена {}: {}", normalizedDomain, e.getMessage(), e);
            throw new StorageException("Хранилище недоступно при выборке домена: " + normalizedDomain, e);
        }
    }

    // url_hash ускоряет поиск, совпадение подтверждается самим url
    private Optional<UrlEntity> findExisting(String normalizedUrl, String hash) {
        return urlRepository.findAllByUrlHash(hash).stream()
                .filter(entity -> normalizedUrl.equals(entity.getUrl()))
                .findFirst();
    }

    private UUID insert(String normalizedUrl, String domain, String source, String hash) {
        UrlEntity entity = new UrlEntity();
        entity.setUrl(normalizedUrl);
        entity.setDomain(domain);
        entity.setSource(source);
        entity.setUrlHash(hash);
        entity.setSubmittedAt(OffsetDateTime.now());

        try {
            return urlRepository.saveAndFlush(entity).getId();
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException("URL уже существует: " + normalizedUrl, e);
        }
    }
}
