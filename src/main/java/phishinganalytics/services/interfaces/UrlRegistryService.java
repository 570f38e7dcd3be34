package phishinganalytics.services.interfaces;

import phishinganalytics.model.UrlEntity;

import java.util.List;
import java.util.UUID;

/**
 * Реестр отправленных URL. Повторная отправка того же URL возвращает уже выданный идентификатор.
 */
public interface UrlRegistryService {

    UUID submit(String url, String domain, String source);

    // домен берётся из самого URL
    UUID submit(String url, String source);

    UrlEntity lookupByUrl(String url);

    List<UrlEntity> listByDomain(String domain);
}
