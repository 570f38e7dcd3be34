package phishinganalytics.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import phishinganalytics.model.UrlEntity;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface UrlRepository extends JpaRepository<UrlEntity, UUID> {

    List<UrlEntity> findAllByUrlHash(String urlHash);

    List<UrlEntity> findAllByDomainOrderBySubmittedAtDesc(String domain);

    @Modifying
    @Transactional
    @Query("UPDATE UrlEntity u SET u.updatedAt = :updatedAt WHERE u.id = :id")
    int touch(@Param("id") UUID id, @Param("updatedAt") OffsetDateTime updatedAt);
}
