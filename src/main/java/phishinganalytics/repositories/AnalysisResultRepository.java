package phishinganalytics.repositories;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import phishinganalytics.model.AnalysisResultEntity;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AnalysisResultRepository extends JpaRepository<AnalysisResultEntity, UUID> {

    @EntityGraph(attributePaths = "url")
    Optional<AnalysisResultEntity> findFirstByUrlIdOrderByAnalysisDateDescCreatedAtDescIdDesc(UUID urlId);

    @EntityGraph(attributePaths = "url")
    Page<AnalysisResultEntity> findAllByUrlId(UUID urlId, Pageable pageable);

    @EntityGraph(attributePaths = "url")
    List<AnalysisResultEntity> findAllByUrlIdOrderByAnalysisDateDescCreatedAtDescIdDesc(UUID urlId, Pageable limit);

    // следующая порция истории строго после последней прочитанной записи
    @EntityGraph(attributePaths = "url")
    @Query("SELECT r FROM AnalysisResultEntity r WHERE r.url.id = :urlId AND ("
            + "r.analysisDate < :analysisDate"
            + " OR (r.analysisDate = :analysisDate AND r.createdAt < :createdAt)"
            + " OR (r.analysisDate = :analysisDate AND r.createdAt = :createdAt AND r.id < :id))"
            + " ORDER BY r.analysisDate DESC, r.createdAt DESC, r.id DESC")
    List<AnalysisResultEntity> findAllAfter(@Param("urlId") UUID urlId,
                                            @Param("analysisDate") OffsetDateTime analysisDate,
                                            @Param("createdAt") OffsetDateTime createdAt,
                                            @Param("id") UUID id,
                                            Pageable limit);

    List<AnalysisResultEntity> findAllByOrderByAnalysisDateDesc();

    List<AnalysisResultEntity> findAllByAnalysisDateGreaterThanEqualAndAnalysisDateLessThanOrderByAnalysisDateDesc(
            OffsetDateTime from, OffsetDateTime until);
}
