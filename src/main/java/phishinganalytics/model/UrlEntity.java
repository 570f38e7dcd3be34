package phishinganalytics.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Getter
@Setter
@Table(name = "urls", indexes = {
        @Index(name = "idx_urls_domain", columnList = "domain"),
        @Index(name = "idx_urls_submitted_at", columnList = "submitted_at DESC"),
        @Index(name = "idx_urls_url_hash", columnList = "url_hash")
})
public class UrlEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    // ключ уникальности, после создания не меняется
    @Column(name = "url", nullable = false, unique = true, updatable = false, length = 2048)
    private String url;

    @Column(name = "domain", nullable = false)
    private String domain;

    @Column(name = "submitted_at")
    private OffsetDateTime submittedAt;

    @Column(name = "source")
    private String source;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    @Column(name = "url_hash", length = 32)
    private String urlHash;
}
