package com.leaderboard.hosted.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Entity
@Table(name = "leaderboards", indexes = {
    @Index(name = "idx_leaderboard_status", columnList = "status")
})
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Leaderboard {
    @Id
    @Column(name = "leaderboard_id")
    private String id;

    @Column(name = "secret", nullable = false)
    private String secret;

    @Column(name = "name")
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "ordering", nullable = false)
    private ScoreOrdering ordering;

    @Enumerated(EnumType.STRING)
    @Column(name = "update_policy", nullable = false)
    private UpdatePolicy updatePolicy;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private LeaderboardStatus status;

    @Column(name = "created_at", nullable = false)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant createdAt;

    @Column(name = "updated_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant updatedAt;

    @Column(name = "created_by")
    private String createdBy;

    @Convert(converter = MetadataJsonConverter.class)
    @Column(name = "metadata", length = 8192)
    private Map<String, Object> metadata;

    @JsonIgnore
    public boolean isActive() {
        return status == LeaderboardStatus.ACTIVE;
    }
}
