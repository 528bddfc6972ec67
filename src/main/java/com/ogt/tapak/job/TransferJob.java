package com.ogt.tapak.job;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "tapak_transfer_jobs")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class TransferJob {

    public static final String TYPE_UPLOAD = "UPLOAD";
    public static final String TYPE_EXPORT = "EXPORT";

    public static final String STATUS_PROCESSING = "PROCESSING";
    public static final String STATUS_COMPLETED = "COMPLETED";
    public static final String STATUS_FAILED = "FAILED";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 20)
    private String jobType; // UPLOAD, EXPORT

    @Column(nullable = false, length = 30)
    private String status; // PROCESSING, COMPLETED, FAILED

    private String fileName;

    @Column(length = 1000)
    private String parameters;

    private Integer rowsProcessed;

    @Column(length = 4000)
    private String errorMessage;

    @CreationTimestamp
    private LocalDateTime createdAt;

    private LocalDateTime completedAt;
}
