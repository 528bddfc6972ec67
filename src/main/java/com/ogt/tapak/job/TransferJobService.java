package com.ogt.tapak.job;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Registro de auditoría de cada carga y exportación.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransferJobService {

    private static final int MAX_ERROR_LENGTH = 4000;

    private final TransferJobRepository jobRepository;

    public TransferJob start(String jobType, String fileName, String parameters) {
        TransferJob job = TransferJob.builder()
                .jobType(jobType)
                .status(TransferJob.STATUS_PROCESSING)
                .fileName(fileName)
                .parameters(parameters)
                .build();
        return jobRepository.save(job);
    }

    public TransferJob complete(TransferJob job, Integer rows) {
        job.setStatus(TransferJob.STATUS_COMPLETED);
        job.setRowsProcessed(rows);
        job.setCompletedAt(LocalDateTime.now());
        return jobRepository.save(job);
    }

    /**
     * Marca el job como fallido. Si el propio registro falla se loguea y se conserva
     * la excepción original de la petición.
     */
    public void fail(TransferJob job, Exception cause) {
        try {
            job.setStatus(TransferJob.STATUS_FAILED);
            job.setErrorMessage(truncate(cause.getMessage()));
            job.setCompletedAt(LocalDateTime.now());
            jobRepository.save(job);
        } catch (DataAccessException e) {
            log.warn("⚠️ No se pudo marcar el job {} como FAILED: {}", job.getId(), e.getMessage());
        }
    }

    public List<TransferJob> recent(String jobType) {
        if (jobType == null || jobType.isBlank()) {
            return jobRepository.findTop100ByOrderByCreatedAtDesc();
        }
        return jobRepository.findTop100ByJobTypeOrderByCreatedAtDesc(jobType.toUpperCase());
    }

    public Optional<TransferJob> find(UUID id) {
        return jobRepository.findById(id);
    }

    private String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
