package com.ogt.tapak.job;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface TransferJobRepository extends JpaRepository<TransferJob, UUID> {

    List<TransferJob> findTop100ByOrderByCreatedAtDesc();

    List<TransferJob> findTop100ByJobTypeOrderByCreatedAtDesc(String jobType);
}
