package com.flagship.retail_banking.recovery;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface RecoveryLogRepository extends JpaRepository<RecoveryLogEntity, UUID> {

    List<RecoveryLogEntity> findAllByOrderByFailedAtDesc(Pageable pageable);

    List<RecoveryLogEntity> findBySenderAccountIdOrderByFailedAtDesc(Long senderAccountId, Pageable pageable);

    long countBySenderAccountId(Long senderAccountId);
}
