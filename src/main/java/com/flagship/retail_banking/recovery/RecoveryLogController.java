package com.flagship.retail_banking.recovery;

import com.flagship.retail_banking.recovery.dto.RecoveryLogResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Read-only access to the recovery log for operators.
 */
@RestController
@RequestMapping("/api/recovery-logs")
@RequiredArgsConstructor
public class RecoveryLogController {

    private static final int MAX_LIMIT = 500;

    private final RecoveryRecorder recoveryRecorder;

    @GetMapping
    public List<RecoveryLogResponse> list(
            @RequestParam(name = "sender_account_id", required = false) Long senderAccountId,
            @RequestParam(name = "limit", defaultValue = "50") int limit) {
        int boundedLimit = Math.max(1, Math.min(limit, MAX_LIMIT));
        List<RecoveryLogEntry> entries = senderAccountId != null
            ? recoveryRecorder.findBySender(senderAccountId, boundedLimit)
            : recoveryRecorder.findAll(boundedLimit);
        return entries.stream().map(RecoveryLogResponse::from).toList();
    }

    @GetMapping("/{id}")
    public ResponseEntity<RecoveryLogResponse> get(@PathVariable("id") UUID id) {
        return recoveryRecorder.findById(id)
            .map(entry -> ResponseEntity.ok(RecoveryLogResponse.from(entry)))
            .orElse(ResponseEntity.notFound().build());
    }
}
