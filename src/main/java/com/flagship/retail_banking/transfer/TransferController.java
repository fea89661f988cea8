package com.flagship.retail_banking.transfer;

import com.flagship.retail_banking.transfer.dto.TransferRequest;
import com.flagship.retail_banking.transfer.dto.TransferResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoint for transfers between accounts.
 *
 * The acting customer comes from the X-Customer-Id header, set by the
 * authentication layer in front of this service. An optional Idempotency-Key
 * makes retries safe: a repeated key returns the original transaction with 200.
 */
@RestController
@RequestMapping("/api/transfers")
@RequiredArgsConstructor
@Slf4j
public class TransferController {

    public static final String CUSTOMER_ID_HEADER = "X-Customer-Id";
    public static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final TransferGateway transferGateway;

    @PostMapping
    public ResponseEntity<TransferResponse> submitTransfer(
            @RequestHeader(CUSTOMER_ID_HEADER) long customerId,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody TransferRequest request) {

        log.info("Received transfer request: customer={}, sender={}, receiver={}, amount={}, idempotencyKey={}",
            customerId, request.getSenderAccountId(), request.getReceiverAccountNumber(),
            request.getAmount(), idempotencyKey);

        TransferOutcome outcome = transferGateway.submitTransfer(
            customerId,
            request.getSenderAccountId(),
            request.getReceiverAccountNumber(),
            request.getAmount(),
            request.getDescription(),
            idempotencyKey);

        HttpStatus status = outcome.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status)
            .body(TransferResponse.from(outcome.getRecord(), outcome.isReplayed()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<TransferResponse> getTransfer(
            @RequestHeader(CUSTOMER_ID_HEADER) long customerId,
            @PathVariable("id") long id) {
        return transferGateway.findTransaction(customerId, id)
            .map(record -> ResponseEntity.ok(TransferResponse.from(record)))
            .orElse(ResponseEntity.notFound().build());
    }
}
