package com.flagship.retail_banking.account;

import com.flagship.retail_banking.account.dto.AccountResponse;
import com.flagship.retail_banking.account.dto.AuditLogResponse;
import com.flagship.retail_banking.account.dto.MoneyMovementRequest;
import com.flagship.retail_banking.account.dto.OpenAccountRequest;
import com.flagship.retail_banking.account.dto.StatusChangeRequest;
import com.flagship.retail_banking.audit.AuditRecorder;
import com.flagship.retail_banking.transfer.TransactionRepository;
import com.flagship.retail_banking.transfer.TransferGateway;
import com.flagship.retail_banking.transfer.dto.TransferResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

import static com.flagship.retail_banking.transfer.TransferController.CUSTOMER_ID_HEADER;

/**
 * REST endpoints for the acting customer's own accounts.
 * Accounts of other customers answer 403, as do unknown account numbers.
 */
@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
@Slf4j
public class AccountController {

    private static final int MAX_LIMIT = 500;

    private final AccountStore accountStore;
    private final TransferGateway transferGateway;
    private final TransactionRepository transactionRepository;
    private final AuditRecorder auditRecorder;

    @PostMapping
    public ResponseEntity<AccountResponse> openAccount(
            @RequestHeader(CUSTOMER_ID_HEADER) long customerId,
            @Valid @RequestBody OpenAccountRequest request) {
        Account account = accountStore.open(
            request.getAccountNumber(),
            request.getAccountType(),
            customerId,
            request.getBranchId(),
            request.getInitialBalance());
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }

    @GetMapping
    public List<AccountResponse> listAccounts(@RequestHeader(CUSTOMER_ID_HEADER) long customerId) {
        return accountStore.findByCustomer(customerId).stream()
            .map(AccountResponse::from)
            .toList();
    }

    @GetMapping("/{accountNumber}")
    public AccountResponse getAccount(
            @RequestHeader(CUSTOMER_ID_HEADER) long customerId,
            @PathVariable("accountNumber") String accountNumber) {
        return AccountResponse.from(transferGateway.ownedAccount(customerId, accountNumber));
    }

    @PutMapping("/{accountNumber}/status")
    public AccountResponse changeStatus(
            @RequestHeader(CUSTOMER_ID_HEADER) long customerId,
            @PathVariable("accountNumber") String accountNumber,
            @Valid @RequestBody StatusChangeRequest request) {
        Account account = transferGateway.ownedAccount(customerId, accountNumber);
        return AccountResponse.from(accountStore.updateStatus(account.getId(), request.getStatus()));
    }

    @PostMapping("/{accountNumber}/deposits")
    public ResponseEntity<TransferResponse> deposit(
            @RequestHeader(CUSTOMER_ID_HEADER) long customerId,
            @PathVariable("accountNumber") String accountNumber,
            @Valid @RequestBody MoneyMovementRequest request) {
        log.info("Received deposit request: customer={}, account={}, amount={}",
            customerId, accountNumber, request.getAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(TransferResponse.from(
            transferGateway.deposit(customerId, accountNumber, request.getAmount(), request.getDescription())));
    }

    @PostMapping("/{accountNumber}/withdrawals")
    public ResponseEntity<TransferResponse> withdraw(
            @RequestHeader(CUSTOMER_ID_HEADER) long customerId,
            @PathVariable("accountNumber") String accountNumber,
            @Valid @RequestBody MoneyMovementRequest request) {
        log.info("Received withdrawal request: customer={}, account={}, amount={}",
            customerId, accountNumber, request.getAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(TransferResponse.from(
            transferGateway.withdraw(customerId, accountNumber, request.getAmount(), request.getDescription())));
    }

    @GetMapping("/{accountNumber}/transactions")
    public List<TransferResponse> transactions(
            @RequestHeader(CUSTOMER_ID_HEADER) long customerId,
            @PathVariable("accountNumber") String accountNumber,
            @RequestParam(name = "limit", defaultValue = "50") int limit) {
        Account account = transferGateway.ownedAccount(customerId, accountNumber);
        return transactionRepository.findByAccount(account.getId(), Math.max(1, Math.min(limit, MAX_LIMIT)))
            .stream()
            .map(TransferResponse::from)
            .toList();
    }

    @GetMapping("/{accountNumber}/audit-logs")
    public List<AuditLogResponse> auditLogs(
            @RequestHeader(CUSTOMER_ID_HEADER) long customerId,
            @PathVariable("accountNumber") String accountNumber) {
        Account account = transferGateway.ownedAccount(customerId, accountNumber);
        return auditRecorder.findByAccount(account.getId()).stream()
            .map(AuditLogResponse::from)
            .toList();
    }
}
