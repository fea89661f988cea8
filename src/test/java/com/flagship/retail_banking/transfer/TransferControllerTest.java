package com.flagship.retail_banking.transfer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.retail_banking.account.Account;
import com.flagship.retail_banking.account.AccountStore;
import com.flagship.retail_banking.account.AccountType;
import com.flagship.retail_banking.recovery.RecoveryRecorder;
import com.flagship.retail_banking.transfer.dto.TransferRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Transfer API tests.
 *
 * These tests verify:
 * - A transfer answers 201, a replay of the same Idempotency-Key answers 200
 * - Concurrent duplicate requests create exactly one transaction
 * - Failures map to the documented status codes with a machine-readable kind
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class TransferControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private AccountStore accountStore;

    @Autowired
    private TransactionRepository transactionRepository;

    @Autowired
    private RecoveryRecorder recoveryRecorder;

    private long customerId;
    private Account sender;
    private Account receiver;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        customerId = ThreadLocalRandom.current().nextLong(1, 1_000_000_000_000L);
        sender = openAccount(customerId, "1000.00");
        receiver = openAccount(customerId + 1, "0.00");
    }

    private Account openAccount(long owner, String balance) {
        String number = "TC" + ThreadLocalRandom.current().nextLong(1_000_000_000L, 9_999_999_999L);
        return accountStore.open(number, AccountType.CHECKING, owner, 1L, new BigDecimal(balance));
    }

    private String body(String amount) throws Exception {
        return objectMapper.writeValueAsString(
            new TransferRequest(sender.getId(), receiver.getAccountNumber(), new BigDecimal(amount), "rent"));
    }

    private BigDecimal balanceOf(Account account) {
        return accountStore.getById(account.getId()).getBalance();
    }

    @Test
    @DisplayName("Transfer answers 201 with the committed transaction")
    void transfer_Created() throws Exception {
        printTestHeader("Create Transfer");
        String request = body("100.00");
        printInput("Request", request);

        MvcResult result = mockMvc.perform(post("/api/transfers")
                .header(TransferController.CUSTOMER_ID_HEADER, customerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(request))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.type").value("TRANSFER"))
            .andExpect(jsonPath("$.status").value("COMPLETED"))
            .andExpect(jsonPath("$.replayed").value(false))
            .andExpect(jsonPath("$.description").value("rent"))
            .andReturn();

        printOutput("Response", result.getResponse().getContentAsString());
        JsonNode json = objectMapper.readTree(result.getResponse().getContentAsString());
        assertEquals(sender.getId(), json.get("sender_account_id").asLong());
        assertEquals(receiver.getId(), json.get("receiver_account_id").asLong());
        assertEquals(0, new BigDecimal("100.00").compareTo(json.get("amount").decimalValue()));
        assertEquals(0, new BigDecimal("900.00").compareTo(balanceOf(sender)));
        assertEquals(0, new BigDecimal("100.00").compareTo(balanceOf(receiver)));
        printSuccess("Transfer created");
    }

    @Test
    @DisplayName("Same Idempotency-Key returns the original transaction with 200")
    void transfer_Replayed() throws Exception {
        printTestHeader("Idempotent Replay Over HTTP");
        String key = UUID.randomUUID().toString();
        printInput("Idempotency-Key", key);

        MvcResult first = mockMvc.perform(post("/api/transfers")
                .header(TransferController.CUSTOMER_ID_HEADER, customerId)
                .header(TransferController.IDEMPOTENCY_KEY_HEADER, key)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("40.00")))
            .andExpect(status().isCreated())
            .andReturn();

        MvcResult second = mockMvc.perform(post("/api/transfers")
                .header(TransferController.CUSTOMER_ID_HEADER, customerId)
                .header(TransferController.IDEMPOTENCY_KEY_HEADER, key)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("40.00")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.replayed").value(true))
            .andExpect(jsonPath("$.idempotency_key").value(key))
            .andReturn();

        long firstId = objectMapper.readTree(first.getResponse().getContentAsString()).get("id").asLong();
        long secondId = objectMapper.readTree(second.getResponse().getContentAsString()).get("id").asLong();
        printOutput("Transaction ids", firstId + " / " + secondId);
        assertEquals(firstId, secondId);
        assertEquals(0, new BigDecimal("960.00").compareTo(balanceOf(sender)));
        printSuccess("Replay returned the same transaction");
    }

    @Test
    @DisplayName("Ten concurrent requests with one key: one 201, nine 200")
    void transfer_ConcurrentDuplicates() throws Exception {
        printTestHeader("Concurrent Duplicate Requests");
        String key = UUID.randomUUID().toString();
        String request = body("25.00");
        int threads = 10;
        printInput("Threads", threads);

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger created = new AtomicInteger();
        AtomicInteger replayed = new AtomicInteger();
        List<Integer> unexpected = Collections.synchronizedList(new ArrayList<>());

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                start.await();
                int status = mockMvc.perform(post("/api/transfers")
                        .header(TransferController.CUSTOMER_ID_HEADER, customerId)
                        .header(TransferController.IDEMPOTENCY_KEY_HEADER, key)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(request))
                    .andReturn().getResponse().getStatus();
                if (status == 201) {
                    created.incrementAndGet();
                } else if (status == 200) {
                    replayed.incrementAndGet();
                } else {
                    unexpected.add(status);
                }
                return null;
            });
        }
        start.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(120, TimeUnit.SECONDS));

        printOutput("201 responses", created.get());
        printOutput("200 responses", replayed.get());
        assertTrue(unexpected.isEmpty(), "Unexpected statuses: " + unexpected);
        assertEquals(1, created.get());
        assertEquals(threads - 1, replayed.get());
        assertEquals(1, transactionRepository.countByAccount(sender.getId()));
        assertEquals(0, new BigDecimal("975.00").compareTo(balanceOf(sender)));
        printSuccess("Exactly one transfer for ten requests");
    }

    @Test
    @DisplayName("Insufficient funds answers 422 and leaves a recovery entry")
    void transfer_InsufficientFunds() throws Exception {
        printTestHeader("Insufficient Funds Over HTTP");

        mockMvc.perform(post("/api/transfers")
                .header(TransferController.CUSTOMER_ID_HEADER, customerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("5000.00")))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.kind").value("INSUFFICIENT_FUNDS"))
            .andExpect(jsonPath("$.message").exists())
            .andExpect(jsonPath("$.timestamp").exists());

        assertEquals(0, new BigDecimal("1000.00").compareTo(balanceOf(sender)));
        assertEquals(1, recoveryRecorder.countBySender(sender.getId()));
        printSuccess("422 with kind");
    }

    @Test
    @DisplayName("Idempotency-Key of another customer's transfer answers 409 without its contents")
    void transfer_KeyOfAnotherCustomer() throws Exception {
        printTestHeader("Idempotency-Key Reused By Another Customer");
        String key = UUID.randomUUID().toString();
        mockMvc.perform(post("/api/transfers")
                .header(TransferController.CUSTOMER_ID_HEADER, customerId)
                .header(TransferController.IDEMPOTENCY_KEY_HEADER, key)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("40.00")))
            .andExpect(status().isCreated());

        long otherCustomer = customerId + 3;
        Account otherAccount = openAccount(otherCustomer, "500.00");
        String request = objectMapper.writeValueAsString(
            new TransferRequest(otherAccount.getId(), receiver.getAccountNumber(), new BigDecimal("40.00"), null));
        printInput("Other customer", otherCustomer);

        MvcResult result = mockMvc.perform(post("/api/transfers")
                .header(TransferController.CUSTOMER_ID_HEADER, otherCustomer)
                .header(TransferController.IDEMPOTENCY_KEY_HEADER, key)
                .contentType(MediaType.APPLICATION_JSON)
                .content(request))
            .andExpect(status().isConflict())
            .andReturn();

        String response = result.getResponse().getContentAsString();
        printOutput("Response", response);
        assertFalse(response.contains("rent"));
        assertFalse(response.contains(sender.getAccountNumber()));
        assertEquals(0, new BigDecimal("500.00").compareTo(balanceOf(otherAccount)));
        printSuccess("Foreign key refused");
    }

    @Test
    @DisplayName("Idempotency-Key over 100 characters answers 400 and moves nothing")
    void transfer_OverlongKey() throws Exception {
        mockMvc.perform(post("/api/transfers")
                .header(TransferController.CUSTOMER_ID_HEADER, customerId)
                .header(TransferController.IDEMPOTENCY_KEY_HEADER, "x".repeat(150))
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("1.00")))
            .andExpect(status().isBadRequest());

        assertEquals(0, new BigDecimal("1000.00").compareTo(balanceOf(sender)));
        assertEquals(0, recoveryRecorder.countBySender(sender.getId()));
    }

    @Test
    @DisplayName("Amount beyond the ledger maximum answers 400 INVALID_AMOUNT")
    void transfer_AmountBeyondMaximum() throws Exception {
        mockMvc.perform(post("/api/transfers")
                .header(TransferController.CUSTOMER_ID_HEADER, customerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("99999999999999.00")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.kind").value("INVALID_AMOUNT"));

        assertEquals(1, recoveryRecorder.countBySender(sender.getId()));
    }

    @Test
    @DisplayName("Sub-cent amount answers 400 INVALID_AMOUNT")
    void transfer_InvalidAmount() throws Exception {
        mockMvc.perform(post("/api/transfers")
                .header(TransferController.CUSTOMER_ID_HEADER, customerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("0.001")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.kind").value("INVALID_AMOUNT"));
    }

    @Test
    @DisplayName("Transfer to the sender's own account answers 400 SAME_ACCOUNT")
    void transfer_SameAccount() throws Exception {
        String request = objectMapper.writeValueAsString(
            new TransferRequest(sender.getId(), sender.getAccountNumber(), new BigDecimal("1.00"), null));

        mockMvc.perform(post("/api/transfers")
                .header(TransferController.CUSTOMER_ID_HEADER, customerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(request))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.kind").value("SAME_ACCOUNT"));
    }

    @Test
    @DisplayName("Unknown receiver answers 404 ACCOUNT_NOT_FOUND")
    void transfer_UnknownReceiver() throws Exception {
        String request = objectMapper.writeValueAsString(
            new TransferRequest(sender.getId(), "NOSUCHACCOUNT", new BigDecimal("1.00"), null));

        mockMvc.perform(post("/api/transfers")
                .header(TransferController.CUSTOMER_ID_HEADER, customerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(request))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.kind").value("ACCOUNT_NOT_FOUND"));
    }

    @Test
    @DisplayName("Someone else's sender account answers 403")
    void transfer_AccessDenied() throws Exception {
        mockMvc.perform(post("/api/transfers")
                .header(TransferController.CUSTOMER_ID_HEADER, customerId + 2)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("1.00")))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.kind").value("ACCESS_DENIED"));

        assertEquals(0, new BigDecimal("1000.00").compareTo(balanceOf(sender)));
    }

    @Test
    @DisplayName("Missing customer header answers 400")
    void transfer_MissingCustomerHeader() throws Exception {
        mockMvc.perform(post("/api/transfers")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("1.00")))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Missing fields answer 400 with field details")
    void transfer_ValidationFailure() throws Exception {
        mockMvc.perform(post("/api/transfers")
                .header(TransferController.CUSTOMER_ID_HEADER, customerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"sender_account_id\": " + sender.getId() + "}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.amount").exists())
            .andExpect(jsonPath("$.details.receiverAccountNumber").exists());
    }

    @Test
    @DisplayName("Transaction lookup answers 200 for a party and 404 otherwise")
    void getTransfer() throws Exception {
        MvcResult created = mockMvc.perform(post("/api/transfers")
                .header(TransferController.CUSTOMER_ID_HEADER, customerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("5.00")))
            .andExpect(status().isCreated())
            .andReturn();
        long id = objectMapper.readTree(created.getResponse().getContentAsString()).get("id").asLong();

        mockMvc.perform(get("/api/transfers/{id}", id)
                .header(TransferController.CUSTOMER_ID_HEADER, customerId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("COMPLETED"));
        mockMvc.perform(get("/api/transfers/{id}", id)
                .header(TransferController.CUSTOMER_ID_HEADER, customerId + 1))
            .andExpect(status().isOk());
        mockMvc.perform(get("/api/transfers/{id}", id)
                .header(TransferController.CUSTOMER_ID_HEADER, customerId + 2))
            .andExpect(status().isNotFound());
    }
}
