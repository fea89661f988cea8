package com.flagship.retail_banking.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_banking.account.Account;
import com.flagship.retail_banking.account.AccountStatus;
import com.flagship.retail_banking.account.AccountType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("id")
    long id;

    @JsonProperty("account_number")
    String accountNumber;

    @JsonProperty("account_type")
    AccountType accountType;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("customer_id")
    long customerId;

    @JsonProperty("branch_id")
    long branchId;

    @JsonProperty("status")
    AccountStatus status;

    @JsonProperty("opened_at")
    Instant openedAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
            .id(account.getId())
            .accountNumber(account.getAccountNumber())
            .accountType(account.getAccountType())
            .balance(account.getBalance())
            .customerId(account.getCustomerId())
            .branchId(account.getBranchId())
            .status(account.getStatus())
            .openedAt(account.getOpenedAt())
            .updatedAt(account.getUpdatedAt())
            .build();
    }
}
