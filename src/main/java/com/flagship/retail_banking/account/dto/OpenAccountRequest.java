package com.flagship.retail_banking.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_banking.account.AccountType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OpenAccountRequest {

    @NotBlank(message = "Account number is required")
    @Pattern(regexp = "^[0-9A-Z]{4,20}$", message = "Account number must be 4-20 digits or capital letters")
    @JsonProperty("account_number")
    private String accountNumber;

    @NotNull(message = "Account type is required")
    @JsonProperty("account_type")
    private AccountType accountType;

    @NotNull(message = "Branch ID is required")
    @JsonProperty("branch_id")
    private Long branchId;

    @DecimalMin(value = "0.00", message = "Initial balance cannot be negative")
    @Digits(integer = 13, fraction = 2, message = "Initial balance has at most two decimal places")
    @JsonProperty("initial_balance")
    private BigDecimal initialBalance;
}
