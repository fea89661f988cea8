package com.flagship.retail_banking.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Request body for deposits and withdrawals.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MoneyMovementRequest {

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    private BigDecimal amount;

    @Size(max = 500, message = "Description is at most 500 characters")
    @JsonProperty("description")
    private String description;
}
