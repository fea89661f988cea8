package com.flagship.retail_banking.transfer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Request body for POST /api/transfers.
 * The amount is only checked for presence here; sign and scale are checked by the engine.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TransferRequest {

    @NotNull(message = "Sender account ID is required")
    @JsonProperty("sender_account_id")
    private Long senderAccountId;

    @NotBlank(message = "Receiver account number is required")
    @Size(max = 20, message = "Receiver account number is at most 20 characters")
    @JsonProperty("receiver_account_number")
    private String receiverAccountNumber;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    private BigDecimal amount;

    @Size(max = 500, message = "Description is at most 500 characters")
    @JsonProperty("description")
    private String description;
}
