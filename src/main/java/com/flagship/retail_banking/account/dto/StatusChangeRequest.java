package com.flagship.retail_banking.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_banking.account.AccountStatus;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StatusChangeRequest {

    @NotNull(message = "Status is required")
    @JsonProperty("status")
    private AccountStatus status;
}
