package com.tradeingest.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Broker chosen by the user for a batch that was parked without one. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BrokerSelectionRequest {

    @NotBlank(message = "Broker name is required")
    @Size(max = 100, message = "Broker name must be 100 characters or less")
    private String brokerName;
}
