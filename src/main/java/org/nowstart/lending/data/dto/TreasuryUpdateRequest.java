package org.nowstart.lending.data.dto;

import jakarta.validation.constraints.NotBlank;

public record TreasuryUpdateRequest(
        @NotBlank(message = "treasury is required")
        String treasury
) {
}
