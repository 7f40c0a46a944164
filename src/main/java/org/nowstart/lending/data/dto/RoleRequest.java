package org.nowstart.lending.data.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.nowstart.lending.data.type.Permission;

public record RoleRequest(
        @NotBlank(message = "account is required")
        String account,
        @NotNull(message = "role is required")
        Permission role
) {
}
