package com.company.dashboard.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClientAliasRequest {

    @NotBlank(message = "Alias is required")
    @Size(max = 100, message = "Alias must not exceed 100 characters")
    private String alias;
}
