package com.example.courier.realtime.dto;

import com.example.courier.shared.dto.CorrelatedRequest;
import com.example.courier.shared.model.UserRole;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * Body of a system announcement. Without {@code targetRoles} it goes to every
 * open connection.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnnouncementRequest implements CorrelatedRequest {

    private String correlationId;

    @NotBlank(message = "Message is required")
    @Size(max = 1000, message = "Message must not exceed 1000 characters")
    private String message;

    @JsonProperty("target_roles")
    @JsonAlias("targetRoles")
    private Set<UserRole> targetRoles;
}
