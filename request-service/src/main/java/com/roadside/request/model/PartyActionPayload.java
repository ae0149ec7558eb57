package com.roadside.request.model;

import com.roadside.shared.enums.CancelReasonCategory;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of cancel and withdraw calls.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PartyActionPayload {

    @NotBlank
    private String actorId;

    private CancelReasonCategory category;

    @Size(max = 1000)
    private String reason;
}
