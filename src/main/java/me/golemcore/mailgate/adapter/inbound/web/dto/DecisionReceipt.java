package me.golemcore.mailgate.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Acknowledges a submitted decision or rejection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecisionReceipt {
    private String requestId;

    /** DELIVERED or STORED_FOR_REPLAY. */
    private String delivery;
}
