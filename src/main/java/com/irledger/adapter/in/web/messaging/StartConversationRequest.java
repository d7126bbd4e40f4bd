package com.irledger.adapter.in.web.messaging;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Admin-initiated conversation with a chosen affiliate
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StartConversationRequest {
    private String adminId;
    private String adminName;
    private String affiliateId;
    private String affiliateName;
}
