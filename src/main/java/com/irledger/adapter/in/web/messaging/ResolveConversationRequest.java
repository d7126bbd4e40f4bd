package com.irledger.adapter.in.web.messaging;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Find or open the caller's conversation
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolveConversationRequest {
    private String userId;
    private String userName;
    private String userRole;
}
