package com.irledger.domain.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for enums
 */
class EnumTest {

    @Test
    void testTransactionType() {
        // Test fromValue
        assertEquals(TransactionType.DEPOSIT, TransactionType.fromValue("Deposit"));
        assertEquals(TransactionType.WITHDRAWAL, TransactionType.fromValue("Withdrawal"));
        assertEquals(TransactionType.EARNINGS, TransactionType.fromValue("Earnings"));
        assertEquals(TransactionType.CREDIT, TransactionType.fromValue("Credit"));

        // Test case insensitivity
        assertEquals(TransactionType.CREDIT, TransactionType.fromValue("credit"));

        // Test isValid
        assertTrue(TransactionType.isValid("Deposit"));
        assertFalse(TransactionType.isValid("Refund"));

        // Test direction
        assertTrue(TransactionType.WITHDRAWAL.isDebit());
        assertFalse(TransactionType.DEPOSIT.isDebit());
        assertEquals(0, new BigDecimal("-250").compareTo(TransactionType.WITHDRAWAL.balanceDelta(new BigDecimal("250"))));
        assertEquals(0, new BigDecimal("250").compareTo(TransactionType.EARNINGS.balanceDelta(new BigDecimal("250"))));

        // Test invalid value
        assertThrows(IllegalArgumentException.class, () -> TransactionType.fromValue("Refund"));
    }

    @Test
    void testWithdrawalStatus() {
        assertEquals(WithdrawalStatus.PENDING, WithdrawalStatus.fromValue("Pending"));
        assertEquals(WithdrawalStatus.APPROVED, WithdrawalStatus.fromValue("approved"));
        assertEquals(WithdrawalStatus.REJECTED, WithdrawalStatus.fromValue("REJECTED"));

        assertFalse(WithdrawalStatus.PENDING.isTerminal());
        assertTrue(WithdrawalStatus.APPROVED.isTerminal());
        assertTrue(WithdrawalStatus.REJECTED.isTerminal());

        assertEquals("Approved", WithdrawalStatus.APPROVED.getValue());
        assertFalse(WithdrawalStatus.isValid("Cancelled"));
        assertThrows(IllegalArgumentException.class, () -> WithdrawalStatus.fromValue("Cancelled"));
    }

    @Test
    void testTaxFormStatus() {
        assertEquals(TaxFormStatus.NOT_REQUIRED, TaxFormStatus.fromValue("not_required"));
        assertEquals(TaxFormStatus.PENDING, TaxFormStatus.fromValue("pending"));
        assertEquals(TaxFormStatus.APPROVED, TaxFormStatus.fromValue("APPROVED"));

        assertTrue(TaxFormStatus.isValid("rejected"));
        assertFalse(TaxFormStatus.isValid("waived"));

        assertEquals("not_required", TaxFormStatus.NOT_REQUIRED.getValue());
        assertThrows(IllegalArgumentException.class, () -> TaxFormStatus.fromValue("waived"));
    }

    @Test
    void testMessagingEnums() {
        assertEquals(SenderRole.ADMIN, SenderRole.fromValue("admin"));
        assertEquals(SenderRole.AFFILIATE, SenderRole.fromValue("Affiliate"));
        assertThrows(IllegalArgumentException.class, () -> SenderRole.fromValue("investor"));

        assertEquals(MessagePriority.HIGH, MessagePriority.fromValue("high"));
        assertEquals("medium", MessagePriority.MEDIUM.getValue());

        assertEquals(MessageStatus.READ, MessageStatus.fromValue("read"));
        assertFalse(MessageStatus.isValid("archived"));
    }
}
