package com.irledger.application.service;

import com.irledger.application.port.in.AccountLedgerUseCase.TransactionEntry;
import com.irledger.application.port.in.AccountLedgerUseCase.TransactionUpdate;
import com.irledger.application.port.in.MessagingUseCase.SendMessageCommand;
import com.irledger.application.port.in.WithdrawalUseCase.SubmitWithdrawalCommand;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates inbound ledger, withdrawal and messaging commands
 */
public class LedgerValidator {

    private static final BigDecimal MAX_AMOUNT = new BigDecimal("999999999999.99");
    private static final int MAX_MESSAGE_LENGTH = 5000;

    public ValidationResult validate(SubmitWithdrawalCommand command) {
        List<String> errors = new ArrayList<>();

        if (isBlank(command.investorId())) {
            errors.add("investorId is required");
        }
        if (isBlank(command.investorName())) {
            errors.add("investorName is required");
        }
        validatePositiveAmount(command.amount(), errors);

        return ValidationResult.of(errors);
    }

    public ValidationResult validate(TransactionEntry entry) {
        List<String> errors = new ArrayList<>();

        if (isBlank(entry.investorId())) {
            errors.add("investorId is required");
        }
        if (entry.type() == null) {
            errors.add("type is required");
        }
        validatePositiveAmount(entry.amount(), errors);
        validateDate(entry.date(), errors);

        return ValidationResult.of(errors);
    }

    public ValidationResult validate(TransactionUpdate update) {
        List<String> errors = new ArrayList<>();

        if (update.status() == null && update.description() == null && update.date() == null) {
            errors.add("status, description or date is required");
        }
        if (update.status() != null && isBlank(update.status())) {
            errors.add("status must not be blank");
        }
        validateDate(update.date(), errors);

        return ValidationResult.of(errors);
    }

    public ValidationResult validate(SendMessageCommand command) {
        List<String> errors = new ArrayList<>();

        if (isBlank(command.senderId())) {
            errors.add("senderId is required");
        }
        if (isBlank(command.senderName())) {
            errors.add("senderName is required");
        }
        if (command.senderRole() == null) {
            errors.add("senderRole is required");
        }
        if (isBlank(command.content())) {
            errors.add("content is required");
        } else if (command.content().length() > MAX_MESSAGE_LENGTH) {
            errors.add("content exceeds maximum length of " + MAX_MESSAGE_LENGTH + " characters");
        }

        return ValidationResult.of(errors);
    }

    private void validatePositiveAmount(BigDecimal amount, List<String> errors) {
        if (amount == null) {
            errors.add("amount is required");
            return;
        }
        if (amount.signum() <= 0) {
            errors.add("amount must be positive");
        }
        if (amount.scale() > 2 && amount.stripTrailingZeros().scale() > 2) {
            errors.add("amount must have at most 2 decimal places");
        }
        if (amount.compareTo(MAX_AMOUNT) > 0) {
            errors.add("amount exceeds maximum allowed value");
        }
    }

    private void validateDate(String date, List<String> errors) {
        if (date == null) {
            return;
        }
        try {
            LocalDate.parse(date, DateTimeFormatter.ISO_LOCAL_DATE);
        } catch (DateTimeParseException e) {
            errors.add("date must be in ISO format (YYYY-MM-DD)");
        }
    }

    private boolean isBlank(String str) {
        return str == null || str.trim().isEmpty();
    }
}
