package com.collectiveip.ledger.kernel;

import com.collectiveip.core.exception.AuthorizationException;
import com.collectiveip.core.exception.ErrorReason;
import com.collectiveip.core.exception.ValidationException;
import com.collectiveip.core.support.Addresses;

import java.math.BigInteger;

/**
 * Precondition checks shared by every ledger entry point.
 */
public final class Guards {

    private Guards() {}

    public static String caller(String caller) {
        return Addresses.normalize(caller, "caller");
    }

    public static <T> T requirePresent(T value, String field) {
        if (value == null) {
            throw new ValidationException(ErrorReason.MISSING_FIELD, field + " is required");
        }
        return value;
    }

    public static BigInteger requirePositive(BigInteger amount, String field) {
        requirePresent(amount, field);
        if (amount.signum() <= 0) {
            throw new ValidationException(ErrorReason.NON_POSITIVE_AMOUNT, field + " must be positive, got " + amount);
        }
        return amount;
    }

    public static BigInteger requireNonNegative(BigInteger amount, String field) {
        requirePresent(amount, field);
        if (amount.signum() < 0) {
            throw new ValidationException(ErrorReason.NEGATIVE_AMOUNT, field + " cannot be negative, got " + amount);
        }
        return amount;
    }

    public static void requireAdministrator(LedgerConfiguration config, String caller) {
        if (!config.administrator().equals(caller)) {
            throw new AuthorizationException(ErrorReason.NOT_ADMINISTRATOR, caller + " is not the administrator");
        }
    }
}
