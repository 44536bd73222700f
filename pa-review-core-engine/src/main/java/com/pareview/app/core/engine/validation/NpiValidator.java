package com.pareview.app.core.engine.validation;

/**
 * Structural check for National Provider Identifiers.
 *
 * <p>An NPI is ten digits whose last digit is a Luhn check digit computed over the
 * card-issuer prefix {@code 80840} followed by the first nine digits.</p>
 */
public final class NpiValidator {

    private static final String ISSUER_PREFIX = "80840";

    private NpiValidator() {
    }

    public static boolean isValid(String npi) {
        if (npi == null || npi.length() != 10 || !npi.chars().allMatch(Character::isDigit)) {
            return false;
        }
        String digits = ISSUER_PREFIX + npi;
        int sum = 0;
        boolean doubleIt = false;
        for (int i = digits.length() - 1; i >= 0; i--) {
            int digit = digits.charAt(i) - '0';
            if (doubleIt) {
                digit *= 2;
                if (digit > 9) {
                    digit -= 9;
                }
            }
            sum += digit;
            doubleIt = !doubleIt;
        }
        return sum % 10 == 0;
    }
}
