package com.questrail.harness.capability;

/**
 * Validation of checkitem, argument and extra-info names.
 *
 * <p>A label starts with an ASCII letter and continues with letters, digits,
 * {@code '-'} or {@code '.'}.</p>
 */
public final class Labels
{
    private Labels() {}

    public static boolean isValid(String label)
    {
        if (label == null || label.isEmpty() || !isAsciiLetter(label.charAt(0))) {
            return false;
        }
        for (int i = 1; i < label.length(); i++) {
            char c = label.charAt(i);
            if (!isAsciiLetter(c) && !(c >= '0' && c <= '9') && c != '-' && c != '.') {
                return false;
            }
        }
        return true;
    }

    /**
     * @throws IllegalArgumentException if {@code label} is not a valid label
     */
    public static String require(String label, String what)
    {
        if (!isValid(label)) {
            throw new IllegalArgumentException("Invalid " + what + " label: '" + label + "'");
        }
        return label;
    }

    private static boolean isAsciiLetter(char c)
    {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
