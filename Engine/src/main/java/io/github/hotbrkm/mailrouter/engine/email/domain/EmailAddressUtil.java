package io.github.hotbrkm.mailrouter.engine.email.domain;

import java.net.IDN;
import java.util.Locale;

public final class EmailAddressUtil {
    /**
     * Label used when email/domain is determined to be invalid
     */
    public static final String INVALID = "INVALID";

    private static final int MAX_LOCAL_PART_LENGTH = 64;
    private static final int MAX_ADDRESS_LENGTH = 254;

    private EmailAddressUtil() {}

    /**
     * Returns the lower-cased ASCII domain of an address, accepting {@code "Name" <user@host>} forms,
     * or {@link #INVALID}.
     */
    public static String extractDomain(String email) {
        String addr = unwrap(email);
        if (addr == null) {
            return INVALID;
        }

        int at = addr.lastIndexOf('@');
        if (at <= 0 || at >= addr.length() - 1) {
            return INVALID;
        }
        return normalizeDomain(addr.substring(at + 1));
    }

    /**
     * Strict check for a bare recipient address: one local part, one {@code @} and a dotted domain.
     */
    public static boolean isValidAddress(String email) {
        if (email == null) {
            return false;
        }
        String addr = email.trim();
        if (addr.isEmpty() || addr.length() > MAX_ADDRESS_LENGTH) {
            return false;
        }
        int at = addr.indexOf('@');
        if (at <= 0 || at != addr.lastIndexOf('@') || at >= addr.length() - 1) {
            return false;
        }

        String local = addr.substring(0, at);
        if (local.length() > MAX_LOCAL_PART_LENGTH || local.startsWith(".") || local.endsWith(".") || local.contains("..")) {
            return false;
        }
        for (int i = 0; i < local.length(); i++) {
            char c = local.charAt(i);
            if (Character.isWhitespace(c) || c == '<' || c == '>' || c == '(' || c == ')' || c == ',' || c == ';'
                    || c == ':' || c == '\\' || c == '"' || c == '[' || c == ']') {
                return false;
            }
        }

        String domain = normalizeDomain(addr.substring(at + 1));
        return !INVALID.equals(domain) && domain.indexOf('.') > 0 && !domain.endsWith(".");
    }

    private static String unwrap(String email) {
        if (email == null) {
            return null;
        }
        String addr = email.trim();
        if (addr.isEmpty()) {
            return null;
        }

        int lt = addr.indexOf('<');
        int gt = addr.indexOf('>');
        if (lt >= 0 && gt > lt) {
            addr = addr.substring(lt + 1, gt).trim();
        }
        if (addr.startsWith("\"") && addr.endsWith("\"") && addr.length() >= 2) {
            addr = addr.substring(1, addr.length() - 1).trim();
        }
        return addr;
    }

    private static String normalizeDomain(String domain) {
        String dom = domain.trim();
        if (dom.isEmpty() || dom.charAt(0) == '[') {
            return INVALID;
        }
        if (dom.endsWith(".")) {
            dom = dom.substring(0, dom.length() - 1);
        }

        String asciiDom;
        try {
            asciiDom = IDN.toASCII(dom);
        } catch (IllegalArgumentException e) {
            return INVALID;
        }

        for (char c : asciiDom.toCharArray()) {
            if (c == ',' || c == '"' || c == '\'' || c == '<' || c == '>' || c == '\\' || c == '/' || c == ' ' || c == ':' || c == '@') {
                return INVALID;
            }
        }
        if (asciiDom.length() <= 2 || asciiDom.startsWith(".") || asciiDom.contains("..")) {
            return INVALID;
        }

        return asciiDom.toLowerCase(Locale.ROOT);
    }
}
