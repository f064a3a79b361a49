package in.quotestream.security;

import java.util.regex.Pattern;

/**
 * Validator for client-supplied feed identifiers.
 *
 * Rules:
 * - Symbols: 1-64 printable ASCII chars, no whitespace. Provider identifiers
 *   such as {@code ^GSPC} or {@code GC=F} are passed through as given.
 * - Case is preserved (CoinGecko ids are lowercase, equities uppercase)
 * - Nonces: short, printable, echoed back verbatim in pongs
 */
public class InputValidator {

    private static final Pattern SYMBOL_PATTERN = Pattern.compile("^[!-~]+$");
    private static final Pattern NONCE_PATTERN = Pattern.compile("^[A-Za-z0-9_.:-]*$");

    private static final int MAX_SYMBOL_LENGTH = 64;
    private static final int MAX_NONCE_LENGTH = 64;

    /**
     * Validate feed symbol.
     *
     * Valid formats:
     * - AAPL
     * - bitcoin
     * - EUR/USD
     * - BRK.B
     * - ^GSPC
     * - GC=F
     *
     * @param symbol Feed symbol
     * @return true if valid
     */
    public boolean isValidSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return false;
        }

        if (symbol.length() > MAX_SYMBOL_LENGTH) {
            return false;
        }

        return SYMBOL_PATTERN.matcher(symbol).matches();
    }

    /**
     * Nonces are optional; null counts as valid.
     */
    public boolean isValidNonce(String nonce) {
        if (nonce == null) {
            return true;
        }
        return nonce.length() <= MAX_NONCE_LENGTH && NONCE_PATTERN.matcher(nonce).matches();
    }
}
