package com.mike.contactenricher.extract;

/**
 * Decodes the {@code data-cfemail} attribute Cloudflare uses to hide addresses from scrapers:
 * the first byte is the XOR key for every following byte.
 */
final class CloudflareEmailDecoder {

    private CloudflareEmailDecoder() {
    }

    /**
     * @return the decoded address, or null when the value is not valid hex
     */
    static String decode(String cfemail) {
        if (cfemail == null || cfemail.length() < 4 || cfemail.length() % 2 != 0) {
            return null;
        }
        try {
            int key = Integer.parseInt(cfemail.substring(0, 2), 16);
            StringBuilder email = new StringBuilder();
            for (int n = 2; n < cfemail.length(); n += 2) {
                int c = Integer.parseInt(cfemail.substring(n, n + 2), 16) ^ key;
                email.append((char) c);
            }
            return email.toString();
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
