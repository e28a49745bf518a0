package com.mike.contactenricher.extract;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default {@link ContactExtractor}: jsoup for links and attributes, regexes for free text.
 * Heuristics are deliberately basic.
 */
@Component
@Slf4j
public class HtmlContactExtractor implements ContactExtractor {

    // =========================
    // Patterns
    // =========================

    private static final Pattern EMAIL_PATTERN =
            Pattern.compile("[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}");

    private static final Pattern LOCAL_PART_PATTERN =
            Pattern.compile("^[a-z0-9._%+-]{1,64}$");

    private static final Pattern AT_BRACKETS =
            Pattern.compile("(?i)\\s*[\\(\\[\\{<]\\s*at\\s*[\\)\\]\\}>]\\s*");
    private static final Pattern DOT_BRACKETS =
            Pattern.compile("(?i)\\s*[\\(\\[\\{<]\\s*dot\\s*[\\)\\]\\}>]\\s*");

    private static final Pattern WHATSAPP_PATTERN = Pattern.compile(
            "(?i)(?:wa\\.me/|api\\.whatsapp\\.com/send/?\\?phone=|whatsapp://send\\?phone=)(\\+?[\\d\\s-]{7,20})");

    /** Asset names that happen to look like addresses, e.g. {@code logo@2x.png}. */
    private static final Set<String> ASSET_SUFFIXES = Set.of(
            ".png", ".jpg", ".jpeg", ".gif", ".svg", ".webp", ".css", ".js");

    private static final Set<String> PLACEHOLDER_DOMAINS = Set.of(
            "example.com", "domain.com", "yourdomain.com", "mysite.com", "email.com", "sentry.io");

    private static final Map<String, Pattern> SOCIAL_PATTERNS = new LinkedHashMap<>();

    static {
        SOCIAL_PATTERNS.put("facebook", Pattern.compile("(?i)^https?://(?:[a-z]+\\.)?(?:facebook\\.com|fb\\.com)/(?!sharer|share\\.php|dialog|plugins)[^/?#\\s]+"));
        SOCIAL_PATTERNS.put("instagram", Pattern.compile("(?i)^https?://(?:www\\.)?instagram\\.com/(?!p/|explore)[^/?#\\s]+"));
        SOCIAL_PATTERNS.put("linkedin", Pattern.compile("(?i)^https?://(?:[a-z]+\\.)?linkedin\\.com/(?:company|in|school)/[^/?#\\s]+"));
        SOCIAL_PATTERNS.put("tiktok", Pattern.compile("(?i)^https?://(?:www\\.)?tiktok\\.com/@[^/?#\\s]+"));
        SOCIAL_PATTERNS.put("youtube", Pattern.compile("(?i)^https?://(?:www\\.)?youtube\\.com/(?:channel/|c/|user/|@)[^/?#\\s]+"));
    }

    // =========================
    // Public API
    // =========================

    @Override
    public ExtractedContacts extract(String html, String pageUrl) {
        if (html == null || html.isBlank()) {
            return ExtractedContacts.empty();
        }

        Document doc = Jsoup.parse(html, pageUrl == null ? "" : pageUrl);
        ExtractedContacts.ExtractedContactsBuilder out = ExtractedContacts.builder();

        extractEmails(doc).forEach(out::email);
        extractPhones(doc).forEach(out::phone);
        extractWhatsapp(doc, html).forEach(out::whatsappNumber);

        Map<String, String> socials = extractSocials(doc);
        out.facebook(socials.get("facebook"))
                .instagram(socials.get("instagram"))
                .linkedin(socials.get("linkedin"))
                .tiktok(socials.get("tiktok"))
                .youtube(socials.get("youtube"));

        ExtractedContacts contacts = out.build();
        log.debug("EXTRACT: {} -> emails={}, phones={}, whatsapp={}",
                pageUrl, contacts.getEmails().size(), contacts.getPhones().size(), contacts.getWhatsapp().size());
        return contacts;
    }

    // =========================
    // Emails
    // =========================

    Set<String> extractEmails(Document doc) {
        Set<String> results = new LinkedHashSet<>();

        // 1) Cloudflare data-cfemail
        for (Element el : doc.select("[data-cfemail]")) {
            addEmail(results, CloudflareEmailDecoder.decode(el.attr("data-cfemail")));
        }

        // 2) mailto: links
        for (Element a : doc.select("a[href]")) {
            String href = a.attr("href").trim();
            if (!href.regionMatches(true, 0, "mailto:", 0, 7)) continue;

            String raw = href.substring(7);
            int q = raw.indexOf('?');
            if (q >= 0) raw = raw.substring(0, q);
            addEmail(results, normalizeObfuscation(raw));
        }

        // 3) plain and (at)/(dot) addresses in visible text
        Matcher matcher = EMAIL_PATTERN.matcher(normalizeObfuscation(doc.text()));
        while (matcher.find()) {
            addEmail(results, matcher.group());
        }

        return results;
    }

    static String normalizeObfuscation(String input) {
        if (input == null || input.isBlank()) return input;
        String s = AT_BRACKETS.matcher(input).replaceAll("@");
        return DOT_BRACKETS.matcher(s).replaceAll(".");
    }

    static String normalizeEmail(String raw) {
        if (raw == null) return null;

        String email = urlDecode(raw).trim().toLowerCase(Locale.ROOT)
                .replaceAll("^[\"'<>()\\[\\];:,]+", "")
                .replaceAll("[)\\]}.,;:'\"<>]+$", "");
        if (email.isEmpty()) return null;

        int at = email.indexOf('@');
        if (at <= 0 || email.indexOf('@', at + 1) != -1) return null;

        String local = email.substring(0, at);
        String domain = email.substring(at + 1);
        if (!LOCAL_PART_PATTERN.matcher(local).matches()) return null;
        if (domain.indexOf('.') <= 0 || domain.startsWith("-") || domain.contains("..")) return null;
        if (PLACEHOLDER_DOMAINS.contains(domain)) return null;
        for (String suffix : ASSET_SUFFIXES) {
            if (domain.endsWith(suffix)) return null;
        }

        return local + "@" + domain;
    }

    private static String urlDecode(String raw) {
        if (!raw.contains("%")) return raw;
        try {
            return URLDecoder.decode(raw, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.debug("URL decode failed for candidate: '{}'", raw);
            return raw;
        }
    }

    private static void addEmail(Set<String> results, String candidate) {
        String normalized = normalizeEmail(candidate);
        if (normalized != null) results.add(normalized);
    }

    // =========================
    // Phones / WhatsApp
    // =========================

    Set<String> extractPhones(Document doc) {
        Set<String> results = new LinkedHashSet<>();
        for (Element a : doc.select("a[href]")) {
            String href = a.attr("href").trim();
            if (!href.regionMatches(true, 0, "tel:", 0, 4)) continue;

            String number = normalizePhone(urlDecode(href.substring(4)));
            if (number != null) results.add(number);
        }
        return results;
    }

    Set<String> extractWhatsapp(Document doc, String html) {
        Set<String> results = new LinkedHashSet<>();
        for (Element a : doc.select("a[href]")) {
            collectWhatsapp(a.attr("href"), results);
        }
        collectWhatsapp(html, results);
        return results;
    }

    private static void collectWhatsapp(String text, Set<String> results) {
        Matcher m = WHATSAPP_PATTERN.matcher(text);
        while (m.find()) {
            String number = normalizePhone(m.group(1));
            if (number != null) results.add(number);
        }
    }

    /**
     * Keeps digits and a leading plus; 7 to 15 digits, the E.164 bounds.
     */
    static String normalizePhone(String raw) {
        if (raw == null) return null;
        String trimmed = raw.trim();
        String digits = trimmed.replaceAll("\\D", "");
        if (digits.length() < 7 || digits.length() > 15) return null;
        return trimmed.startsWith("+") ? "+" + digits : digits;
    }

    // =========================
    // Social links
    // =========================

    Map<String, String> extractSocials(Document doc) {
        Map<String, String> found = new LinkedHashMap<>();
        for (Element a : doc.select("a[href]")) {
            String href = a.absUrl("href");
            if (href.isEmpty()) href = a.attr("href");

            for (Map.Entry<String, Pattern> entry : SOCIAL_PATTERNS.entrySet()) {
                if (found.containsKey(entry.getKey())) continue;
                Matcher m = entry.getValue().matcher(href);
                if (m.find()) {
                    found.put(entry.getKey(), m.group());
                }
            }
        }
        return found;
    }
}
