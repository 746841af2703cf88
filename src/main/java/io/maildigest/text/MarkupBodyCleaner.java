package io.maildigest.text;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strips markup, quoted replies, signatures, disclaimers and inline image
 * references, then collapses blank lines and truncates.
 */
public final class MarkupBodyCleaner implements BodyCleaner {
    private static final Map<String, String> ENTITIES = Map.of(
            "&amp;", "&",
            "&lt;", "<",
            "&gt;", ">",
            "&quot;", "\"",
            "&#39;", "'",
            "&apos;", "'",
            "&nbsp;", " "
    );

    private static final Pattern TAG = Pattern.compile("<[^>]*>");
    private static final Pattern ENTITY = Pattern.compile("&\\w+;|&#\\d+;");
    private static final Pattern REPLY_HEADER = Pattern.compile(
            "\\n*On\\s+.{10,80}\\s+wrote:\\s*\\n(>[^\\n]*\\n?)*", Pattern.CASE_INSENSITIVE);
    private static final Pattern QUOTE_BLOCK = Pattern.compile("\\n*(?:^|\\n)(>[^\\n]*\\n?)+");
    private static final Pattern SIGNATURE = Pattern.compile("\\n--\\s*\\n[\\s\\S]*$", Pattern.MULTILINE);
    private static final Pattern SENT_FROM = Pattern.compile("\\n*Sent from my [\\w\\s]+$", Pattern.CASE_INSENSITIVE);
    private static final Pattern SIGN_OFF = Pattern.compile(
            "\\n*(?:Best regards|Kind regards|Regards|Cheers|Thanks|Best),?\\s*\\n[\\s\\S]{0,200}$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern DISCLAIMER = Pattern.compile(
            "\\n*(?:This email is confidential|CONFIDENTIALITY NOTICE|DISCLAIMER"
                    + "|If you (?:are not|received this in error))[\\s\\S]*$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern INLINE_IMAGE = Pattern.compile("\\[(?:image|cid:[^\\]]*)\\]", Pattern.CASE_INSENSITIVE);
    private static final Pattern IMAGE_LINK = Pattern.compile(
            "\\[https?://[^\\]]*\\.(?:png|gif|jpg|jpeg|bmp)\\]", Pattern.CASE_INSENSITIVE);
    private static final Pattern BLANK_RUN = Pattern.compile("\\n{3,}");

    @Override
    public String clean(String rawBody, int maxLength) {
        if (rawBody == null || rawBody.isEmpty()) {
            return "";
        }
        String body = TAG.matcher(rawBody).replaceAll("");
        body = decodeEntities(body);
        body = REPLY_HEADER.matcher(body).replaceAll("");
        body = QUOTE_BLOCK.matcher(body).replaceAll("");
        body = SIGNATURE.matcher(body).replaceAll("");
        body = SENT_FROM.matcher(body).replaceAll("");
        body = SIGN_OFF.matcher(body).replaceAll("");
        body = DISCLAIMER.matcher(body).replaceAll("");
        body = INLINE_IMAGE.matcher(body).replaceAll("");
        body = IMAGE_LINK.matcher(body).replaceAll("");
        body = BLANK_RUN.matcher(body).replaceAll("\n\n").strip();
        if (maxLength >= 0 && body.length() > maxLength) {
            body = body.substring(0, maxLength);
        }
        return body;
    }

    private static String decodeEntities(String body) {
        Matcher matcher = ENTITY.matcher(body);
        StringBuilder out = new StringBuilder(body.length());
        while (matcher.find()) {
            String match = matcher.group();
            matcher.appendReplacement(out, Matcher.quoteReplacement(ENTITIES.getOrDefault(match, match)));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
