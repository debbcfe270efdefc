package com.example.PhishGuard.utils;

import com.example.PhishGuard.dto.AttachmentDto;
import com.example.PhishGuard.models.EmailSubmission;
import jakarta.mail.Address;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.Session;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeUtility;
import org.jsoup.Jsoup;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Utility for turning a raw RFC 822 message into a classifiable submission.
 */
public final class EmailParser {

    private static final Session LENIENT_SESSION = lenientSession();

    private EmailParser() {
    }

    public static ParsedEmail parse(byte[] rawEmailBytes) throws MessagingException, IOException {
        Objects.requireNonNull(rawEmailBytes, "rawEmailBytes");
        MimeMessage message = new MimeMessage(LENIENT_SESSION, new ByteArrayInputStream(rawEmailBytes));
        BodyCollector collector = new BodyCollector();
        List<AttachmentDto> attachments = new ArrayList<>();
        walk(message, collector, attachments);
        return new ParsedEmail(
                message.getSubject(),
                collector.text(),
                firstHeader(message, "Message-ID"),
                senderOf(message),
                Collections.unmodifiableList(attachments)
        );
    }

    // phishing mail routinely carries malformed address headers
    private static Session lenientSession() {
        Properties props = new Properties();
        props.setProperty("mail.mime.address.strict", "false");
        return Session.getInstance(props);
    }

    private static String senderOf(MimeMessage message) throws MessagingException {
        Address[] from;
        try {
            from = message.getFrom();
        } catch (AddressException e) {
            return firstHeader(message, "From");
        }
        if (from == null || from.length == 0) {
            String returnPath = firstHeader(message, "Return-Path");
            return returnPath == null ? null : returnPath.replaceAll("[<>]", "").strip();
        }
        return from[0] instanceof InternetAddress internetAddress ? internetAddress.getAddress() : from[0].toString();
    }

    private static String firstHeader(MimeMessage message, String name) throws MessagingException {
        String value = message.getHeader(name, null);
        return value == null || value.isBlank() ? null : value.strip();
    }

    private static void walk(Part part, BodyCollector collector, List<AttachmentDto> attachments)
            throws MessagingException, IOException {
        if (part.isMimeType("multipart/*")) {
            Multipart multipart = (Multipart) part.getContent();
            for (int i = 0; i < multipart.getCount(); i++) {
                walk(multipart.getBodyPart(i), collector, attachments);
            }
            return;
        }

        String disposition = part.getDisposition();
        String fileName = part.getFileName();
        boolean hasFileName = fileName != null && !fileName.isBlank();
        boolean isAttachment = Part.ATTACHMENT.equalsIgnoreCase(disposition)
                || (Part.INLINE.equalsIgnoreCase(disposition) && hasFileName);
        if (hasFileName || isAttachment) {
            String decodedFileName = hasFileName ? MimeUtility.decodeText(fileName) : "attachment";
            String contentType = baseType(part.getContentType());
            try (InputStream dataStream = part.getInputStream()) {
                attachments.add(new AttachmentDto(decodedFileName, contentType, dataStream.readAllBytes()));
            }
            return;
        }

        if (part.isMimeType("text/plain")) {
            collector.offerPlain(String.valueOf(part.getContent()));
        } else if (part.isMimeType("text/html")) {
            collector.offerHtml(String.valueOf(part.getContent()));
        }
    }

    // drops parameters such as charset/name; blank means "let the analyzer decide"
    private static String baseType(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return null;
        }
        int semicolon = contentType.indexOf(';');
        String base = (semicolon < 0 ? contentType : contentType.substring(0, semicolon)).trim();
        return base.isEmpty() ? null : base.toLowerCase(Locale.ROOT);
    }

    private static final class BodyCollector {
        private String plain;
        private String html;

        void offerPlain(String text) {
            if (plain == null && !text.isBlank()) {
                plain = text;
            }
        }

        void offerHtml(String markup) {
            if (html == null && !markup.isBlank()) {
                html = markup;
            }
        }

        String text() {
            if (plain != null) {
                return plain.strip();
            }
            if (html != null) {
                return Jsoup.parse(html).text();
            }
            return "";
        }
    }

    public record ParsedEmail(String subject, String body, String messageId, String sourceAddr,
                              List<AttachmentDto> attachments) {

        public EmailSubmission toSubmission() {
            return new EmailSubmission(subject, body, attachments);
        }
    }
}
