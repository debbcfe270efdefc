package com.example.PhishGuard.service;

import com.example.PhishGuard.dto.AttachmentDto;
import com.example.PhishGuard.exceptions.ReputationLookupException;
import com.example.PhishGuard.models.AttachmentRecord;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URLConnection;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Fingerprints attachments and scores how risky they look.
 * <p>
 * The score is the larger of a local heuristic over name, declared type and content, and the
 * external reputation for the content hash. A reputation failure never fails the submission; the
 * score is raised to at least {@link #UNKNOWN_SCORE} instead.
 */
@Service
public class AttachmentAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(AttachmentAnalyzer.class);

    public static final String UNKNOWN_CONTENT_TYPE = "unknown";
    public static final double UNKNOWN_SCORE = 50.0;
    public static final double MAX_SCORE = 100.0;

    private static final Set<String> EXECUTABLE_EXTENSIONS = Set.of(
            "exe", "scr", "com", "pif", "bat", "cmd", "msi", "dll", "jar", "vbs", "vbe",
            "js", "jse", "wsf", "wsh", "hta", "ps1", "lnk", "reg", "cpl", "iso");
    private static final Set<String> MACRO_EXTENSIONS = Set.of("docm", "dotm", "xlsm", "xltm", "xlam", "pptm", "potm");
    private static final Set<String> ARCHIVE_EXTENSIONS = Set.of("zip", "rar", "7z", "gz", "tar", "cab");
    private static final Set<String> DECOY_EXTENSIONS = Set.of(
            "pdf", "doc", "docx", "xls", "xlsx", "ppt", "pptx", "txt", "jpg", "jpeg", "png", "gif", "csv", "rtf");
    private static final Pattern DANGEROUS_HREF =
            Pattern.compile("href\\s*=\\s*['\"]?\\s*(javascript:|vbscript:|data:)", Pattern.CASE_INSENSITIVE);

    private final ReputationLookup reputationLookup;

    public AttachmentAnalyzer(ReputationLookup reputationLookup) {
        this.reputationLookup = reputationLookup;
    }

    public AttachmentRecord analyze(String filename, String contentType, byte[] data) {
        return analyze(filename, contentType, data, new HashMap<>());
    }

    /**
     * Analyzes every attachment independently; the output order mirrors the input order and
     * each distinct hash is looked up at most once.
     */
    public List<AttachmentRecord> analyzeAll(List<AttachmentDto> attachments) {
        Map<String, ReputationOutcome> lookups = new HashMap<>();
        List<AttachmentRecord> records = new ArrayList<>(attachments.size());
        for (AttachmentDto attachment : attachments) {
            AttachmentRecord record = analyze(attachment.getFilename(), attachment.getContentType(),
                    attachment.getData(), lookups);
            records.add(record);
        }
        return records;
    }

    private AttachmentRecord analyze(String filename, String declaredType, byte[] data,
                                     Map<String, ReputationOutcome> lookups) {
        byte[] content = data == null ? new byte[0] : data;
        String name = filename == null || filename.isBlank() ? "attachment" : filename.strip();
        String sha256 = sha256Hex(content);
        String contentType = resolveContentType(name, declaredType, content);

        double heuristic = heuristicScore(name, declaredType, contentType, content);
        boolean seen = lookups.containsKey(sha256);
        ReputationOutcome reputation = lookups.computeIfAbsent(sha256, this::consultReputation);
        if (seen) {
            logger.info("Duplicate attachment content within submission: {} ({})", name, sha256);
        }

        double score = heuristic;
        if (reputation.failed()) {
            score = Math.max(score, UNKNOWN_SCORE);
        } else if (reputation.score().isPresent()) {
            score = Math.max(score, reputation.score().getAsDouble());
        }
        score = Math.min(MAX_SCORE, Math.max(0.0, score));

        logger.info("Attachment {} ({}, {} bytes) sha256={} score={}", name, contentType, content.length, sha256, score);
        return new AttachmentRecord(name, contentType, content.length, sha256, score);
    }

    private ReputationOutcome consultReputation(String sha256) {
        try {
            return new ReputationOutcome(reputationLookup.lookup(sha256), false);
        } catch (ReputationLookupException e) {
            logger.warn("Reputation lookup failed, scoring as unknown: {}", e.getMessage());
            return new ReputationOutcome(OptionalDouble.empty(), true);
        } catch (RuntimeException e) {
            logger.warn("Reputation lookup for {} broke unexpectedly, scoring as unknown", sha256, e);
            return new ReputationOutcome(OptionalDouble.empty(), true);
        }
    }

    public static String sha256Hex(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Declared type first, then the filename extension, then the leading bytes.
     */
    String resolveContentType(String filename, String declaredType, byte[] content) {
        if (declaredType != null && !declaredType.isBlank()) {
            return declaredType.strip();
        }
        Optional<MediaType> byName = MediaTypeFactory.getMediaType(filename);
        if (byName.isPresent()) {
            return byName.get().toString();
        }
        if (content.length > 0) {
            try (InputStream in = new ByteArrayInputStream(content)) {
                String sniffed = URLConnection.guessContentTypeFromStream(in);
                if (sniffed != null) {
                    return sniffed;
                }
            } catch (IOException e) {
                logger.debug("Content sniffing failed for {}: {}", filename, e.getMessage());
            }
        }
        return UNKNOWN_CONTENT_TYPE;
    }

    double heuristicScore(String filename, String declaredType, String contentType, byte[] content) {
        if (content.length == 0) {
            return 0.0;
        }
        String lower = filename.toLowerCase(Locale.ROOT);
        String extension = extensionOf(lower);
        double score = 0.0;

        if (EXECUTABLE_EXTENSIONS.contains(extension)) {
            score += 70;
        } else if (MACRO_EXTENSIONS.contains(extension)) {
            score += 40;
        } else if (ARCHIVE_EXTENSIONS.contains(extension)) {
            score += 10;
        }

        if (hasDecoyDoubleExtension(lower)) {
            score += 25;
        }

        if (isPortableExecutable(content) && !EXECUTABLE_EXTENSIONS.contains(extension)) {
            score += 60;
        }

        if (declaredType != null && !declaredType.isBlank() && declaredTypeMismatch(filename, declaredType)) {
            score += 15;
        }

        if (isHtml(extension, contentType) && containsActiveContent(new String(content, StandardCharsets.UTF_8))) {
            score += 40;
        }

        return Math.min(MAX_SCORE, score);
    }

    private static String extensionOf(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot < 0 || dot == filename.length() - 1 ? "" : filename.substring(dot + 1);
    }

    private static boolean hasDecoyDoubleExtension(String lower) {
        String[] parts = lower.split("\\.");
        if (parts.length < 3) {
            return false;
        }
        String last = parts[parts.length - 1];
        String inner = parts[parts.length - 2];
        return DECOY_EXTENSIONS.contains(inner) && (EXECUTABLE_EXTENSIONS.contains(last) || ARCHIVE_EXTENSIONS.contains(last));
    }

    private static boolean isPortableExecutable(byte[] content) {
        return content.length >= 2 && content[0] == 'M' && content[1] == 'Z';
    }

    private static boolean declaredTypeMismatch(String filename, String declaredType) {
        Optional<MediaType> expected = MediaTypeFactory.getMediaType(filename);
        if (expected.isEmpty()) {
            return false;
        }
        try {
            MediaType declared = MediaType.parseMediaType(declaredType);
            if (MediaType.APPLICATION_OCTET_STREAM.equalsTypeAndSubtype(declared)) {
                return false;
            }
            return !declared.getType().equalsIgnoreCase(expected.get().getType());
        } catch (IllegalArgumentException e) {
            return true;
        }
    }

    private static boolean isHtml(String extension, String contentType) {
        return "html".equals(extension) || "htm".equals(extension)
                || contentType.toLowerCase(Locale.ROOT).startsWith("text/html");
    }

    static boolean containsActiveContent(String html) {
        if (DANGEROUS_HREF.matcher(html).find()) {
            return true;
        }
        Document doc = Jsoup.parse(html);
        if (!doc.select("script").isEmpty()) {
            return true;
        }
        for (Element el : doc.getAllElements()) {
            for (Attribute attr : el.attributes()) {
                if (attr.getKey().toLowerCase(Locale.ROOT).startsWith("on")) {
                    return true;
                }
            }
        }
        return false;
    }

    private record ReputationOutcome(OptionalDouble score, boolean failed) {
    }
}
