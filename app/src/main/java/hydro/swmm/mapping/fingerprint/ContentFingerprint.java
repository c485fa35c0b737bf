package hydro.swmm.mapping.fingerprint;

import hydro.swmm.mapping.parse.SectionParser;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Computes a formatting-insensitive MD5 fingerprint of a model description file.
 * Blank lines, comment lines and whitespace runs between tokens do not affect the result.
 */
public final class ContentFingerprint {

    private static final String ALGORITHM = "MD5";
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\r|\\n");

    private ContentFingerprint() {
    }

    public static String of(Path file) {
        Objects.requireNonNull(file, "file");
        return of(SectionParser.read(file));
    }

    public static String of(String content) {
        byte[] canonical = canonicalize(content).getBytes(StandardCharsets.UTF_8);
        return HexFormat.of().formatHex(digest().digest(canonical));
    }

    /**
     * Canonical text the digest is taken over: one normalized, newline-joined line per semantic line.
     */
    public static String canonicalize(String content) {
        Objects.requireNonNull(content, "content");
        List<String> meaningful = new ArrayList<>();
        for (String raw : LINE_BREAK.split(content)) {
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith(";")) {
                continue;
            }
            meaningful.add(WHITESPACE.matcher(line).replaceAll(" "));
        }
        return String.join("\n", meaningful);
    }

    private static MessageDigest digest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException(ALGORITHM + " digest is not available", ex);
        }
    }
}
