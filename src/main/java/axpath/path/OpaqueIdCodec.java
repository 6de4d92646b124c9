package axpath.path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * Converts path strings to compact opaque ids and back.
 *
 * <p>An id is the UTF-8 path, zlib-deflated when that makes it smaller,
 * in URL-safe Base64 without padding. Decoding tries to inflate first and
 * falls back to the raw bytes, so both variants decode.
 */
public final class OpaqueIdCodec {

    private static final Logger log = LoggerFactory.getLogger(OpaqueIdCodec.class);

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private OpaqueIdCodec() {}

    /** Encodes a path string as an opaque id. */
    public static String encode(String path) {
        byte[] raw = path.getBytes(StandardCharsets.UTF_8);
        byte[] deflated = deflate(raw);
        byte[] chosen = deflated.length < raw.length ? deflated : raw;
        log.trace("Encoded path of {} bytes into {} bytes (compressed={})",
                raw.length, chosen.length, chosen == deflated);
        return ENCODER.encodeToString(chosen);
    }

    /**
     * Decodes an opaque id produced by {@link #encode(String)}.
     *
     * @throws ElementPathException if the id is not valid Base64 or not UTF-8 text
     */
    public static String decode(String opaqueId) {
        byte[] data;
        try {
            data = DECODER.decode(opaqueId.trim());
        } catch (IllegalArgumentException e) {
            throw new ElementPathException("Opaque id is not valid base64: " + opaqueId, e);
        }
        byte[] inflated = inflate(data);
        return utf8(inflated != null ? inflated : data, opaqueId);
    }

    /** Accepts either a path string (returned unchanged) or an opaque id. */
    public static String toPathString(String idOrPath) {
        if (ElementPath.isElementPath(idOrPath)) {
            return idOrPath;
        }
        return decode(idOrPath);
    }

    // ── zlib ──────────────────────────────────────────────────────────────

    private static byte[] deflate(byte[] input) {
        Deflater deflater = new Deflater(Deflater.BEST_COMPRESSION);
        try {
            deflater.setInput(input);
            deflater.finish();
            ByteArrayOutputStream out = new ByteArrayOutputStream(input.length);
            byte[] buf = new byte[512];
            while (!deflater.finished()) {
                int n = deflater.deflate(buf);
                out.write(buf, 0, n);
            }
            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }

    /** Inflated bytes, or {@code null} if the input is not a complete zlib stream. */
    private static byte[] inflate(byte[] input) {
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(input);
            ByteArrayOutputStream out = new ByteArrayOutputStream(input.length * 4);
            byte[] buf = new byte[512];
            while (!inflater.finished()) {
                int n = inflater.inflate(buf);
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    return null;
                }
                out.write(buf, 0, n);
            }
            return inflater.getRemaining() == 0 ? out.toByteArray() : null;
        } catch (DataFormatException e) {
            log.trace("Opaque id payload is not deflated: {}", e.getMessage());
            return null;
        } finally {
            inflater.end();
        }
    }

    private static String utf8(byte[] bytes, String opaqueId) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new ElementPathException("Opaque id does not decode to UTF-8 text: " + opaqueId, e);
        }
    }
}
