package io.dataquest.decode;

import io.dataquest.core.Record;
import io.dataquest.core.Transform;
import io.dataquest.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Turns raw bytes into text without ever failing: strict UTF-8 first, then ISO-8859-1 (which maps every
 * byte), and as a last resort UTF-8 with malformed sequences replaced by U+FFFD. A leading byte-order mark
 * is dropped.
 */
public class ByteDecoder implements Transform<byte[], String> {
    private static final Logger log = LoggerFactory.getLogger(ByteDecoder.class);
    private static final char BOM = '\uFEFF';

    private final Metrics metrics;

    public ByteDecoder() { this(Metrics.detached()); }
    public ByteDecoder(Metrics metrics) { this.metrics = metrics; }

    @Override
    public Record<String> apply(Record<byte[]> input) {
        return input.withPayload(decode(input.key(), input.payload()));
    }

    public String decode(byte[] bytes) {
        return decode("-", bytes);
    }

    private String decode(String key, byte[] bytes) {
        if (bytes == null || bytes.length == 0) return "";
        String text;
        try {
            text = strict(bytes, StandardCharsets.UTF_8);
            count(key, "utf-8");
        } catch (CharacterCodingException notUtf8) {
            try {
                text = strict(bytes, StandardCharsets.ISO_8859_1);
                count(key, "latin-1");
            } catch (CharacterCodingException | RuntimeException e) {
                text = new String(bytes, StandardCharsets.UTF_8);
                count(key, "utf-8-replace");
            }
        }
        return stripBom(text);
    }

    private static String strict(byte[] bytes, Charset cs) throws CharacterCodingException {
        return cs.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
    }

    private void count(String key, String charset) {
        metrics.counter("decode." + charset).inc();
        log.debug("Decoded {} as {}", key, charset);
    }

    private static String stripBom(String s) {
        return !s.isEmpty() && s.charAt(0) == BOM ? s.substring(1) : s;
    }
}
