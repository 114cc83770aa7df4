package com.mimecast.forwarder.mime;

import jakarta.mail.internet.MimeUtility;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Base64;
import org.apache.commons.codec.net.QuotedPrintableCodec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * RFC 2047 header value decoder.
 *
 * <p>Decodes every encoded word with its own charset, so a subject made of segments in
 * different charsets comes out as one string.
 * <p>Whitespace between two adjacent encoded words is dropped, folded lines are unfolded,
 * and the result has runs of whitespace collapsed to a single space.
 * <p>Unknown charsets decode as UTF-8 and undecodable bytes are dropped rather than
 * replaced, so no replacement characters end up in a forwarded subject.
 */
public final class HeaderDecoder {
    private static final Logger log = LogManager.getLogger(HeaderDecoder.class);

    /**
     * Pattern to match RFC 2047 encoded words.
     */
    private static final Pattern ENCODED_WORD_PATTERN = Pattern.compile(
            "=\\?([^?]+)\\?([BQbq])\\?([^?]*)\\?="
    );

    private HeaderDecoder() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Decodes a raw header value.
     *
     * @param value Raw header value, may be null.
     * @return Decoded, whitespace collapsed value. Never null.
     */
    public static String decode(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }

        String unfolded = value.replaceAll("\\r?\\n", "");
        StringBuilder decoded = new StringBuilder();
        Matcher matcher = ENCODED_WORD_PATTERN.matcher(unfolded);

        int last = 0;
        boolean previousEncoded = false;
        while (matcher.find()) {
            String gap = unfolded.substring(last, matcher.start());
            if (!(previousEncoded && gap.isBlank())) {
                decoded.append(gap);
            }

            decoded.append(decodeWord(matcher.group(1), matcher.group(2), matcher.group(3), matcher.group()));
            previousEncoded = true;
            last = matcher.end();
        }
        decoded.append(unfolded.substring(last));

        return decoded.toString().replaceAll("\\s+", " ").trim();
    }

    /**
     * Decodes a single encoded word.
     *
     * @param charset  Declared charset, optionally with an RFC 2231 language suffix.
     * @param encoding B or Q.
     * @param text     Encoded text.
     * @param word     Whole encoded word, returned as is when it cannot be decoded.
     * @return Decoded string.
     */
    private static String decodeWord(String charset, String encoding, String text, String word) {
        byte[] bytes;
        if ("B".equalsIgnoreCase(encoding)) {
            bytes = Base64.decodeBase64(text);
        } else {
            try {
                bytes = QuotedPrintableCodec.decodeQuotedPrintable(text.replace('_', ' ').getBytes(StandardCharsets.US_ASCII));
            } catch (DecoderException e) {
                log.debug("Unable to decode Q encoded word {}: {}", word, e.getMessage());
                return word;
            }
        }

        return toString(bytes, resolveCharset(charset));
    }

    private static Charset resolveCharset(String declared) {
        String name = declared;
        int language = name.indexOf('*');
        if (language > 0) {
            name = name.substring(0, language);
        }

        try {
            return Charset.forName(MimeUtility.javaCharset(name));
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            log.debug("Unknown charset {}, decoding as UTF-8", declared);
            return StandardCharsets.UTF_8;
        }
    }

    private static String toString(byte[] bytes, Charset charset) {
        try {
            return charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.IGNORE)
                    .onUnmappableCharacter(CodingErrorAction.IGNORE)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            return new String(bytes, charset);
        }
    }
}
