package com.eyelevel.documentanalyzer.service.processing;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Decodes file content as UTF-8. Malformed input never fails the decode: it falls back to a
 * lossy decoding in which every invalid sequence becomes U+FFFD. The result depends only on
 * the bytes.
 */
public final class Utf8TextDecoder {

    private Utf8TextDecoder() {
    }

    /**
     * @param text  the decoded text.
     * @param lossy {@code true} if replacement characters were substituted for malformed input.
     */
    public record DecodedText(String text, boolean lossy) {
    }

    public static DecodedText decode(final byte[] content) {
        try {
            final String strict = StandardCharsets.UTF_8.newDecoder()
                                                        .onMalformedInput(CodingErrorAction.REPORT)
                                                        .onUnmappableCharacter(CodingErrorAction.REPORT)
                                                        .decode(ByteBuffer.wrap(content))
                                                        .toString();
            return new DecodedText(strict, false);
        } catch (CharacterCodingException e) {
            return new DecodedText(new String(content, StandardCharsets.UTF_8), true);
        }
    }
}
