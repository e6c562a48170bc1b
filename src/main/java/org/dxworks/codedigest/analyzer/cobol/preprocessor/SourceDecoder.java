package org.dxworks.codedigest.analyzer.cobol.preprocessor;

import org.dxworks.codedigest.model.Diagnostic;
import org.dxworks.codedigest.model.DiagnosticKind;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Decodes legacy source bytes. Tries the hinted charset, then UTF-8, ISO-8859-1 and windows-1252,
 * each strictly (malformed input rejects the charset instead of being replaced).
 * <p>
 * ISO-8859-1 maps every byte, so unless it is the hint it is only accepted at once when the
 * result holds no C1 control characters; files carrying 0x80-0x9F bytes are left to windows-1252.
 * When windows-1252 rejects them too (0x81, 0x8D, 0x8F, 0x90, 0x9D are unmapped there), the
 * ISO-8859-1 text is used after all.
 */
public final class SourceDecoder {

    private static final char BOM = '\uFEFF';

    private SourceDecoder() {
    }

    public static DecodedSource decode(byte[] bytes, String encodingHint) throws SourceDecodingException {
        List<Diagnostic> diagnostics = new ArrayList<>();
        List<Charset> chain = fallbackChain(encodingHint, diagnostics);

        Charset first = chain.get(0);
        String latin1WithControls = null;
        for (Charset charset : chain) {
            String text = tryDecode(bytes, charset);
            if (text == null) {
                continue;
            }
            if (StandardCharsets.ISO_8859_1.equals(charset) && !charset.equals(first) && containsC1Controls(text)) {
                latin1WithControls = text;
                continue;
            }
            return decoded(text, charset, first, diagnostics);
        }
        if (latin1WithControls != null) {
            return decoded(latin1WithControls, StandardCharsets.ISO_8859_1, first, diagnostics);
        }

        throw new SourceDecodingException("Source is not valid in any of " + names(chain));
    }

    private static DecodedSource decoded(String text, Charset charset, Charset first, List<Diagnostic> diagnostics) {
        if (!charset.equals(first)) {
            diagnostics.add(new Diagnostic(DiagnosticKind.ENCODING_FALLBACK, 0,
                    "Could not decode as " + first.name() + ", decoded as " + charset.name()));
        }
        if (!text.isEmpty() && text.charAt(0) == BOM) {
            text = text.substring(1);
        }
        return new DecodedSource(text, charset, diagnostics);
    }

    static List<Charset> fallbackChain(String encodingHint, List<Diagnostic> diagnostics) {
        Set<Charset> chain = new LinkedHashSet<>();
        if (encodingHint != null && !encodingHint.isBlank()) {
            try {
                chain.add(Charset.forName(encodingHint.trim()));
            } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                diagnostics.add(new Diagnostic(DiagnosticKind.UNKNOWN_ENCODING_HINT, 0,
                        "Unknown encoding hint '" + encodingHint + "', using fallback chain"));
            }
        }
        chain.add(StandardCharsets.UTF_8);
        chain.add(StandardCharsets.ISO_8859_1);
        if (Charset.isSupported("windows-1252")) {
            chain.add(Charset.forName("windows-1252"));
        }
        return new ArrayList<>(chain);
    }

    private static String tryDecode(byte[] bytes, Charset charset) {
        CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            CharBuffer decoded = decoder.decode(ByteBuffer.wrap(bytes));
            return decoded.toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }

    private static boolean containsC1Controls(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c >= '\u0080' && c <= '\u009F') {
                return true;
            }
        }
        return false;
    }

    private static String names(List<Charset> chain) {
        List<String> names = new ArrayList<>();
        for (Charset charset : chain) {
            names.add(charset.name());
        }
        return String.join(", ", names);
    }
}
