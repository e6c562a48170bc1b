package org.dxworks.codedigest.analyzer.cobol.preprocessor;

import org.dxworks.codedigest.model.DiagnosticKind;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SourceDecoderTest {

    @Test
    void decodesUtf8WithoutDiagnostics() throws Exception {
        DecodedSource decoded = SourceDecoder.decode("MOVE A TO B.".getBytes(StandardCharsets.UTF_8), null);

        assertEquals("MOVE A TO B.", decoded.getText());
        assertEquals(StandardCharsets.UTF_8, decoded.getCharset());
        assertTrue(decoded.getDiagnostics().isEmpty());
    }

    @Test
    void honoursEncodingHint() throws Exception {
        byte[] latin = "CAFÉ".getBytes(StandardCharsets.ISO_8859_1);

        DecodedSource decoded = SourceDecoder.decode(latin, "ISO-8859-1");

        assertEquals("CAFÉ", decoded.getText());
        assertTrue(decoded.getDiagnostics().isEmpty());
    }

    @Test
    void unknownHintIsReportedAndFallbackChainUsed() throws Exception {
        DecodedSource decoded = SourceDecoder.decode("STOP RUN.".getBytes(StandardCharsets.US_ASCII), "no-such-charset");

        assertEquals("STOP RUN.", decoded.getText());
        assertEquals(1, decoded.getDiagnostics().size());
        assertEquals(DiagnosticKind.UNKNOWN_ENCODING_HINT, decoded.getDiagnostics().get(0).getKind());
    }

    @Test
    void invalidUtf8FallsBackToLatin1() throws Exception {
        DecodedSource decoded = SourceDecoder.decode(new byte[]{'A', (byte) 0xE9}, null);

        assertEquals("Aé", decoded.getText());
        assertEquals(StandardCharsets.ISO_8859_1, decoded.getCharset());
        assertEquals(DiagnosticKind.ENCODING_FALLBACK, decoded.getDiagnostics().get(0).getKind());
    }

    @Test
    void c1BytesAreLeftToWindows1252() throws Exception {
        DecodedSource decoded = SourceDecoder.decode(new byte[]{'A', (byte) 0x80}, null);

        assertEquals("A€", decoded.getText());
        assertEquals("windows-1252", decoded.getCharset().name());
    }

    @Test
    void hintedLatin1IsTakenEvenWithC1Bytes() throws Exception {
        DecodedSource decoded = SourceDecoder.decode(new byte[]{'A', (byte) 0x80}, "ISO-8859-1");

        assertEquals("A\u0080", decoded.getText());
        assertEquals(StandardCharsets.ISO_8859_1, decoded.getCharset());
        assertTrue(decoded.getDiagnostics().isEmpty());
    }

    @Test
    void byteOrderMarkIsDropped() throws Exception {
        DecodedSource decoded = SourceDecoder.decode(new byte[]{(byte) 0xEF, (byte) 0xBB, (byte) 0xBF, 'A'}, null);

        assertEquals("A", decoded.getText());
    }

    @Test
    void latin1KeepsBytesThatWindows1252CannotMap() throws Exception {
        // 0x81 is malformed UTF-8 and unmapped in windows-1252
        DecodedSource decoded = SourceDecoder.decode(new byte[]{'A', ' ', (byte) 0xE9, (byte) 0x81}, null);

        assertEquals("A \u00E9\u0081", decoded.getText());
        assertEquals(StandardCharsets.ISO_8859_1, decoded.getCharset());
        assertEquals(1, decoded.getDiagnostics().size());
        assertEquals(DiagnosticKind.ENCODING_FALLBACK, decoded.getDiagnostics().get(0).getKind());
        assertEquals("Could not decode as UTF-8, decoded as ISO-8859-1", decoded.getDiagnostics().get(0).getMessage());
    }

    @Test
    void hintedCharsetThatFailsFallsThroughTheChain() throws Exception {
        DecodedSource decoded = SourceDecoder.decode(new byte[]{'A', (byte) 0x81}, "US-ASCII");

        assertEquals(StandardCharsets.ISO_8859_1, decoded.getCharset());
        assertEquals("Could not decode as US-ASCII, decoded as ISO-8859-1", decoded.getDiagnostics().get(0).getMessage());
    }
}
