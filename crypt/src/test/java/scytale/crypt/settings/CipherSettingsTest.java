/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt.settings;

import org.junit.jupiter.api.Test;
import scytale.crypt.CipherSpec;
import scytale.crypt.Ciphers;
import scytale.crypt.CipherType;
import scytale.crypt.InvalidCipherKeyException;
import scytale.crypt.key.AffineKey;
import scytale.crypt.key.EmptyKey;
import scytale.crypt.key.KeywordKey;
import scytale.crypt.key.MatrixKey;
import scytale.crypt.key.RailKey;
import scytale.crypt.key.RouteKey;
import scytale.crypt.key.ShiftKey;
import scytale.crypt.transposition.RoutePattern;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CipherSettingsTest {

    @Test
    void testParseHill() throws SettingsParseException {
        CipherSettings settings = CipherSettings.parse(
            "# Hill example\n" +
            "# second header\n" +
            "Cipher=HILL\n" +
            "Matrix=2,1;3,4\n" +
            "End\n");
        assertEquals(List.of("Hill example", "second header"), settings.getHeaders());
        assertEquals("End", settings.getEndMarker());
        assertEquals("2,1;3,4", settings.get(CipherSettings.MATRIX));

        CipherSpec spec = settings.toSpec();
        assertEquals(CipherType.HILL, spec.type());
        assertEquals(new MatrixKey(new int[][]{{2, 1}, {3, 4}}), spec.key());
    }

    @Test
    void testParseEachCipher() throws SettingsParseException {
        assertEquals(new CipherSpec(CipherType.CAESAR, new ShiftKey(3)),
                     CipherSettings.parse("Cipher=caesar\nShift=3").toSpec());
        assertEquals(new CipherSpec(CipherType.AFFINE, new AffineKey(5, 8)),
                     CipherSettings.parse("Cipher=AFFINE\nA=5\nB=8\n").toSpec());
        assertEquals(new CipherSpec(CipherType.ATBASH, EmptyKey.INSTANCE),
                     CipherSettings.parse("Cipher=Atbash\n").toSpec());
        assertEquals(new CipherSpec(CipherType.AUTOKEY, new KeywordKey("QUEEN")),
                     CipherSettings.parse("Cipher=autokey\nKeyword=QUEEN\n").toSpec());
        assertEquals(new CipherSpec(CipherType.RAIL_FENCE, new RailKey(3)),
                     CipherSettings.parse("Cipher=rail-fence\nRails= 3 \n").toSpec());
        assertEquals(new CipherSpec(CipherType.ROUTE, new RouteKey(3, 4, RoutePattern.SNAKE)),
                     CipherSettings.parse("Cipher=ROUTE\nRows=3\nCols=4\nPattern=snake\n")
                                   .toSpec());
    }

    @Test
    void testDefaults() throws SettingsParseException {
        assertEquals(new ShiftKey(ShiftKey.DEFAULT_AUGUST_SHIFT),
                     CipherSettings.parse("Cipher=AUGUST\n").toSpec().key());
        assertEquals(new RouteKey(3, 4, RoutePattern.SPIRAL_IN),
                     CipherSettings.parse("Cipher=ROUTE\nRows=3\nCols=4\n").toSpec().key());
    }

    @Test
    void testUnknownFieldsAreIgnored() throws SettingsParseException {
        CipherSettings settings = CipherSettings.parse("Cipher=CAESAR\nColour=blue\nShift=1\n");
        assertNull(settings.get("Colour"));
        assertEquals(new ShiftKey(1), settings.toSpec().key());
    }

    @Test
    void testParsingStopsAtEndMarker() throws SettingsParseException {
        CipherSettings settings = CipherSettings.parse("Cipher=CAESAR\nShift=1\nEnd\nShift=2\n");
        assertEquals(1, settings.getInt(CipherSettings.SHIFT));
    }

    @Test
    void testCommentAfterFirstFieldIsSkipped() throws SettingsParseException {
        CipherSettings settings =
            CipherSettings.parse("# header\nCipher=CAESAR\n# not a header\nShift=4\nEnd\n");
        assertEquals(List.of("header"), settings.getHeaders());
        assertEquals(new CipherSpec(CipherType.CAESAR, new ShiftKey(4)), settings.toSpec());
    }

    @Test
    void testMalformedSettings() {
        assertThrows(SettingsParseException.class, () -> CipherSettings.parse(""));
        assertThrows(SettingsParseException.class, () -> CipherSettings.parse("  \n"));
        assertThrows(SettingsParseException.class,
                     () -> CipherSettings.parse("Cipher=CAESAR\nShift=1\nShift=2\n"));
        assertThrows(SettingsParseException.class,
                     () -> CipherSettings.parse("Shift=1\n").toSpec());
        assertThrows(SettingsParseException.class,
                     () -> CipherSettings.parse("Cipher=ENIGMA\n").toSpec());
        assertThrows(SettingsParseException.class,
                     () -> CipherSettings.parse("Cipher=CAESAR\n").toSpec());
        assertThrows(SettingsParseException.class,
                     () -> CipherSettings.parse("Cipher=ROUTE\nRows=3\nCols=4\nPattern=zigzag")
                                         .toSpec());
        assertThrows(SettingsParseException.class,
                     () -> CipherSettings.parse("Cipher=HILL\nMatrix=1,2;3\n").toSpec());
    }

    @Test
    void testNumberFormatCause() throws SettingsParseException {
        CipherSettings settings = CipherSettings.parse("Cipher=CAESAR\nShift=three\n");
        SettingsParseException e = assertThrows(SettingsParseException.class, settings::toSpec);
        assertInstanceOf(NumberFormatException.class, e.getCause());
        assertEquals(7, settings.getInt("Missing", 7));
    }

    @Test
    void testToOrderedString() {
        CipherSettings settings = CipherSettings.fromSpec(
            new CipherSpec(CipherType.ROUTE, new RouteKey(3, 4, RoutePattern.SPIRAL_OUT)));
        settings.addHeader("route");
        assertEquals("# route\nCipher=ROUTE\nCols=4\nPattern=spiral_out\nRows=3\nEnd\n",
                     settings.toOrderedString());
    }

    @Test
    void testWrittenSettingsParseBack() throws SettingsParseException {
        CipherSpec[] specs = {
            new CipherSpec(CipherType.HILL, new MatrixKey(new int[][]{{6, 24, 1}, {13, 16, 10},
                                                                    {20, 17, 15}})),
            new CipherSpec(CipherType.AFFINE, new AffineKey(-3, 7)),
            new CipherSpec(CipherType.MYSZKOWSKI, new KeywordKey("tomato")),
            new CipherSpec(CipherType.ATBASH, EmptyKey.INSTANCE)
        };
        for (CipherSpec spec : specs) {
            String text = CipherSettings.fromSpec(spec).toOrderedString();
            assertEquals(spec, CipherSettings.parse(text).toSpec(), text);
        }
    }

    @Test
    void testPutValidation() {
        CipherSettings settings = new CipherSettings();
        assertThrows(IllegalArgumentException.class, () -> settings.put("Keyword", "a\nb"));
        assertThrows(IllegalArgumentException.class, () -> settings.put("A=B", "c"));
        settings.put(CipherSettings.CIPHER, "BEAUFORT");
        settings.put(CipherSettings.KEYWORD, "FORTIFICATION");
        assertNull(settings.getEndMarker());
        assertEquals("Cipher=BEAUFORT\nKeyword=FORTIFICATION\n", settings.toOrderedString());
    }

    @Test
    void testKeyValidityIsLeftToTheCipher() throws SettingsParseException {
        CipherSpec spec = CipherSettings.parse("Cipher=AFFINE\nA=2\nB=1\n").toSpec();
        assertThrows(InvalidCipherKeyException.class,
                     () -> Ciphers.encrypt(spec, "HELLO"));
    }
}
