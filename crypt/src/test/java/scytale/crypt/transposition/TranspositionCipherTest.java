/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt.transposition;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;
import scytale.crypt.CipherResult;
import scytale.crypt.InvalidCipherKeyException;
import scytale.crypt.InvalidCipherParameterException;
import scytale.crypt.key.KeywordKey;
import scytale.crypt.key.RailKey;
import scytale.crypt.key.RouteKey;

import static org.junit.jupiter.api.Assertions.*;

class TranspositionCipherTest {
    private static final String SAMPLE = "We are discovered, flee at once!";

    private final RailFenceCipher railFence = new RailFenceCipher();
    private final RouteCipher route = new RouteCipher();
    private final MyszkowskiCipher myszkowski = new MyszkowskiCipher();

    @Test
    void testRailFenceKnownAnswer() {
        assertEquals("HOLELWRDLO", railFence.encrypt("HELLO WORLD", new RailKey(3)));
        assertEquals("HELLOWORLD", railFence.decrypt("HOLELWRDLO", new RailKey(3)));
        assertEquals("WECRLTEERDSOEEFEAOCAIVDEN",
                     railFence.encrypt("WE ARE DISCOVERED. FLEE AT ONCE", new RailKey(3)));
    }

    @Test
    void testRailFenceNeverPads() {
        CipherResult result = railFence.encryptWithPadding(SAMPLE, new RailKey(4));
        assertEquals(0, result.padding());
        assertEquals("WEAREDISCOVEREDFLEEATONCE", railFence.decrypt(result, new RailKey(4)));
    }

    @Test
    void testRailFenceRailBounds() {
        assertThrows(InvalidCipherParameterException.class,
                     () -> railFence.encrypt("HELLO", new RailKey(1)));
        assertThrows(InvalidCipherParameterException.class,
                     () -> railFence.encrypt("HELLO", new RailKey(6)));
        assertThrows(InvalidCipherParameterException.class,
                     () -> railFence.decrypt("HELLO", new RailKey(0)));
        assertEquals("HLOEL", railFence.encrypt("HELLO", new RailKey(2)));
        assertEquals("HELLO", railFence.encrypt("HELLO", new RailKey(5)));
    }

    @ParameterizedTest(name = "{0}")
    @CsvSource({
        "spiral_in, HELLRXXDLOWO",
        "spiral_out, OWOLDXXRLLEH",
        "snake, HELLROWOLDXX",
        "diagonal, HEOLWLLODRXX"
    })
    void testRouteKnownAnswers(String patternName, String expected) {
        RouteKey key = new RouteKey(3, 4, RoutePattern.fromName(patternName));
        CipherResult result = route.encryptWithPadding("HELLO WORLD", key);
        assertEquals(expected, result.text());
        assertEquals(2, result.padding());
        assertEquals("HELLOWORLDXX", route.decrypt(expected, key));
        assertEquals("HELLOWORLD", route.decrypt(result, key));
    }

    @ParameterizedTest(name = "{0}")
    @EnumSource(RoutePattern.class)
    void testRouteRoundTrip(RoutePattern pattern) {
        RouteKey key = new RouteKey(5, 5, pattern);
        CipherResult result = route.encryptWithPadding(SAMPLE, key);
        assertEquals("WEAREDISCOVEREDFLEEATONCE", route.decrypt(result, key));
    }

    @Test
    void testRouteDefaultsToSpiralIn() {
        assertEquals(RoutePattern.SPIRAL_IN, new RouteKey(3, 4).pattern());
        assertEquals("HELLRXXDLOWO", route.encrypt("hello world", new RouteKey(3, 4)));
    }

    @Test
    void testRouteValidation() {
        assertThrows(InvalidCipherParameterException.class,
                     () -> route.encrypt("HELLO", new RouteKey(0, 4)));
        assertThrows(InvalidCipherParameterException.class,
                     () -> route.encrypt("HELLO", new RouteKey(2, -1)));
        assertThrows(InvalidCipherParameterException.class,
                     () -> route.encrypt("HELLO WORLD", new RouteKey(2, 2)));
        assertThrows(InvalidCipherParameterException.class,
                     () -> route.decrypt("HELLO", new RouteKey(2, 3)));
        assertThrows(NullPointerException.class, () -> new RouteKey(2, 2, null));
    }

    @Test
    void testMyszkowskiKnownAnswers() {
        assertEquals("OXLLERLDWXHO", myszkowski.encrypt("HELLO WORLD", new KeywordKey("ZEBRAS")));
        assertEquals("ROXACDESEDEXWIREVX",
                     myszkowski.encrypt("WEAREDISCOVERED", new KeywordKey("TOMATO")));
        assertEquals("WEAREDISCOVEREDXXX",
                     myszkowski.decrypt("ROXACDESEDEXWIREVX", new KeywordKey("tomato")));
    }

    @Test
    void testMyszkowskiRoundTripWithPadding() {
        KeywordKey key = new KeywordKey("BALLOON");
        CipherResult result = myszkowski.encryptWithPadding(SAMPLE, key);
        assertEquals(3, result.padding());
        assertEquals("WEAREDISCOVEREDFLEEATONCE", myszkowski.decrypt(result, key));
    }

    @Test
    void testMyszkowskiValidation() {
        assertThrows(InvalidCipherKeyException.class,
                     () -> myszkowski.encrypt("HELLO", new KeywordKey("")));
        assertThrows(InvalidCipherParameterException.class,
                     () -> myszkowski.decrypt("HELLO", new KeywordKey("KEY")));
    }

    @Test
    void testDigitsAreKept() {
        assertEquals("A1C2B3", railFence.decrypt(railFence.encrypt("a1 c2 b3", new RailKey(2)),
                                                 new RailKey(2)));
    }
}
