/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt;

import org.junit.jupiter.api.Test;
import scytale.crypt.key.EmptyKey;
import scytale.crypt.key.KeywordKey;
import scytale.crypt.key.RailKey;

import static org.junit.jupiter.api.Assertions.*;

class CipherTypeTest {

    @Test
    void testFromName() {
        assertEquals(CipherType.RAIL_FENCE, CipherType.fromName("rail-fence"));
        assertEquals(CipherType.RAIL_FENCE, CipherType.fromName("Rail Fence"));
        assertEquals(CipherType.VIGENERE, CipherType.fromName(" vigenere "));
        for (CipherType type : CipherType.values()) {
            assertEquals(type, CipherType.fromName(type.name()));
        }
        assertThrows(InvalidCipherParameterException.class, () -> CipherType.fromName("enigma"));
    }

    @Test
    void testProperties() {
        assertTrue(CipherType.ATBASH.reciprocal);
        assertTrue(CipherType.BEAUFORT.reciprocal);
        assertFalse(CipherType.VIGENERE.reciprocal);
        assertEquals(CipherType.Family.POLYGRAPHIC, CipherType.HILL.family);
        assertEquals(CipherType.Family.TRANSPOSITION, CipherType.MYSZKOWSKI.family);
        assertTrue(CipherType.ROUTE.padded);
        assertFalse(CipherType.AUTOKEY.padded);
    }

    @Test
    void testAccepts() {
        assertTrue(CipherType.ATBASH.accepts(EmptyKey.INSTANCE));
        assertTrue(CipherType.MYSZKOWSKI.accepts(new KeywordKey("KEY")));
        assertFalse(CipherType.RAIL_FENCE.accepts(new KeywordKey("KEY")));
        assertFalse(CipherType.VIGENERE.accepts(new RailKey(2)));
        assertFalse(CipherType.VIGENERE.accepts(null));
    }
}
