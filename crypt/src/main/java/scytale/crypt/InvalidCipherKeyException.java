/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt;

import java.io.Serial;

/**
 * Thrown when a key cannot be used by a cipher, for example an Affine multiplier that shares a
 * factor with 26, or a Hill matrix whose determinant has no inverse modulo 26.
 */
public class InvalidCipherKeyException extends CipherException {
    @Serial
    private static final long serialVersionUID = -1;

    /**
     * Constructs a new exception with the given detail message.
     *
     * @param message why the key was rejected
     */
    public InvalidCipherKeyException(String message) {
        super(message);
    }
}
