/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt;

import java.io.Serial;

/**
 * Thrown when a cipher parameter or the shape of the input does not fit the cipher: a rail
 * count out of range, an unknown route pattern, grid dimensions that do not match the
 * ciphertext, and similar.
 */
public class InvalidCipherParameterException extends CipherException {
    @Serial
    private static final long serialVersionUID = -1;

    /**
     * Constructs a new exception with the given detail message.
     *
     * @param message why the parameter was rejected
     */
    public InvalidCipherParameterException(String message) {
        super(message);
    }

    /**
     * Constructs a new exception with the given detail message and cause.
     *
     * @param message why the parameter was rejected
     * @param cause   the underlying failure
     */
    public InvalidCipherParameterException(String message, Throwable cause) {
        super(message, cause);
    }
}
