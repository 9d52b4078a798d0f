/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt;

import java.io.Serial;

/**
 * Base class of the failures a cipher reports for a key or parameter it cannot work with.
 * <p>
 * Failures are deterministic: the same input always fails the same way, and no partial result
 * is ever produced.
 */
public abstract class CipherException extends IllegalArgumentException {
    @Serial
    private static final long serialVersionUID = -1;

    protected CipherException(String message) {
        super(message);
    }

    protected CipherException(String message, Throwable cause) {
        super(message, cause);
    }
}
