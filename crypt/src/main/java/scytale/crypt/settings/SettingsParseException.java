/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt.settings;

import java.io.Serial;

/**
 * Thrown when a textual cipher description cannot be parsed: a line that is neither a header,
 * a {@code key=value} pair nor the end marker, a repeated or missing field, or a value of the
 * wrong form.
 *
 * @see CipherSettings
 */
public class SettingsParseException extends Exception {
    @Serial
    private static final long serialVersionUID = -1;

    /**
     * Constructs a new exception wrapping the failure that made the settings unusable.
     *
     * @param e the underlying exception
     */
    public SettingsParseException(Exception e) {
        super(e);
    }

    /**
     * Constructs a new exception with a detail message.
     *
     * @param msg the detail message
     */
    public SettingsParseException(String msg) {
        super(msg);
    }

    /**
     * Constructs a new exception for a numeric field that could not be parsed.
     *
     * @param msg the detail message
     * @param e   the parse failure
     */
    public SettingsParseException(String msg, NumberFormatException e) {
        super(msg + " : " + e);
        initCause(e);
    }
}
