package io.asyncly.core.journal;

import java.io.Serial;

/// Thrown when a journal being replayed does not match the computation it drives.
///
/// A mismatch means the journal was captured from a different computation, or the
/// computation is not deterministic up to its recorded effects.
public class JournalReplayException extends Exception {

    @Serial private static final long serialVersionUID = 4810362911405720153L;

    public JournalReplayException(String message) {
        super(message);
    }
}
