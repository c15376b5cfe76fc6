package org.pixelforge.processing;

import org.pixelforge.metrics.ErrorKind;

public class EncodeException extends ImageProcessingException {

    public EncodeException(final String message) {
        this(message, null);
    }

    public EncodeException(final String message, final Throwable cause) {
        super(ErrorKind.ENCODE, message, cause);
    }
}
