package org.pixelforge.processing;

import org.pixelforge.metrics.ErrorKind;

public class TransformException extends ImageProcessingException {

    public TransformException(final String message) {
        this(message, null);
    }

    public TransformException(final String message, final Throwable cause) {
        super(ErrorKind.TRANSFORM, message, cause);
    }
}
