package org.pixelforge.processing;

import org.pixelforge.metrics.ErrorKind;

/**
 * The file is missing, unreadable, or not an image container ImageIO recognizes.
 */
public class DecodeException extends ImageProcessingException {

    public DecodeException(final String message) {
        this(message, null);
    }

    public DecodeException(final String message, final Throwable cause) {
        super(ErrorKind.DECODE, message, cause);
    }
}
