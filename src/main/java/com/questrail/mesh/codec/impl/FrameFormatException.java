package com.questrail.mesh.codec.impl;

/**
 * Raised internally when a frame violates {@link MeshFrameLayout}.
 * Never escapes the codec; the decoder turns it into a dropped frame.
 */
final class FrameFormatException extends Exception
{
    FrameFormatException(String message) {
        super(message);
    }
}
