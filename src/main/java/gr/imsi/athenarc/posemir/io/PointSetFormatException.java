package gr.imsi.athenarc.posemir.io;

/**
 * Thrown when a file read as a point set or pattern does not hold valid points.
 */
public class PointSetFormatException extends IllegalArgumentException {

    public PointSetFormatException(String message) {
        super(message);
    }

    public PointSetFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
