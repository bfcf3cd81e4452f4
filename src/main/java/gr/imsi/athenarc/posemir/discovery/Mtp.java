package gr.imsi.athenarc.posemir.discovery;

import gr.imsi.athenarc.posemir.domain.Pattern;
import gr.imsi.athenarc.posemir.domain.Vector;

/**
 * Maximal translatable pattern: the points of a point set that the vector maps onto other points
 * of the same set. Only lives while TECs are being computed.
 */
public class Mtp {

    private final Vector vector;
    private final Pattern pattern;

    public Mtp(Vector vector, Pattern pattern) {
        this.vector = vector;
        this.pattern = pattern;
    }

    public Vector getVector() {
        return vector;
    }

    public Pattern getPattern() {
        return pattern;
    }

    @Override
    public String toString() {
        return "MTP" + vector + ": " + pattern.size() + " points";
    }
}
