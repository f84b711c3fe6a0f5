package im.arun.treebinder.model;

import lombok.Value;

/**
 * Opaque tree node identity. The session number ties an id to the surface
 * that issued it; the serial is never reused within that surface.
 */
@Value
public class NodeId {
    long session;
    long serial;

    @Override
    public String toString() {
        return session + ":" + serial;
    }
}
