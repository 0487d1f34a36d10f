package de.upb.sse.jsweep.model;

/**
 * Reads fresh snapshots of a project. Every call re-reads the sources, so identities and
 * reference data never leak from one pass into the next.
 */
public interface CodeModelProvider {

    /**
     * @throws de.upb.sse.jsweep.exceptions.ModelReadException if the sources cannot be read
     */
    CodeModel read(CleanupScope scope);
}
