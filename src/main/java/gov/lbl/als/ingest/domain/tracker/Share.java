package gov.lbl.als.ingest.domain.tracker;

/**
 * Storage location known to the Tracker. Dataset instance paths are interpreted relative to it.
 *
 * @param slug identifier the ingester is configured with (for example {@code als-beegfs})
 * @param name display name
 */
public record Share(String slug, String name) {}
